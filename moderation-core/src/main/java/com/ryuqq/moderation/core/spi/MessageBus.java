package com.ryuqq.moderation.core.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * Message bus SPI for task publication and consumption.
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Publishing payloads to a topic, immediately or after a delay</li>
 *   <li>Handing out one message at a time with a visibility timeout</li>
 *   <li>Acknowledging processed messages</li>
 *   <li>Negative acknowledging messages for immediate redelivery</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Idempotent: ack/nack of an already settled handle is a no-op</li>
 *   <li>At-least-once Delivery: an un-acked message becomes visible again after the visibility timeout</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * bus.publish(Topic.of("moderation"), payload);
 *
 * Optional&lt;Delivery&gt; delivery = bus.consume(Topic.of("moderation"), Duration.ofSeconds(1));
 * delivery.ifPresent(d -&gt; {
 *     process(d.payload());
 *     bus.ack(d.handle());
 * });
 * </pre>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public interface MessageBus {

    /**
     * Publishes a payload for immediate delivery.
     *
     * @param topic target topic
     * @param payload message payload
     * @throws IllegalArgumentException if topic or payload is null
     * @throws com.ryuqq.moderation.core.exception.InfrastructureException if the bus cannot accept the message
     */
    void publish(Topic topic, String payload);

    /**
     * Publishes a payload that becomes visible only after {@code delay}.
     *
     * @param topic target topic
     * @param payload message payload
     * @param delay delay before the message can be consumed (zero for immediate)
     * @throws IllegalArgumentException if an argument is null or delay is negative
     * @throws com.ryuqq.moderation.core.exception.InfrastructureException if the bus cannot accept the message
     */
    void publishDelayed(Topic topic, String payload, Duration delay);

    /**
     * Waits up to {@code timeout} for a visible message on the topic.
     *
     * <p>The returned message stays invisible to other consumers until it is
     * acked, nacked, or its visibility timeout expires.</p>
     *
     * @param topic topic to consume
     * @param timeout maximum wait (zero for a non-blocking poll)
     * @return the delivery, or empty if nothing became visible in time
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    Optional<Delivery> consume(Topic topic, Duration timeout) throws InterruptedException;

    /**
     * Acknowledges a delivery, removing the message permanently.
     *
     * @param handle handle from {@link Delivery#handle()}
     * @throws IllegalArgumentException if handle is null
     */
    void ack(AckHandle handle);

    /**
     * Returns an un-acked delivery to its topic for immediate redelivery.
     *
     * @param handle handle from {@link Delivery#handle()}
     * @throws IllegalArgumentException if handle is null
     */
    void nack(AckHandle handle);
}
