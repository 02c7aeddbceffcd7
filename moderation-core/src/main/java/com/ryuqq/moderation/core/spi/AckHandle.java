package com.ryuqq.moderation.core.spi;

/**
 * Opaque handle used to acknowledge one delivery.
 *
 * <p>A redelivered message gets a new handle; acknowledging a stale handle is a no-op.</p>
 *
 * @param topic topic the message was consumed from
 * @param deliveryTag bus-assigned tag, unique per delivery
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public record AckHandle(Topic topic, long deliveryTag) {

    public AckHandle {
        if (topic == null) {
            throw new IllegalArgumentException("topic cannot be null");
        }
        if (deliveryTag <= 0) {
            throw new IllegalArgumentException("deliveryTag must be positive (current: " + deliveryTag + ")");
        }
    }
}
