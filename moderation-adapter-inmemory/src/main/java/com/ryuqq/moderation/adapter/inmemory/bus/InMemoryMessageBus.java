package com.ryuqq.moderation.adapter.inmemory.bus;

import com.ryuqq.moderation.core.spi.AckHandle;
import com.ryuqq.moderation.core.spi.Delivery;
import com.ryuqq.moderation.core.spi.MessageBus;
import com.ryuqq.moderation.core.spi.Topic;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link MessageBus} SPI for testing and reference purposes.
 *
 * <p>This implementation provides thread-safe topic queues using {@link DelayQueue}
 * for delayed delivery and visibility timeout simulation.</p>
 *
 * <p><strong>Architecture (per topic):</strong></p>
 * <ul>
 *   <li><strong>Queue:</strong> DelayQueue&lt;DelayedMessage&gt; - Delayed delivery ordered by availability time, FIFO on ties</li>
 *   <li><strong>In-Flight Tracking:</strong> ConcurrentHashMap&lt;Long, InFlightMessage&gt; - keyed by delivery tag</li>
 * </ul>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Delayed delivery (publishDelayed)</li>
 *   <li>Visibility timeout (30 seconds default); expired in-flight messages are reclaimed on every consume</li>
 *   <li>At-least-once delivery with a per-message delivery count</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * MessageBus bus = new InMemoryMessageBus();
 * bus.publish(Topic.of("moderation"), payload);
 *
 * Optional&lt;Delivery&gt; delivery = bus.consume(Topic.of("moderation"), Duration.ofSeconds(1));
 * delivery.ifPresent(d -&gt; bus.ack(d.handle()));
 * </pre>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public class InMemoryMessageBus implements MessageBus {

    /**
     * Default visibility timeout: 30 seconds.
     */
    private static final long DEFAULT_VISIBILITY_TIMEOUT_MS = 30_000L;

    private final ConcurrentHashMap<Topic, TopicQueue> topics;
    private final AtomicLong deliveryTags;
    private final AtomicLong sequence;
    private final long visibilityTimeoutMs;

    /**
     * Creates a new InMemoryMessageBus with default visibility timeout (30 seconds).
     */
    public InMemoryMessageBus() {
        this(DEFAULT_VISIBILITY_TIMEOUT_MS);
    }

    /**
     * Creates a new InMemoryMessageBus with custom visibility timeout.
     *
     * @param visibilityTimeoutMs visibility timeout in milliseconds
     * @throws IllegalArgumentException if visibilityTimeoutMs is not positive
     */
    public InMemoryMessageBus(long visibilityTimeoutMs) {
        if (visibilityTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "visibilityTimeoutMs must be positive (current: " + visibilityTimeoutMs + ")");
        }
        this.topics = new ConcurrentHashMap<>();
        this.deliveryTags = new AtomicLong();
        this.sequence = new AtomicLong();
        this.visibilityTimeoutMs = visibilityTimeoutMs;
    }

    @Override
    public void publish(Topic topic, String payload) {
        publishDelayed(topic, payload, Duration.ZERO);
    }

    @Override
    public void publishDelayed(Topic topic, String payload, Duration delay) {
        if (topic == null) {
            throw new IllegalArgumentException("topic cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay cannot be null or negative (current: " + delay + ")");
        }

        enqueue(topic, payload, 0, delay.toMillis());
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Reclaims expired in-flight messages of the topic before polling</li>
     *   <li>Blocks on {@link DelayQueue#poll(long, TimeUnit)} up to the timeout</li>
     *   <li>Visibility timeout starts immediately upon delivery</li>
     * </ul>
     */
    @Override
    public Optional<Delivery> consume(Topic topic, Duration timeout) throws InterruptedException {
        if (topic == null) {
            throw new IllegalArgumentException("topic cannot be null");
        }
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be null or negative (current: " + timeout + ")");
        }

        TopicQueue topicQueue = queueOf(topic);
        reclaimExpired(topic, topicQueue, System.currentTimeMillis());

        DelayedMessage message = timeout.isZero()
            ? topicQueue.queue.poll()
            : topicQueue.queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (message == null) {
            return Optional.empty();
        }

        long tag = deliveryTags.incrementAndGet();
        int deliveryCount = message.deliveryCount + 1;
        topicQueue.inFlight.put(tag, new InFlightMessage(message.payload, deliveryCount,
            System.currentTimeMillis() + visibilityTimeoutMs));
        return Optional.of(new Delivery(topic, message.payload, new AckHandle(topic, tag), deliveryCount));
    }

    /**
     * {@inheritDoc}
     *
     * <p>Idempotent: acknowledging an unknown or already settled handle is a no-op.</p>
     */
    @Override
    public void ack(AckHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        queueOf(handle.topic()).inFlight.remove(handle.deliveryTag());
    }

    /**
     * {@inheritDoc}
     *
     * <p>Re-publishes the message with zero delay. A handle that is no longer in flight is ignored.</p>
     */
    @Override
    public void nack(AckHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        InFlightMessage message = queueOf(handle.topic()).inFlight.remove(handle.deliveryTag());
        if (message != null) {
            enqueue(handle.topic(), message.payload, message.deliveryCount, 0);
        }
    }

    /**
     * Forces every in-flight message of a topic back to its queue, as if the consumer died. Used for testing.
     *
     * @param topic topic
     * @return number of messages returned
     */
    public int expireVisibilityTimeouts(Topic topic) {
        return reclaimExpired(topic, queueOf(topic), Long.MAX_VALUE);
    }

    /**
     * Makes every delayed message of a topic visible now. Used for testing.
     *
     * @param topic topic
     * @return number of messages whose delay was cut short
     */
    public int expireDelays(Topic topic) {
        TopicQueue topicQueue = queueOf(topic);
        int count = 0;
        for (DelayedMessage message : topicQueue.queue.toArray(new DelayedMessage[0])) {
            if (topicQueue.queue.remove(message)) {
                topicQueue.queue.put(new DelayedMessage(message.payload, message.deliveryCount,
                    System.currentTimeMillis(), message.sequence, message.delayMs));
                count++;
            }
        }
        return count;
    }

    /**
     * Snapshot of queued (not in-flight) messages, in availability order. Used for test assertions.
     *
     * @param topic topic
     * @return queued messages
     */
    public List<QueuedMessage> queuedMessages(Topic topic) {
        List<DelayedMessage> snapshot = new ArrayList<>(List.of(queueOf(topic).queue.toArray(new DelayedMessage[0])));
        snapshot.sort(Comparator.naturalOrder());
        return snapshot.stream()
            .map(m -> new QueuedMessage(m.payload, Duration.ofMillis(m.delayMs), m.deliveryCount))
            .toList();
    }

    /**
     * Returns the number of queued (not in-flight) messages of a topic. Used for test assertions.
     *
     * @param topic topic
     * @return queue size
     */
    public int queueSize(Topic topic) {
        return queueOf(topic).queue.size();
    }

    /**
     * Returns the number of in-flight messages of a topic. Used for test assertions.
     *
     * @param topic topic
     * @return in-flight count
     */
    public int inFlightSize(Topic topic) {
        return queueOf(topic).inFlight.size();
    }

    /**
     * Clears all topics. Used for test cleanup.
     */
    public void clear() {
        topics.clear();
    }

    private void enqueue(Topic topic, String payload, int deliveryCount, long delayMs) {
        queueOf(topic).queue.put(new DelayedMessage(payload, deliveryCount,
            System.currentTimeMillis() + delayMs, sequence.incrementAndGet(), delayMs));
    }

    private int reclaimExpired(Topic topic, TopicQueue topicQueue, long now) {
        int count = 0;
        for (var entry : topicQueue.inFlight.entrySet()) {
            if (entry.getValue().visibleAt <= now && topicQueue.inFlight.remove(entry.getKey(), entry.getValue())) {
                enqueue(topic, entry.getValue().payload, entry.getValue().deliveryCount, 0);
                count++;
            }
        }
        return count;
    }

    private TopicQueue queueOf(Topic topic) {
        return topics.computeIfAbsent(topic, t -> new TopicQueue());
    }

    /**
     * A message waiting in a topic queue. Used for test assertions.
     *
     * @param payload message payload
     * @param requestedDelay delay requested at publish time
     * @param previousDeliveries how many times the message was delivered before
     */
    public record QueuedMessage(String payload, Duration requestedDelay, int previousDeliveries) {
    }

    private static final class TopicQueue {
        private final DelayQueue<DelayedMessage> queue = new DelayQueue<>();
        private final ConcurrentHashMap<Long, InFlightMessage> inFlight = new ConcurrentHashMap<>();
    }

    /**
     * Internal class representing a delayed message in the queue.
     *
     * <ul>
     *   <li>availableAt = publish time + delay</li>
     *   <li>Messages with delay &lt;= 0 are immediately available</li>
     * </ul>
     */
    private static final class DelayedMessage implements Delayed {
        private final String payload;
        private final int deliveryCount;
        private final long availableAt;
        private final long sequence;
        private final long delayMs;

        DelayedMessage(String payload, int deliveryCount, long availableAt, long sequence, long delayMs) {
            this.payload = payload;
            this.deliveryCount = deliveryCount;
            this.availableAt = availableAt;
            this.sequence = sequence;
            this.delayMs = delayMs;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            long diff = availableAt - System.currentTimeMillis();
            return unit.convert(diff, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            DelayedMessage that = (DelayedMessage) other;
            int byTime = Long.compare(this.availableAt, that.availableAt);
            return byTime != 0 ? byTime : Long.compare(this.sequence, that.sequence);
        }
    }

    private static final class InFlightMessage {
        private final String payload;
        private final int deliveryCount;
        private final long visibleAt;

        InFlightMessage(String payload, int deliveryCount, long visibleAt) {
            this.payload = payload;
            this.deliveryCount = deliveryCount;
            this.visibleAt = visibleAt;
        }
    }
}
