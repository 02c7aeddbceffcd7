package com.ryuqq.moderation.core.spi;

/**
 * A message handed to a consumer, not yet acknowledged.
 *
 * @param topic source topic
 * @param payload raw payload (JSON)
 * @param handle handle for ack / nack
 * @param deliveryCount how many times this message has been delivered (1 = first delivery)
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public record Delivery(Topic topic, String payload, AckHandle handle, int deliveryCount) {

    public Delivery {
        if (topic == null) {
            throw new IllegalArgumentException("topic cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (deliveryCount <= 0) {
            throw new IllegalArgumentException("deliveryCount must be positive (current: " + deliveryCount + ")");
        }
    }

    /**
     * Whether the bus has delivered this message before.
     *
     * @return true if deliveryCount &gt; 1
     */
    public boolean isRedelivery() {
        return deliveryCount > 1;
    }
}
