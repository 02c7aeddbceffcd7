package com.ryuqq.moderation.core.spi;

/**
 * Logical topic name on the message bus.
 *
 * @param name topic name (non-blank)
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public record Topic(String name) {

    public Topic {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }

    public static Topic of(String name) {
        return new Topic(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
