package com.ryuqq.moderation.adapter.runner.config;

/**
 * Exception for unreadable or invalid configuration.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
