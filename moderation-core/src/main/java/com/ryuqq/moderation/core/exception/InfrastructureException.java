package com.ryuqq.moderation.core.exception;

/**
 * Result store, prediction cache or message bus unreachable. Transient.
 */
public class InfrastructureException extends ModerationException {

    public InfrastructureException(String message) {
        super(ErrorType.INFRASTRUCTURE, message);
    }

    public InfrastructureException(String message, Throwable cause) {
        super(ErrorType.INFRASTRUCTURE, message, cause);
    }
}
