package com.ryuqq.moderation.core.exception;

/**
 * Base exception for classified pipeline failures.
 *
 * <p>Collaborators (item repository, model, store, bus) throw subclasses of this
 * exception; the worker converts them into outcomes and never lets them escape
 * a task boundary.</p>
 */
public abstract class ModerationException extends RuntimeException {

    private final ErrorType errorType;

    protected ModerationException(ErrorType errorType, String message) {
        super(message);
        this.errorType = requireType(errorType);
    }

    protected ModerationException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = requireType(errorType);
    }

    private static ErrorType requireType(ErrorType errorType) {
        if (errorType == null) {
            throw new IllegalArgumentException("errorType cannot be null");
        }
        return errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public boolean isRetryable() {
        return errorType.isRetryable();
    }
}
