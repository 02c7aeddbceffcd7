package com.ryuqq.moderation.core.exception;

/**
 * Classification of pipeline failures.
 *
 * <p>Each type declares whether it is retryable. The retry policy only ever
 * consults this flag; it never inspects exception classes.</p>
 */
public enum ErrorType {

    /** Task payload could not be decoded or is missing required fields. */
    MALFORMED_MESSAGE(false),

    /** The item referenced by the task does not exist. */
    ITEM_NOT_FOUND(false),

    /** No result record exists for the task id (publish happened without write). */
    RESULT_NOT_FOUND(false),

    /** Model is loading, overloaded or otherwise temporarily unusable. */
    MODEL_UNAVAILABLE(true),

    /** Store, cache or bus could not be reached. */
    INFRASTRUCTURE(true),

    /** A collaborator threw something we did not classify. */
    UNEXPECTED(true),

    /** Derived: a retryable failure hit the retry limit. Never thrown. */
    EXHAUSTED_RETRIES(false);

    private final boolean retryable;

    ErrorType(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
