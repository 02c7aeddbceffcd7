package com.ryuqq.moderation.core.exception;

/**
 * A bus payload does not match the task or dead-letter schema. Permanent.
 */
public class MalformedMessageException extends ModerationException {

    public MalformedMessageException(String message) {
        super(ErrorType.MALFORMED_MESSAGE, message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(ErrorType.MALFORMED_MESSAGE, message, cause);
    }
}
