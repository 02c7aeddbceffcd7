package com.ryuqq.moderation.core.exception;

/**
 * The moderation model cannot serve a prediction right now. Transient.
 */
public class ModelUnavailableException extends ModerationException {

    public ModelUnavailableException(String message) {
        super(ErrorType.MODEL_UNAVAILABLE, message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(ErrorType.MODEL_UNAVAILABLE, message, cause);
    }
}
