package com.ai.tutoring.exception;

/**
 * The AI provider was unreachable, timed out, or returned output that failed
 * validation. Nothing has been persisted when this is thrown.
 */
public class GenerationFailedException extends TutoringException {

    public GenerationFailedException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public GenerationFailedException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
