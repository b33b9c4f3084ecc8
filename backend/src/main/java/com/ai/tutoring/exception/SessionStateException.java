package com.ai.tutoring.exception;

/**
 * Operation not allowed in the session's current lifecycle or cancellation state.
 */
public class SessionStateException extends TutoringException {

    public SessionStateException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
