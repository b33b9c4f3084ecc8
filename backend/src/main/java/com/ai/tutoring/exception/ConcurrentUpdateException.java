package com.ai.tutoring.exception;

/**
 * Optimistic write lost twice in a row.
 */
public class ConcurrentUpdateException extends TutoringException {

    public ConcurrentUpdateException(String message, Throwable cause) {
        super(ErrorCode.CONCURRENT_MODIFICATION, message, cause);
    }
}
