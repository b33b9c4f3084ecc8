package com.ai.tutoring.exception;

import lombok.Getter;

/**
 * Base class of all domain failures. Each carries the {@link ErrorCode}
 * that {@link GlobalExceptionHandler} renders.
 */
@Getter
public abstract class TutoringException extends RuntimeException {

    private final ErrorCode errorCode;

    protected TutoringException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected TutoringException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
