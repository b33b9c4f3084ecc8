package com.ai.tutoring.exception;

/**
 * Request payload does not satisfy the operation's contract
 * (e.g. an answer map that does not cover every question).
 */
public class ContractViolationException extends TutoringException {

    public ContractViolationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
