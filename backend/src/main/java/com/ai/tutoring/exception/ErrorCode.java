package com.ai.tutoring.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Machine-readable error codes returned in the {@code errorCode} field of
 * every error response.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Lifecycle / cancellation
    INVALID_TRANSITION(HttpStatus.CONFLICT),
    SLOT_CONFLICT(HttpStatus.CONFLICT),
    NOT_SCHEDULED(HttpStatus.CONFLICT),
    ALREADY_REQUESTED(HttpStatus.CONFLICT),
    NO_PENDING_REQUEST(HttpStatus.CONFLICT),
    SELF_REQUEST_CONFLICT(HttpStatus.CONFLICT),

    // Lesson report pipeline
    NOT_STARTED(HttpStatus.CONFLICT),
    NOT_COMPLETED(HttpStatus.CONFLICT),
    MISSING_NOTES(HttpStatus.BAD_REQUEST),
    NOTES_ALREADY_ATTACHED(HttpStatus.CONFLICT),
    SUMMARY_ALREADY_ATTACHED(HttpStatus.CONFLICT),
    SUMMARY_MISSING(HttpStatus.CONFLICT),
    IMMUTABLE_QUIZ(HttpStatus.CONFLICT),
    INCOMPLETE_SUBMISSION(HttpStatus.BAD_REQUEST),

    // Infrastructure
    CONCURRENT_MODIFICATION(HttpStatus.CONFLICT),
    GENERATION_FAILED(HttpStatus.BAD_GATEWAY),
    QUIZ_GENERATION_FAILED(HttpStatus.BAD_GATEWAY),

    SESSION_NOT_FOUND(HttpStatus.NOT_FOUND),
    QUIZ_NOT_FOUND(HttpStatus.NOT_FOUND);

    private final HttpStatus status;
}
