package com.ai.tutoring.exception;

public class ResourceNotFoundException extends TutoringException {

    public ResourceNotFoundException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static ResourceNotFoundException session(String sessionId) {
        return new ResourceNotFoundException(ErrorCode.SESSION_NOT_FOUND, "Session not found: " + sessionId);
    }

    public static ResourceNotFoundException quiz(String sessionId) {
        return new ResourceNotFoundException(ErrorCode.QUIZ_NOT_FOUND, "Quiz not found for session: " + sessionId);
    }
}
