package com.ai.tutoring.exception;

/**
 * Thrown when regenerating a quiz that already has graded attempts.
 */
public class ImmutableQuizException extends TutoringException {

    public ImmutableQuizException(String quizId) {
        super(ErrorCode.IMMUTABLE_QUIZ,
                "Quiz " + quizId + " already has attempts and can no longer be regenerated");
    }
}
