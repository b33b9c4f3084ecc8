package com.ai.tutoring.dto;

import com.ai.tutoring.model.QuizAttempt;
import com.ai.tutoring.model.SessionQuiz;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A session's quiz together with the student's latest attempt, if any.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuizView {

    private SessionQuiz quiz;

    /** Null until the student has submitted once. */
    private QuizAttempt attempt;
}
