package com.ai.tutoring.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A single validated quiz question. Stored as part of the quiz's JSON
 * {@code questions} column.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuizQuestion {

    /** The question text. */
    private String question;

    private QuestionType type;

    /** Answer options; only present for multiple choice. */
    private List<String> options;

    /**
     * For multiple choice, the option text verbatim; for true/false,
     * {@code "true"} or {@code "false"}.
     */
    private String correctAnswer;

    /** Why the correct answer is right. */
    private String explanation;

    /** Short name of the lesson topic this question covers. */
    private String topic;
}
