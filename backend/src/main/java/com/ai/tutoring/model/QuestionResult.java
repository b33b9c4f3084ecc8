package com.ai.tutoring.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Grading outcome for one question of an attempt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuestionResult {

    /** 0-based index matching the quiz question. */
    private int questionIndex;

    private String question;

    private String studentAnswer;

    private String correctAnswer;

    @JsonProperty("isCorrect")
    private boolean correct;

    private String explanation;

    private String topic;
}
