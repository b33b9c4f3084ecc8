package com.ai.tutoring.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Sent by the frontend when the student submits their quiz answers.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QuizSubmitRequest {

    /**
     * Question index → chosen answer: the option text for multiple choice,
     * "true"/"false" for true/false questions.
     */
    @NotNull
    private Map<Integer, String> answers;
}
