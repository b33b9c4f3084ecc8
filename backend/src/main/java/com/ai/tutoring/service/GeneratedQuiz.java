package com.ai.tutoring.service;

import com.ai.tutoring.model.Difficulty;
import com.ai.tutoring.model.QuizQuestion;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A quiz reply that passed validation and is ready to be stored.
 */
@Value
@Builder
public class GeneratedQuiz {
    List<QuizQuestion> questions;
    List<String> focusAreas;
    Difficulty difficulty;
}
