package com.ai.tutoring.service;

import com.ai.tutoring.model.QuestionResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class GradingResult {
    int correctCount;
    int totalQuestions;
    /** Percentage 0-100, rounded half up. */
    int score;
    List<QuestionResult> detailedResults;
}
