package com.ai.tutoring.dto;

import com.ai.tutoring.model.LessonSummary;
import com.ai.tutoring.model.SessionQuiz;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of {@code POST /api/sessions/{id}/generate-summary}: the summary, plus
 * the quiz when automatic quiz generation is enabled and succeeded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LessonReportResponse {

    private String sessionId;

    private LessonSummary summary;

    /** Null when auto-generation is off or failed; see {@link #warnings}. */
    private SessionQuiz quiz;

    /** Non-fatal problems, e.g. a failed automatic quiz generation. */
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
