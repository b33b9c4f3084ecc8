package com.ai.tutoring.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * AI-authored recap of a completed session, embedded in the session row.
 * Written once by {@code LessonSummaryService}; never updated afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Embeddable
public class LessonSummary {

    @Column(name = "summary_what_was_learned", columnDefinition = "TEXT")
    private String whatWasLearned;

    @Column(name = "summary_mistakes", columnDefinition = "TEXT")
    private String mistakes;

    @Column(name = "summary_strengths", columnDefinition = "TEXT")
    private String strengths;

    @Column(name = "summary_practice_tasks", columnDefinition = "TEXT")
    private String practiceTasks;

    @Column(name = "summary_generated_at")
    private LocalDateTime generatedAt;
}
