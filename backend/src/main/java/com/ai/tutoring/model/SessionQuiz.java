package com.ai.tutoring.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * The live quiz of a completed session. There is at most one row per session;
 * regenerating overwrites it in place until the first attempt is graded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "session_quizzes",
        uniqueConstraints = @UniqueConstraint(name = "uk_quiz_session", columnNames = "session_id"))
public class SessionQuiz {

    @Id
    @Column(length = 36, nullable = false, updatable = false)
    private String id;

    @Column(name = "session_id", nullable = false, length = 36, updatable = false)
    private String sessionId;

    @Convert(converter = JsonColumnConverters.QuestionListConverter.class)
    @Column(nullable = false, columnDefinition = "TEXT")
    private List<QuizQuestion> questions;

    @Convert(converter = JsonColumnConverters.StringListConverter.class)
    @Column(name = "focus_areas", columnDefinition = "TEXT")
    private List<String> focusAreas;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Difficulty difficulty;

    /** Time of the latest (re)generation. */
    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Version
    private Long version;

    @PrePersist
    public void prePersist() {
        if (id == null)
            id = UUID.randomUUID().toString();
    }
}
