package com.ai.tutoring.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One fully graded submission of a student's answers to a session quiz.
 *
 * <p>Rows are insert-only. A retake is a new row with the next
 * {@link #attemptNumber}; the highest number is the one shown to the student.</p>
 */
@Entity
@Immutable
@Table(name = "quiz_attempts",
        uniqueConstraints = @UniqueConstraint(name = "uk_attempt_quiz_student_number",
                columnNames = {"quiz_id", "student_id", "attempt_number"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuizAttempt {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "quiz_id", nullable = false, length = 36)
    private String quizId;

    @Column(name = "session_id", nullable = false, length = 36)
    private String sessionId;

    @Column(name = "student_id", nullable = false, length = 36)
    private String studentId;

    /** 1 for the first submission, incremented on every retake. */
    @Column(name = "attempt_number", nullable = false)
    private int attemptNumber;

    /** Question index → submitted answer, exactly as received. */
    @Convert(converter = JsonColumnConverters.AnswerMapConverter.class)
    @Column(nullable = false, columnDefinition = "TEXT")
    private Map<Integer, String> answers;

    /** Score % (0-100), rounded half up. */
    @Column(nullable = false)
    private int score;

    @Column(name = "correct_count", nullable = false)
    private int correctCount;

    @Column(name = "total_questions", nullable = false)
    private int totalQuestions;

    @Convert(converter = JsonColumnConverters.ResultListConverter.class)
    @Column(name = "detailed_results", nullable = false, columnDefinition = "TEXT")
    private List<QuestionResult> detailedResults;

    @Column(name = "completed_at", nullable = false)
    private LocalDateTime completedAt;

    @PrePersist
    public void prePersist() {
        if (id == null)
            id = UUID.randomUUID().toString();
    }
}
