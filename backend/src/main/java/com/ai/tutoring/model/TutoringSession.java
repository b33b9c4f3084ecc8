package com.ai.tutoring.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A booked tutoring meeting between one tutor and one student.
 *
 * <p>Status and cancellation state are only changed through
 * {@code SessionLifecycleService} and {@code CancellationService}, which
 * rely on {@link #version} for optimistic compare-and-set.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "tutoring_sessions", indexes = {
        @Index(name = "idx_sessions_tutor_start", columnList = "tutor_id, scheduled_at"),
        @Index(name = "idx_sessions_status_start", columnList = "status, scheduled_at")
})
public class TutoringSession {

    @Id
    @Column(length = 36, nullable = false, updatable = false)
    private String id;

    @Column(name = "tutor_id", nullable = false, length = 36)
    private String tutorId;

    @Column(name = "student_id", nullable = false, length = 36)
    private String studentId;

    @Column(name = "subject_id", length = 36)
    private String subjectId;

    /** Display names captured at booking; used as generator context. */
    @Column(name = "subject_name")
    private String subjectName;

    @Column(name = "student_name")
    private String studentName;

    @Column(name = "scheduled_at", nullable = false)
    private LocalDateTime scheduledAt;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private SessionStatus status = SessionStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    @Builder.Default
    private CancellationState cancellation = CancellationState.NONE;

    @Column(name = "price_cents")
    private long priceCents;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "tutor_notes", columnDefinition = "TEXT")
    private String tutorNotes;

    @Embedded
    private LessonSummary aiSummary;

    @Version
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    public void prePersist() {
        if (id == null)
            id = UUID.randomUUID().toString();
    }

    @Transient
    public boolean isCancelRequestedByTutor() {
        return cancellation.isRequestedBy(Party.TUTOR);
    }

    @Transient
    public boolean isCancelRequestedByStudent() {
        return cancellation.isRequestedBy(Party.STUDENT);
    }

    /** End of the booked slot. */
    @Transient
    public LocalDateTime getEndsAt() {
        return scheduledAt.plusMinutes(durationMinutes);
    }

    public boolean hasTutorNotes() {
        return tutorNotes != null && !tutorNotes.isBlank();
    }
}
