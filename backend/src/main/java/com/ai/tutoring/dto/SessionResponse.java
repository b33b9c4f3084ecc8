package com.ai.tutoring.dto;

import com.ai.tutoring.model.LessonSummary;
import com.ai.tutoring.model.SessionStatus;
import com.ai.tutoring.model.TutoringSession;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Session view returned by every session endpoint. Exposes the cancellation
 * negotiation as the two request flags clients render.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionResponse {

    private String id;
    private String tutorId;
    private String studentId;
    private String subjectId;
    private String subjectName;
    private String studentName;
    private LocalDateTime scheduledAt;
    private int durationMinutes;
    private SessionStatus status;
    private boolean cancelRequestedByTutor;
    private boolean cancelRequestedByStudent;
    private long priceCents;
    private String notes;
    private String tutorNotes;
    private LessonSummary aiSummary;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static SessionResponse from(TutoringSession session) {
        return SessionResponse.builder()
                .id(session.getId())
                .tutorId(session.getTutorId())
                .studentId(session.getStudentId())
                .subjectId(session.getSubjectId())
                .subjectName(session.getSubjectName())
                .studentName(session.getStudentName())
                .scheduledAt(session.getScheduledAt())
                .durationMinutes(session.getDurationMinutes())
                .status(session.getStatus())
                .cancelRequestedByTutor(session.isCancelRequestedByTutor())
                .cancelRequestedByStudent(session.isCancelRequestedByStudent())
                .priceCents(session.getPriceCents())
                .notes(session.getNotes())
                .tutorNotes(session.getTutorNotes())
                .aiSummary(session.getAiSummary())
                .createdAt(session.getCreatedAt())
                .updatedAt(session.getUpdatedAt())
                .build();
    }
}
