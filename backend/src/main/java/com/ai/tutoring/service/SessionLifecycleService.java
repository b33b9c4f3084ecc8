package com.ai.tutoring.service;

import com.ai.tutoring.dto.AutoCompleteResponse;
import com.ai.tutoring.dto.CreateSessionRequest;
import com.ai.tutoring.exception.ErrorCode;
import com.ai.tutoring.exception.ResourceNotFoundException;
import com.ai.tutoring.exception.SessionStateException;
import com.ai.tutoring.exception.TutoringException;
import com.ai.tutoring.model.CancellationState;
import com.ai.tutoring.model.SessionStatus;
import com.ai.tutoring.model.TutoringSession;
import com.ai.tutoring.repository.TutoringSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;

/**
 * Owns session status. Every status change goes through
 * {@link #applyTransition(TutoringSession, SessionStatus)}, which enforces
 * the edge table in {@link SessionStatus}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionLifecycleService {

    private static final int DEFAULT_DURATION_MINUTES = 60;

    private final TutoringSessionRepository sessionRepository;
    private final OptimisticRetry optimisticRetry;
    private final SessionNotifier notifier;

    // ── Booking ──────────────────────────────────────────────────────────────

    public TutoringSession book(CreateSessionRequest request) {
        TutoringSession session = TutoringSession.builder()
                .tutorId(request.getTutorId())
                .studentId(request.getStudentId())
                .subjectId(request.getSubjectId())
                .subjectName(request.getSubjectName())
                .studentName(request.getStudentName())
                .scheduledAt(request.getScheduledAt())
                .durationMinutes(request.getDurationMinutes() != null
                        ? request.getDurationMinutes()
                        : DEFAULT_DURATION_MINUTES)
                .priceCents(request.getPriceCents())
                .notes(request.getNotes())
                .status(SessionStatus.PENDING)
                .cancellation(CancellationState.NONE)
                .build();

        TutoringSession saved = sessionRepository.save(session);
        log.info("Session booked: id={}, tutor={}, student={}, at={}",
                saved.getId(), saved.getTutorId(), saved.getStudentId(), saved.getScheduledAt());
        return saved;
    }

    public TutoringSession getSession(String sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> ResourceNotFoundException.session(sessionId));
    }

    // ── Transitions ──────────────────────────────────────────────────────────

    /**
     * Moves the session to {@code next}.
     *
     * @throws SessionStateException INVALID_TRANSITION for an edge outside the
     *                               table, SLOT_CONFLICT when confirming into
     *                               an already booked slot
     */
    public TutoringSession transition(String sessionId, SessionStatus next) {
        TutoringSession updated = optimisticRetry.execute("session " + sessionId, () -> {
            TutoringSession session = getSession(sessionId);
            if (next == SessionStatus.SCHEDULED && session.getStatus() == SessionStatus.PENDING) {
                ensureSlotFree(session);
            }
            applyTransition(session, next);
            return sessionRepository.saveAndFlush(session);
        });

        log.info("Session {} moved to {}", sessionId, next);
        notifyStatus(updated);
        return updated;
    }

    /**
     * Validates and applies one edge in memory. Leaving SCHEDULED drops any
     * open cancellation request.
     */
    static void applyTransition(TutoringSession session, SessionStatus next) {
        SessionStatus current = session.getStatus();
        if (!current.canTransitionTo(next)) {
            throw new SessionStateException(ErrorCode.INVALID_TRANSITION,
                    "Cannot move session " + session.getId() + " from " + current + " to " + next);
        }
        if (current == SessionStatus.SCHEDULED) {
            session.setCancellation(CancellationState.NONE);
        }
        session.setStatus(next);
    }

    private void ensureSlotFree(TutoringSession session) {
        LocalDateTime start = session.getScheduledAt();
        LocalDateTime end = session.getEndsAt();

        List<TutoringSession> booked = sessionRepository.findByTutorIdAndStatusAndScheduledAtBetween(
                session.getTutorId(), SessionStatus.SCHEDULED, start.minusDays(1), end);

        for (TutoringSession other : booked) {
            if (other.getId().equals(session.getId()))
                continue;
            if (other.getScheduledAt().isBefore(end) && start.isBefore(other.getEndsAt())) {
                throw new SessionStateException(ErrorCode.SLOT_CONFLICT,
                        "Time slot already booked by session " + other.getId());
            }
        }
    }

    // ── Tutor notes ──────────────────────────────────────────────────────────

    /**
     * Attaches the tutor's lesson notes. Notes can be written once, while the
     * lesson runs or after it has completed.
     */
    public TutoringSession attachTutorNotes(String sessionId, String tutorNotes) {
        if (tutorNotes == null || tutorNotes.isBlank()) {
            throw new SessionStateException(ErrorCode.MISSING_NOTES, "Tutor notes are required");
        }

        TutoringSession updated = optimisticRetry.execute("session " + sessionId, () -> {
            TutoringSession session = getSession(sessionId);
            SessionStatus status = session.getStatus();
            if (status != SessionStatus.IN_PROGRESS && status != SessionStatus.COMPLETED) {
                throw new SessionStateException(ErrorCode.NOT_STARTED,
                        "Tutor notes can only be added once the session has started (status: " + status + ")");
            }
            if (session.hasTutorNotes()) {
                throw new SessionStateException(ErrorCode.NOTES_ALREADY_ATTACHED,
                        "Tutor notes were already attached to session " + sessionId);
            }
            session.setTutorNotes(tutorNotes.trim());
            return sessionRepository.saveAndFlush(session);
        });

        log.info("Tutor notes attached to session {} ({} chars)", sessionId, updated.getTutorNotes().length());
        return updated;
    }

    // ── Auto-completion ──────────────────────────────────────────────────────

    /**
     * Completes every open session whose slot ended at or before {@code cutoff}.
     * Scheduled sessions pass through IN_PROGRESS so only table edges are used.
     * A session that fails (e.g. cancelled concurrently) is skipped.
     */
    public AutoCompleteResponse autoCompleteEndedSessions(LocalDateTime cutoff) {
        List<TutoringSession> candidates = sessionRepository.findByStatusInAndScheduledAtLessThanEqual(
                EnumSet.of(SessionStatus.SCHEDULED, SessionStatus.IN_PROGRESS), cutoff);

        int completed = 0;
        for (TutoringSession candidate : candidates) {
            if (candidate.getEndsAt().isAfter(cutoff))
                continue;
            try {
                TutoringSession done = completeEnded(candidate.getId(), cutoff);
                if (done != null) {
                    completed++;
                    notifyStatus(done);
                }
            } catch (TutoringException e) {
                log.warn("Auto-complete skipped session {}: {}", candidate.getId(), e.getMessage());
            }
        }

        log.info("autoCompleteEndedSessions: checked={}, completed={}, cutoff={}",
                candidates.size(), completed, cutoff);
        return AutoCompleteResponse.builder()
                .checked(candidates.size())
                .completed(completed)
                .cutoff(cutoff)
                .build();
    }

    private TutoringSession completeEnded(String sessionId, LocalDateTime cutoff) {
        return optimisticRetry.execute("session " + sessionId, () -> {
            TutoringSession session = getSession(sessionId);
            if (session.getStatus().isTerminal() || session.getEndsAt().isAfter(cutoff)) {
                return null;
            }
            if (session.getStatus() == SessionStatus.SCHEDULED) {
                applyTransition(session, SessionStatus.IN_PROGRESS);
            }
            applyTransition(session, SessionStatus.COMPLETED);
            return sessionRepository.saveAndFlush(session);
        });
    }

    private void notifyStatus(TutoringSession session) {
        try {
            if (session.getStatus() == SessionStatus.COMPLETED) {
                notifier.sessionCompleted(session);
            } else if (session.getStatus() == SessionStatus.CANCELLED) {
                notifier.sessionCancelled(session);
            }
        } catch (RuntimeException e) {
            // Non-fatal: the status change is already committed.
            log.error("Notification for session {} failed: {}", session.getId(), e.getMessage(), e);
        }
    }
}
