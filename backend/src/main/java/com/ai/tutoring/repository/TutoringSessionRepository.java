package com.ai.tutoring.repository;

import com.ai.tutoring.model.SessionStatus;
import com.ai.tutoring.model.TutoringSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Spring Data JPA repository for TutoringSession entities.
 * Backed by the `tutoring_sessions` table in PostgreSQL.
 */
@Repository
public interface TutoringSessionRepository extends JpaRepository<TutoringSession, String> {

    /**
     * Sessions of one tutor in a given status starting inside a window.
     * Used for the double-booking check when a session is confirmed.
     */
    List<TutoringSession> findByTutorIdAndStatusAndScheduledAtBetween(
            String tutorId, SessionStatus status, LocalDateTime from, LocalDateTime to);

    /**
     * Candidates for auto-completion: open sessions that started before the cutoff.
     */
    List<TutoringSession> findByStatusInAndScheduledAtLessThanEqual(
            Collection<SessionStatus> statuses, LocalDateTime cutoff);
}
