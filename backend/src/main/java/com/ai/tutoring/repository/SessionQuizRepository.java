package com.ai.tutoring.repository;

import com.ai.tutoring.model.SessionQuiz;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SessionQuizRepository extends JpaRepository<SessionQuiz, String> {

    Optional<SessionQuiz> findBySessionId(String sessionId);

    /**
     * Loads the quiz for grading and bumps its version on commit, so a
     * regeneration racing with the submission fails its own version check.
     */
    @Lock(LockModeType.OPTIMISTIC_FORCE_INCREMENT)
    @Query("SELECT q FROM SessionQuiz q WHERE q.sessionId = :sessionId")
    Optional<SessionQuiz> findForGradingBySessionId(@Param("sessionId") String sessionId);
}
