package com.ai.tutoring.repository;

import com.ai.tutoring.model.LessonSummary;
import com.ai.tutoring.model.SessionStatus;
import com.ai.tutoring.model.TutoringSession;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class TutoringSessionRepositoryTest {

    private static final LocalDateTime START = LocalDateTime.of(2026, 3, 2, 16, 0);

    @Autowired
    private TutoringSessionRepository sessionRepository;

    @Autowired
    private TestEntityManager entityManager;

    private TutoringSession persist(String tutorId, SessionStatus status, LocalDateTime at) {
        TutoringSession session = TutoringSession.builder()
                .tutorId(tutorId)
                .studentId("student-1")
                .scheduledAt(at)
                .durationMinutes(60)
                .status(status)
                .build();
        entityManager.persist(session);
        return session;
    }

    @Test
    @DisplayName("new sessions get an id, a version and timestamps")
    void persist_assignsIdAndVersion() {
        TutoringSession session = persist("tutor-1", SessionStatus.PENDING, START);
        entityManager.flush();

        assertNotNull(session.getId());
        assertNotNull(session.getVersion());
        assertNotNull(session.getCreatedAt());
    }

    @Test
    @DisplayName("findByTutorIdAndStatusAndScheduledAtBetween filters tutor, status and window")
    void findBookedInWindow() {
        persist("tutor-1", SessionStatus.SCHEDULED, START);
        persist("tutor-1", SessionStatus.PENDING, START);
        persist("tutor-2", SessionStatus.SCHEDULED, START);
        persist("tutor-1", SessionStatus.SCHEDULED, START.plusDays(3));
        entityManager.flush();

        List<TutoringSession> found = sessionRepository.findByTutorIdAndStatusAndScheduledAtBetween(
                "tutor-1", SessionStatus.SCHEDULED, START.minusDays(1), START.plusHours(1));

        assertEquals(1, found.size());
        assertEquals(START, found.get(0).getScheduledAt());
    }

    @Test
    @DisplayName("findByStatusInAndScheduledAtLessThanEqual returns open sessions started before the cutoff")
    void findAutoCompleteCandidates() {
        persist("tutor-1", SessionStatus.SCHEDULED, START);
        persist("tutor-1", SessionStatus.IN_PROGRESS, START.plusHours(1));
        persist("tutor-1", SessionStatus.COMPLETED, START);
        persist("tutor-1", SessionStatus.SCHEDULED, START.plusDays(1));
        entityManager.flush();

        List<TutoringSession> found = sessionRepository.findByStatusInAndScheduledAtLessThanEqual(
                EnumSet.of(SessionStatus.SCHEDULED, SessionStatus.IN_PROGRESS), START.plusHours(1));

        assertEquals(2, found.size());
    }

    @Test
    @DisplayName("embedded summary is stored with the session")
    void summary_isEmbedded() {
        TutoringSession session = persist("tutor-1", SessionStatus.COMPLETED, START);
        session.setAiSummary(LessonSummary.builder()
                .whatWasLearned("Fractions")
                .mistakes("Denominators")
                .strengths("Focus")
                .practiceTasks("Drill")
                .generatedAt(START.plusHours(2))
                .build());
        entityManager.flush();
        entityManager.clear();

        TutoringSession loaded = sessionRepository.findById(session.getId()).orElseThrow();

        assertEquals("Denominators", loaded.getAiSummary().getMistakes());
    }
}
