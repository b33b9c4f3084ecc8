package com.ai.tutoring.service;

import com.ai.tutoring.exception.ErrorCode;
import com.ai.tutoring.exception.GenerationFailedException;
import com.ai.tutoring.exception.SessionStateException;
import com.ai.tutoring.model.LessonSummary;
import com.ai.tutoring.model.SessionStatus;
import com.ai.tutoring.model.TutoringSession;
import com.ai.tutoring.repository.TutoringSessionRepository;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.LocalDateTime;

/**
 * Turns a completed session's tutor notes into a structured lesson summary.
 *
 * <p>The provider call happens outside any transaction. The summary is only
 * written after the reply passed validation, in a separate optimistic unit
 * that re-checks the preconditions, so a failed or concurrent generation
 * leaves the session untouched and the call can simply be repeated.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LessonSummaryService {

    private final TutoringSessionRepository sessionRepository;
    private final SessionLifecycleService lifecycleService;
    private final GenerationRunner generationRunner;
    private final JsonReplyReader jsonReplyReader;
    private final OptimisticRetry optimisticRetry;

    public LessonSummary generateSummary(String sessionId) {
        TutoringSession session = lifecycleService.getSession(sessionId);
        checkPreconditions(session);

        log.info("Generating lesson summary for session {} (notes: {} chars)",
                sessionId, session.getTutorNotes().length());

        String rawResponse;
        try {
            rawResponse = generationRunner.generate(buildPrompt(session));
        } catch (IOException e) {
            throw new GenerationFailedException(ErrorCode.GENERATION_FAILED,
                    "Failed to generate AI summary: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationFailedException(ErrorCode.GENERATION_FAILED,
                    "AI summary generation was interrupted", e);
        }

        LessonSummary summary = parseSummary(rawResponse);

        TutoringSession updated = optimisticRetry.execute("session " + sessionId, () -> {
            TutoringSession current = lifecycleService.getSession(sessionId);
            checkPreconditions(current);
            current.setAiSummary(summary);
            return sessionRepository.saveAndFlush(current);
        });

        log.info("Lesson summary attached to session {}", sessionId);
        return updated.getAiSummary();
    }

    private static void checkPreconditions(TutoringSession session) {
        if (session.getStatus() != SessionStatus.COMPLETED) {
            throw new SessionStateException(ErrorCode.NOT_COMPLETED,
                    "A summary can only be generated for a completed session (status: "
                            + session.getStatus() + ")");
        }
        if (!session.hasTutorNotes()) {
            throw new SessionStateException(ErrorCode.MISSING_NOTES,
                    "Tutor notes are required to generate a summary");
        }
        if (session.getAiSummary() != null) {
            throw new SessionStateException(ErrorCode.SUMMARY_ALREADY_ATTACHED,
                    "Session " + session.getId() + " already has a lesson summary");
        }
    }

    // ── Prompt Builder ───────────────────────────────────────────────────────

    private String buildPrompt(TutoringSession session) {
        StringBuilder details = new StringBuilder();
        if (session.getSubjectName() != null)
            details.append("- Subject: ").append(session.getSubjectName()).append('\n');
        if (session.getStudentName() != null)
            details.append("- Student: ").append(session.getStudentName()).append('\n');
        if (session.getDurationMinutes() > 0)
            details.append("- Duration: ").append(session.getDurationMinutes()).append(" minutes\n");

        return """
                You are an educational assistant helping to create structured lesson summaries for students and their parents.

                Based on the tutor's notes from a tutoring session, write a clear, professional summary.

                Session details:
                %s
                Tutor's notes:
                %s

                Produce exactly these four sections:
                1. whatWasLearned: the main topics, concepts and skills covered. Be specific.
                2. mistakes: mistakes the student made or areas where they struggled. Be constructive.
                3. strengths: what the student did well.
                4. practiceTasks: 3-5 specific, actionable exercises for before the next session.

                Answer with a JSON object with exactly these keys: "whatWasLearned", "mistakes", "strengths", "practiceTasks".
                Each value must be a non-empty string (markdown bullet points are allowed inside the string).
                """.formatted(details, session.getTutorNotes());
    }

    // ── Response Parser ──────────────────────────────────────────────────────

    /**
     * All four fields must be present and non-blank; otherwise the whole reply
     * is rejected.
     */
    private LessonSummary parseSummary(String rawResponse) {
        JsonNode root = jsonReplyReader.readObject(rawResponse, ErrorCode.GENERATION_FAILED);

        String whatWasLearned = JsonReplyReader.nonBlankText(root, "whatWasLearned");
        String mistakes = JsonReplyReader.nonBlankText(root, "mistakes");
        String strengths = JsonReplyReader.nonBlankText(root, "strengths");
        String practiceTasks = JsonReplyReader.nonBlankText(root, "practiceTasks");

        if (whatWasLearned == null || mistakes == null || strengths == null || practiceTasks == null) {
            log.warn("AI summary missing fields: whatWasLearned={}, mistakes={}, strengths={}, practiceTasks={}",
                    whatWasLearned != null, mistakes != null, strengths != null, practiceTasks != null);
            throw new GenerationFailedException(ErrorCode.GENERATION_FAILED,
                    "AI response missing required fields. Please try again.");
        }

        return LessonSummary.builder()
                .whatWasLearned(whatWasLearned)
                .mistakes(mistakes)
                .strengths(strengths)
                .practiceTasks(practiceTasks)
                .generatedAt(LocalDateTime.now())
                .build();
    }
}
