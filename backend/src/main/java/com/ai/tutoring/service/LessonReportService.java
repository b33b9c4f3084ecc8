package com.ai.tutoring.service;

import com.ai.tutoring.dto.LessonReportResponse;
import com.ai.tutoring.exception.TutoringException;
import com.ai.tutoring.model.LessonSummary;
import com.ai.tutoring.model.SessionQuiz;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the post-session lesson report: the summary, followed by the quiz
 * when {@code tutoring.quiz.auto-generate} is on. A failed quiz does not fail
 * the report; it is reported as a warning and can be generated later through
 * {@link QuizGenerationService}.
 */
@Slf4j
@Service
public class LessonReportService {

    private final LessonSummaryService summaryService;
    private final QuizGenerationService quizGenerationService;
    private final SessionLifecycleService lifecycleService;
    private final SessionNotifier notifier;
    private final boolean autoGenerateQuiz;

    public LessonReportService(LessonSummaryService summaryService,
                               QuizGenerationService quizGenerationService,
                               SessionLifecycleService lifecycleService,
                               SessionNotifier notifier,
                               @Value("${tutoring.quiz.auto-generate:true}") boolean autoGenerateQuiz) {
        this.summaryService = summaryService;
        this.quizGenerationService = quizGenerationService;
        this.lifecycleService = lifecycleService;
        this.notifier = notifier;
        this.autoGenerateQuiz = autoGenerateQuiz;
    }

    public LessonReportResponse generateReport(String sessionId) {
        LessonSummary summary = summaryService.generateSummary(sessionId);

        SessionQuiz quiz = null;
        List<String> warnings = new ArrayList<>();
        if (autoGenerateQuiz) {
            try {
                quiz = quizGenerationService.generateQuiz(sessionId);
            } catch (TutoringException e) {
                log.warn("Automatic quiz generation failed for session {}: {}", sessionId, e.getMessage());
                warnings.add("Quiz generation failed: " + e.getMessage()
                        + ". The summary was created successfully.");
            }
        }

        try {
            notifier.lessonReportReady(lifecycleService.getSession(sessionId), quiz != null);
        } catch (RuntimeException e) {
            log.error("Lesson report notification for session {} failed: {}", sessionId, e.getMessage(), e);
        }

        return LessonReportResponse.builder()
                .sessionId(sessionId)
                .summary(summary)
                .quiz(quiz)
                .warnings(warnings)
                .build();
    }
}
