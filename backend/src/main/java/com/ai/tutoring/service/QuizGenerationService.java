package com.ai.tutoring.service;

import com.ai.tutoring.exception.ErrorCode;
import com.ai.tutoring.exception.GenerationFailedException;
import com.ai.tutoring.exception.ImmutableQuizException;
import com.ai.tutoring.exception.SessionStateException;
import com.ai.tutoring.model.LessonSummary;
import com.ai.tutoring.model.SessionQuiz;
import com.ai.tutoring.model.SessionStatus;
import com.ai.tutoring.model.TutoringSession;
import com.ai.tutoring.repository.QuizAttemptRepository;
import com.ai.tutoring.repository.SessionQuizRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Generates the improvement quiz of a completed session from its lesson summary.
 *
 * <p>Regeneration replaces the live quiz in place as long as nobody has
 * submitted answers to it. Once an attempt exists the quiz is frozen so that
 * stored grades keep matching the questions they were graded against.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuizGenerationService {

    private final SessionLifecycleService lifecycleService;
    private final SessionQuizRepository quizRepository;
    private final QuizAttemptRepository attemptRepository;
    private final GenerationRunner generationRunner;
    private final GeneratedQuizParser quizParser;
    private final OptimisticRetry optimisticRetry;

    public SessionQuiz generateQuiz(String sessionId) {
        TutoringSession session = lifecycleService.getSession(sessionId);
        if (session.getAiSummary() == null) {
            throw new SessionStateException(ErrorCode.SUMMARY_MISSING,
                    "AI summary is required to generate a quiz. Please generate the summary first.");
        }
        if (session.getStatus() != SessionStatus.COMPLETED) {
            throw new SessionStateException(ErrorCode.NOT_COMPLETED,
                    "A quiz can only be generated for a completed session (status: " + session.getStatus() + ")");
        }
        // Fail fast before paying for a provider call.
        ensureRegenerable(quizRepository.findBySessionId(sessionId));

        log.info("Generating quiz for session {}", sessionId);

        String rawResponse;
        try {
            rawResponse = generationRunner.generate(buildPrompt(session));
        } catch (IOException e) {
            throw new GenerationFailedException(ErrorCode.QUIZ_GENERATION_FAILED,
                    "Failed to generate quiz: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationFailedException(ErrorCode.QUIZ_GENERATION_FAILED,
                    "Quiz generation was interrupted", e);
        }

        GeneratedQuiz generated = quizParser.parse(rawResponse);

        SessionQuiz saved = optimisticRetry.execute("quiz of session " + sessionId, () -> {
            Optional<SessionQuiz> current = quizRepository.findBySessionId(sessionId);
            ensureRegenerable(current);

            SessionQuiz quiz = current.orElseGet(() -> SessionQuiz.builder().sessionId(sessionId).build());
            quiz.setQuestions(generated.getQuestions());
            quiz.setFocusAreas(generated.getFocusAreas());
            quiz.setDifficulty(generated.getDifficulty());
            quiz.setCreatedAt(LocalDateTime.now());
            return quizRepository.saveAndFlush(quiz);
        });

        log.info("Quiz {} stored for session {}: {} questions, difficulty={}",
                saved.getId(), sessionId, saved.getQuestions().size(), saved.getDifficulty());
        return saved;
    }

    private void ensureRegenerable(Optional<SessionQuiz> existing) {
        if (existing.isPresent() && attemptRepository.existsByQuizId(existing.get().getId())) {
            throw new ImmutableQuizException(existing.get().getId());
        }
    }

    // ── Prompt Builder ───────────────────────────────────────────────────────

    private String buildPrompt(TutoringSession session) {
        LessonSummary summary = session.getAiSummary();
        StringBuilder details = new StringBuilder();
        if (session.getSubjectName() != null)
            details.append("Subject: ").append(session.getSubjectName()).append('\n');
        if (session.getStudentName() != null)
            details.append("Student: ").append(session.getStudentName()).append('\n');

        return """
                You are an educational assessment specialist creating a personalized quiz to help a student improve.

                Session details:
                %s
                Lesson summary:

                What was learned:
                %s

                Mistakes & areas for improvement:
                %s

                Strengths:
                %s

                Practice tasks:
                %s

                Create a quiz with 8-10 questions:
                - about 60%% on the mistakes / weak areas, 30%% on what was learned, 10%% on the practice tasks
                - a mix of multiple choice (4 options) and true/false questions
                - every question has a detailed explanation of the correct answer and a short topic name
                - for multiple choice, "correctAnswer" must repeat one of the options word for word
                - for true/false, "correctAnswer" must be "true" or "false"

                Answer with a JSON object with this structure:
                {
                  "questions": [
                    {
                      "question": "Question text?",
                      "type": "multiple_choice" or "true_false",
                      "options": ["Option A", "Option B", "Option C", "Option D"],
                      "correctAnswer": "Option B",
                      "explanation": "Why this is correct",
                      "topic": "Topic name"
                    }
                  ],
                  "focusAreas": ["Area 1", "Area 2"],
                  "difficulty": "easy" or "medium" or "hard"
                }
                """.formatted(details,
                summary.getWhatWasLearned(),
                summary.getMistakes(),
                summary.getStrengths(),
                summary.getPracticeTasks());
    }
}
