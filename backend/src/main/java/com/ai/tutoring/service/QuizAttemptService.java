package com.ai.tutoring.service;

import com.ai.tutoring.dto.QuizView;
import com.ai.tutoring.exception.ResourceNotFoundException;
import com.ai.tutoring.model.QuizAttempt;
import com.ai.tutoring.model.SessionQuiz;
import com.ai.tutoring.model.TutoringSession;
import com.ai.tutoring.repository.QuizAttemptRepository;
import com.ai.tutoring.repository.SessionQuizRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Quiz retrieval and submission for the session's student.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuizAttemptService {

    private final SessionLifecycleService lifecycleService;
    private final SessionQuizRepository quizRepository;
    private final QuizAttemptRepository attemptRepository;
    private final QuizGrader quizGrader;
    private final OptimisticRetry optimisticRetry;

    /**
     * @return the live quiz and the student's latest attempt (null if none)
     */
    public QuizView getQuiz(String sessionId) {
        TutoringSession session = lifecycleService.getSession(sessionId);
        SessionQuiz quiz = quizRepository.findBySessionId(sessionId)
                .orElseThrow(() -> ResourceNotFoundException.quiz(sessionId));

        QuizAttempt latest = attemptRepository
                .findFirstByQuizIdAndStudentIdOrderByAttemptNumberDesc(quiz.getId(), session.getStudentId())
                .orElse(null);

        return QuizView.builder()
                .quiz(quiz)
                .attempt(latest)
                .build();
    }

    /** Every attempt of the session's student, newest first. */
    public List<QuizAttempt> getAttemptHistory(String sessionId) {
        TutoringSession session = lifecycleService.getSession(sessionId);
        SessionQuiz quiz = quizRepository.findBySessionId(sessionId)
                .orElseThrow(() -> ResourceNotFoundException.quiz(sessionId));
        return attemptRepository.findByQuizIdAndStudentIdOrderByAttemptNumberDesc(quiz.getId(), session.getStudentId());
    }

    /**
     * Grades the answers and stores the attempt in one transaction. Grading
     * locks the quiz version so it cannot be regenerated underneath the
     * attempt.
     */
    public QuizAttempt submitQuizAnswers(String sessionId, Map<Integer, String> answers) {
        TutoringSession session = lifecycleService.getSession(sessionId);
        String studentId = session.getStudentId();

        QuizAttempt saved = optimisticRetry.execute("attempts of session " + sessionId, () -> {
            SessionQuiz quiz = quizRepository.findForGradingBySessionId(sessionId)
                    .orElseThrow(() -> ResourceNotFoundException.quiz(sessionId));

            GradingResult result = quizGrader.grade(quiz.getQuestions(), answers);

            int attemptNumber = attemptRepository
                    .findFirstByQuizIdAndStudentIdOrderByAttemptNumberDesc(quiz.getId(), studentId)
                    .map(previous -> previous.getAttemptNumber() + 1)
                    .orElse(1);

            QuizAttempt attempt = QuizAttempt.builder()
                    .quizId(quiz.getId())
                    .sessionId(sessionId)
                    .studentId(studentId)
                    .attemptNumber(attemptNumber)
                    .answers(new TreeMap<>(answers))
                    .score(result.getScore())
                    .correctCount(result.getCorrectCount())
                    .totalQuestions(result.getTotalQuestions())
                    .detailedResults(result.getDetailedResults())
                    .completedAt(LocalDateTime.now())
                    .build();
            return attemptRepository.saveAndFlush(attempt);
        });

        log.info("Quiz attempt #{} saved: session={}, student={}, score={}% ({}/{})",
                saved.getAttemptNumber(), sessionId, studentId,
                saved.getScore(), saved.getCorrectCount(), saved.getTotalQuestions());
        return saved;
    }
}
