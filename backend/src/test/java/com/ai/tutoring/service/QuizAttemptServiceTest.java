package com.ai.tutoring.service;

import com.ai.tutoring.dto.QuizView;
import com.ai.tutoring.exception.ContractViolationException;
import com.ai.tutoring.exception.ErrorCode;
import com.ai.tutoring.exception.ResourceNotFoundException;
import com.ai.tutoring.model.Difficulty;
import com.ai.tutoring.model.QuestionType;
import com.ai.tutoring.model.QuizAttempt;
import com.ai.tutoring.model.QuizQuestion;
import com.ai.tutoring.model.SessionQuiz;
import com.ai.tutoring.model.SessionStatus;
import com.ai.tutoring.model.TutoringSession;
import com.ai.tutoring.repository.QuizAttemptRepository;
import com.ai.tutoring.repository.SessionQuizRepository;
import com.ai.tutoring.repository.TutoringSessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionOperations;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QuizAttemptServiceTest {

    @Mock
    private TutoringSessionRepository sessionRepository;

    @Mock
    private SessionQuizRepository quizRepository;

    @Mock
    private QuizAttemptRepository attemptRepository;

    @Mock
    private SessionNotifier notifier;

    private QuizAttemptService quizAttemptService;
    private SessionQuiz quiz;

    @BeforeEach
    void setUp() {
        OptimisticRetry retry = new OptimisticRetry(TransactionOperations.withoutTransaction());
        SessionLifecycleService lifecycleService = new SessionLifecycleService(sessionRepository, retry, notifier);
        quizAttemptService = new QuizAttemptService(lifecycleService, quizRepository, attemptRepository,
                new QuizGrader(), retry);

        TutoringSession session = TutoringSession.builder()
                .id("s-1")
                .studentId("student-1")
                .status(SessionStatus.COMPLETED)
                .build();
        lenient().when(sessionRepository.findById("s-1")).thenReturn(Optional.of(session));

        quiz = SessionQuiz.builder()
                .id("q-1")
                .sessionId("s-1")
                .questions(List.of(
                        question(QuestionType.MULTIPLE_CHOICE, "B", List.of("A", "B", "C")),
                        question(QuestionType.TRUE_FALSE, "true", null),
                        question(QuestionType.MULTIPLE_CHOICE, "C", List.of("A", "B", "C"))))
                .difficulty(Difficulty.MEDIUM)
                .build();
    }

    private static QuizQuestion question(QuestionType type, String correct, List<String> options) {
        return QuizQuestion.builder()
                .question("Q")
                .type(type)
                .options(options)
                .correctAnswer(correct)
                .explanation("E")
                .topic("T")
                .build();
    }

    @Test
    @DisplayName("submitQuizAnswers: first attempt is graded and stored as attempt 1")
    void submit_firstAttempt() {
        // Arrange
        when(quizRepository.findForGradingBySessionId("s-1")).thenReturn(Optional.of(quiz));
        when(attemptRepository.findFirstByQuizIdAndStudentIdOrderByAttemptNumberDesc("q-1", "student-1"))
                .thenReturn(Optional.empty());
        when(attemptRepository.saveAndFlush(any(QuizAttempt.class))).thenAnswer(inv -> inv.getArgument(0));

        // Act
        QuizAttempt attempt = quizAttemptService.submitQuizAnswers("s-1", Map.of(0, "B", 1, "True", 2, "A"));

        // Assert
        assertEquals(1, attempt.getAttemptNumber());
        assertEquals(2, attempt.getCorrectCount());
        assertEquals(3, attempt.getTotalQuestions());
        assertEquals(67, attempt.getScore());
        assertEquals(3, attempt.getDetailedResults().size());
        assertEquals("student-1", attempt.getStudentId());
        assertNotNull(attempt.getCompletedAt());
    }

    @Test
    @DisplayName("submitQuizAnswers: a retake gets the next attempt number")
    void submit_retake_incrementsNumber() {
        // Arrange
        QuizAttempt previous = QuizAttempt.builder().id("a-1").quizId("q-1").attemptNumber(2).build();
        when(quizRepository.findForGradingBySessionId("s-1")).thenReturn(Optional.of(quiz));
        when(attemptRepository.findFirstByQuizIdAndStudentIdOrderByAttemptNumberDesc("q-1", "student-1"))
                .thenReturn(Optional.of(previous));
        when(attemptRepository.saveAndFlush(any(QuizAttempt.class))).thenAnswer(inv -> inv.getArgument(0));

        // Act
        QuizAttempt attempt = quizAttemptService.submitQuizAnswers("s-1", Map.of(0, "B", 1, "true", 2, "C"));

        // Assert
        assertEquals(3, attempt.getAttemptNumber());
        assertEquals(100, attempt.getScore());
    }

    @Test
    @DisplayName("submitQuizAnswers: incomplete answers create no attempt")
    void submit_incomplete_noAttempt() {
        // Arrange
        when(quizRepository.findForGradingBySessionId("s-1")).thenReturn(Optional.of(quiz));

        // Act & Assert
        ContractViolationException ex = assertThrows(ContractViolationException.class,
                () -> quizAttemptService.submitQuizAnswers("s-1", Map.of(0, "B", 1, "true")));
        assertEquals(ErrorCode.INCOMPLETE_SUBMISSION, ex.getErrorCode());
        verify(attemptRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("submitQuizAnswers: no quiz is QUIZ_NOT_FOUND")
    void submit_noQuiz_notFound() {
        // Arrange
        when(quizRepository.findForGradingBySessionId("s-1")).thenReturn(Optional.empty());

        // Act & Assert
        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class,
                () -> quizAttemptService.submitQuizAnswers("s-1", Map.of(0, "B")));
        assertEquals(ErrorCode.QUIZ_NOT_FOUND, ex.getErrorCode());
    }

    @Test
    @DisplayName("getQuiz: returns the quiz with the latest attempt, or null before the first one")
    void getQuiz_withAndWithoutAttempt() {
        // Arrange
        QuizAttempt latest = QuizAttempt.builder().id("a-2").quizId("q-1").attemptNumber(2).build();
        when(quizRepository.findBySessionId("s-1")).thenReturn(Optional.of(quiz));
        when(attemptRepository.findFirstByQuizIdAndStudentIdOrderByAttemptNumberDesc("q-1", "student-1"))
                .thenReturn(Optional.empty(), Optional.of(latest));

        // Act
        QuizView before = quizAttemptService.getQuiz("s-1");
        QuizView after = quizAttemptService.getQuiz("s-1");

        // Assert
        assertSame(quiz, before.getQuiz());
        assertNull(before.getAttempt());
        assertSame(latest, after.getAttempt());
    }
}
