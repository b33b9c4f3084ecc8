package com.ai.tutoring.service;

import com.ai.tutoring.exception.ConcurrentUpdateException;
import com.ai.tutoring.exception.ErrorCode;
import com.ai.tutoring.exception.SessionStateException;
import com.ai.tutoring.model.CancellationDecision;
import com.ai.tutoring.model.CancellationState;
import com.ai.tutoring.model.Party;
import com.ai.tutoring.model.SessionStatus;
import com.ai.tutoring.model.TutoringSession;
import com.ai.tutoring.repository.TutoringSessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.support.TransactionOperations;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CancellationServiceTest {

    @Mock
    private TutoringSessionRepository sessionRepository;

    @Mock
    private SessionNotifier notifier;

    private CancellationService cancellationService;

    @BeforeEach
    void setUp() {
        OptimisticRetry retry = new OptimisticRetry(TransactionOperations.withoutTransaction());
        SessionLifecycleService lifecycleService = new SessionLifecycleService(sessionRepository, retry, notifier);
        cancellationService = new CancellationService(sessionRepository, lifecycleService, retry, notifier);
    }

    private static TutoringSession scheduled(CancellationState cancellation) {
        return TutoringSession.builder()
                .id("s-1")
                .tutorId("tutor-1")
                .studentId("student-1")
                .scheduledAt(LocalDateTime.of(2026, 3, 2, 16, 0))
                .durationMinutes(60)
                .status(SessionStatus.SCHEDULED)
                .cancellation(cancellation)
                .build();
    }

    private void stubSave() {
        when(sessionRepository.saveAndFlush(any(TutoringSession.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    @DisplayName("tutor requests, student accepts: cancelled with both flags cleared")
    void requestThenAccept_cancels() {
        // Arrange
        TutoringSession s = scheduled(CancellationState.NONE);
        when(sessionRepository.findById("s-1")).thenReturn(Optional.of(s));
        stubSave();

        // Act
        TutoringSession requested = cancellationService.requestCancel("s-1", Party.TUTOR);
        assertTrue(requested.isCancelRequestedByTutor());
        assertFalse(requested.isCancelRequestedByStudent());
        TutoringSession done = cancellationService.respondToCancel("s-1", Party.STUDENT, CancellationDecision.ACCEPT);

        // Assert
        assertEquals(SessionStatus.CANCELLED, done.getStatus());
        assertFalse(done.isCancelRequestedByTutor());
        assertFalse(done.isCancelRequestedByStudent());
        verify(notifier).sessionCancelled(s);
    }

    @Test
    @DisplayName("student requests, tutor rejects: stays scheduled with both flags cleared")
    void requestThenReject_staysScheduled() {
        // Arrange
        TutoringSession s = scheduled(CancellationState.NONE);
        when(sessionRepository.findById("s-1")).thenReturn(Optional.of(s));
        stubSave();

        // Act
        cancellationService.requestCancel("s-1", Party.STUDENT);
        TutoringSession after = cancellationService.respondToCancel("s-1", Party.TUTOR, CancellationDecision.REJECT);

        // Assert
        assertEquals(SessionStatus.SCHEDULED, after.getStatus());
        assertEquals(CancellationState.NONE, after.getCancellation());
        verifyNoInteractions(notifier);
    }

    @Test
    @DisplayName("racing requests: the loser re-reads and completes the mutual cancellation")
    void concurrentRequests_resolveToCancelled() {
        // Arrange: the student read NONE, but the tutor's request committed first
        TutoringSession stale = scheduled(CancellationState.NONE);
        TutoringSession fresh = scheduled(CancellationState.REQUESTED_BY_TUTOR);
        when(sessionRepository.findById("s-1")).thenReturn(Optional.of(stale), Optional.of(fresh));
        when(sessionRepository.saveAndFlush(any(TutoringSession.class)))
                .thenThrow(new ObjectOptimisticLockingFailureException(TutoringSession.class, "s-1"))
                .thenAnswer(inv -> inv.getArgument(0));

        // Act
        TutoringSession result = cancellationService.requestCancel("s-1", Party.STUDENT);

        // Assert
        assertEquals(SessionStatus.CANCELLED, result.getStatus());
        assertFalse(result.isCancelRequestedByTutor());
        assertFalse(result.isCancelRequestedByStudent());
        verify(sessionRepository, times(2)).saveAndFlush(any());
    }

    @Test
    @DisplayName("a second lost write surfaces as CONCURRENT_MODIFICATION")
    void twoLostWrites_throw() {
        // Arrange
        when(sessionRepository.findById("s-1"))
                .thenReturn(Optional.of(scheduled(CancellationState.NONE)), Optional.of(scheduled(CancellationState.NONE)));
        when(sessionRepository.saveAndFlush(any(TutoringSession.class)))
                .thenThrow(new ObjectOptimisticLockingFailureException(TutoringSession.class, "s-1"));

        // Act & Assert
        ConcurrentUpdateException ex = assertThrows(ConcurrentUpdateException.class,
                () -> cancellationService.requestCancel("s-1", Party.TUTOR));
        assertEquals(ErrorCode.CONCURRENT_MODIFICATION, ex.getErrorCode());
    }

    @Test
    @DisplayName("illegal operations leave the session untouched")
    void illegalOperations_throwWithoutWrite() {
        // Arrange
        TutoringSession requested = scheduled(CancellationState.REQUESTED_BY_TUTOR);
        when(sessionRepository.findById("s-1")).thenReturn(Optional.of(requested));

        // Act & Assert
        assertEquals(ErrorCode.ALREADY_REQUESTED, assertThrows(SessionStateException.class,
                () -> cancellationService.requestCancel("s-1", Party.TUTOR)).getErrorCode());
        assertEquals(ErrorCode.SELF_REQUEST_CONFLICT, assertThrows(SessionStateException.class,
                () -> cancellationService.respondToCancel("s-1", Party.TUTOR, CancellationDecision.ACCEPT)).getErrorCode());
        assertEquals(CancellationState.REQUESTED_BY_TUTOR, requested.getCancellation());
        verify(sessionRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("cancellation outside scheduled is NOT_SCHEDULED")
    void notScheduled_throws() {
        // Arrange
        TutoringSession pending = scheduled(CancellationState.NONE);
        pending.setStatus(SessionStatus.PENDING);
        when(sessionRepository.findById("s-1")).thenReturn(Optional.of(pending));

        // Act & Assert
        SessionStateException ex = assertThrows(SessionStateException.class,
                () -> cancellationService.requestCancel("s-1", Party.STUDENT));
        assertEquals(ErrorCode.NOT_SCHEDULED, ex.getErrorCode());
    }
}
