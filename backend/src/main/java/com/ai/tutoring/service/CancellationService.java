package com.ai.tutoring.service;

import com.ai.tutoring.exception.ErrorCode;
import com.ai.tutoring.exception.SessionStateException;
import com.ai.tutoring.model.CancellationDecision;
import com.ai.tutoring.model.CancellationState;
import com.ai.tutoring.model.Party;
import com.ai.tutoring.model.SessionStatus;
import com.ai.tutoring.model.TutoringSession;
import com.ai.tutoring.repository.TutoringSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Two-party cancellation of a scheduled session.
 *
 * <p>Either party may ask to cancel; the other side accepts or rejects. If
 * both sides ask, the second request is treated as acceptance. The
 * read-validate-write runs under {@link OptimisticRetry}, so when both
 * requests race the loser re-reads the winner's request and completes the
 * mutual cancellation, whatever the arrival order.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CancellationService {

    private final TutoringSessionRepository sessionRepository;
    private final SessionLifecycleService lifecycleService;
    private final OptimisticRetry optimisticRetry;
    private final SessionNotifier notifier;

    public TutoringSession requestCancel(String sessionId, Party actor) {
        TutoringSession updated = optimisticRetry.execute("session " + sessionId, () -> {
            TutoringSession session = lifecycleService.getSession(sessionId);
            requireScheduled(session);
            apply(session, session.getCancellation().request(actor));
            return sessionRepository.saveAndFlush(session);
        });

        log.info("Cancellation requested by {} on session {} → status={}, state={}",
                actor, sessionId, updated.getStatus(), updated.getCancellation());
        afterChange(updated);
        return updated;
    }

    public TutoringSession respondToCancel(String sessionId, Party actor, CancellationDecision decision) {
        TutoringSession updated = optimisticRetry.execute("session " + sessionId, () -> {
            TutoringSession session = lifecycleService.getSession(sessionId);
            requireScheduled(session);
            apply(session, session.getCancellation().respond(actor, decision));
            return sessionRepository.saveAndFlush(session);
        });

        log.info("Cancellation {} by {} on session {} → status={}",
                decision, actor, sessionId, updated.getStatus());
        afterChange(updated);
        return updated;
    }

    private static void requireScheduled(TutoringSession session) {
        if (session.getStatus() != SessionStatus.SCHEDULED) {
            throw new SessionStateException(ErrorCode.NOT_SCHEDULED,
                    "Cancellation is only possible while the session is scheduled (status: "
                            + session.getStatus() + ")");
        }
    }

    private static void apply(TutoringSession session, CancellationState next) {
        if (next == CancellationState.MUTUALLY_CANCELLED) {
            SessionLifecycleService.applyTransition(session, SessionStatus.CANCELLED);
        }
        session.setCancellation(next);
    }

    private void afterChange(TutoringSession session) {
        if (session.getStatus() != SessionStatus.CANCELLED)
            return;
        try {
            notifier.sessionCancelled(session);
        } catch (RuntimeException e) {
            log.error("Cancellation notice for session {} failed: {}", session.getId(), e.getMessage(), e);
        }
    }
}
