package com.ai.tutoring.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Periodically completes sessions whose booked slot is over.
 * Disable with {@code tutoring.auto-complete.enabled=false}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "tutoring.auto-complete.enabled", havingValue = "true", matchIfMissing = true)
public class SessionAutoCompletionJob {

    private final SessionLifecycleService lifecycleService;

    @Scheduled(fixedDelayString = "${tutoring.auto-complete.interval-ms:600000}",
            initialDelayString = "${tutoring.auto-complete.initial-delay-ms:60000}")
    public void completeEndedSessions() {
        try {
            lifecycleService.autoCompleteEndedSessions(LocalDateTime.now());
        } catch (RuntimeException e) {
            // Keep the schedule alive; the next run picks the sessions up again.
            log.error("Scheduled auto-completion failed: {}", e.getMessage(), e);
        }
    }
}
