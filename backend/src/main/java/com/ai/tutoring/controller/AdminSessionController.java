package com.ai.tutoring.controller;

import com.ai.tutoring.dto.AutoCompleteResponse;
import com.ai.tutoring.service.SessionLifecycleService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;

/**
 * Operational endpoints, meant to be called by an external scheduler or by
 * an operator.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminSessionController {

    private final SessionLifecycleService lifecycleService;

    /**
     * Completes ended sessions. {@code now} overrides the cutoff, which lets
     * tests simulate a future point in time.
     */
    @PostMapping("/cron/auto-complete-sessions")
    public ResponseEntity<AutoCompleteResponse> autoCompleteSessions(
            @RequestParam(name = "now", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime now) {
        LocalDateTime cutoff = now != null ? now : LocalDateTime.now();
        return ResponseEntity.ok(lifecycleService.autoCompleteEndedSessions(cutoff));
    }
}
