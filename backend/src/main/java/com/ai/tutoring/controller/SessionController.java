package com.ai.tutoring.controller;

import com.ai.tutoring.dto.CancelRequest;
import com.ai.tutoring.dto.CancelResponseRequest;
import com.ai.tutoring.dto.CreateSessionRequest;
import com.ai.tutoring.dto.LessonReportResponse;
import com.ai.tutoring.dto.SessionResponse;
import com.ai.tutoring.dto.StatusUpdateRequest;
import com.ai.tutoring.dto.TutorNotesRequest;
import com.ai.tutoring.service.CancellationService;
import com.ai.tutoring.service.LessonReportService;
import com.ai.tutoring.service.SessionLifecycleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * SessionController exposes the session lifecycle, the cancellation
 * negotiation and lesson report generation.
 */
@Slf4j
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@CrossOrigin(origins = { "http://localhost:5173", "http://localhost:3000" })
public class SessionController {

    private final SessionLifecycleService lifecycleService;
    private final CancellationService cancellationService;
    private final LessonReportService lessonReportService;

    // ── POST /api/sessions ───────────────────────────────────────────────────

    @PostMapping
    public ResponseEntity<SessionResponse> bookSession(@Valid @RequestBody CreateSessionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(SessionResponse.from(lifecycleService.book(request)));
    }

    // ── GET /api/sessions/{id} ───────────────────────────────────────────────

    @GetMapping("/{id}")
    public ResponseEntity<SessionResponse> getSession(@PathVariable String id) {
        return ResponseEntity.ok(SessionResponse.from(lifecycleService.getSession(id)));
    }

    // ── PUT /api/sessions/{id}/status ────────────────────────────────────────

    @PutMapping("/{id}/status")
    public ResponseEntity<SessionResponse> updateStatus(
            @PathVariable String id,
            @Valid @RequestBody StatusUpdateRequest request) {
        return ResponseEntity.ok(SessionResponse.from(lifecycleService.transition(id, request.getStatus())));
    }

    // ── PUT /api/sessions/{id}/tutor-notes ───────────────────────────────────

    @PutMapping("/{id}/tutor-notes")
    public ResponseEntity<SessionResponse> attachTutorNotes(
            @PathVariable String id,
            @Valid @RequestBody TutorNotesRequest request) {
        return ResponseEntity.ok(SessionResponse.from(
                lifecycleService.attachTutorNotes(id, request.getTutorNotes())));
    }

    // ── POST /api/sessions/{id}/cancel-request ───────────────────────────────

    @PostMapping("/{id}/cancel-request")
    public ResponseEntity<SessionResponse> requestCancel(
            @PathVariable String id,
            @Valid @RequestBody CancelRequest request) {
        return ResponseEntity.ok(SessionResponse.from(
                cancellationService.requestCancel(id, request.getRole())));
    }

    // ── POST /api/sessions/{id}/cancel-response ──────────────────────────────

    @PostMapping("/{id}/cancel-response")
    public ResponseEntity<SessionResponse> respondToCancel(
            @PathVariable String id,
            @Valid @RequestBody CancelResponseRequest request) {
        return ResponseEntity.ok(SessionResponse.from(
                cancellationService.respondToCancel(id, request.getRole(), request.getDecision())));
    }

    // ── POST /api/sessions/{id}/generate-summary ─────────────────────────────

    @PostMapping("/{id}/generate-summary")
    public ResponseEntity<LessonReportResponse> generateSummary(@PathVariable String id) {
        log.info("Lesson report requested for session {}", id);
        return ResponseEntity.ok(lessonReportService.generateReport(id));
    }
}
