package com.ai.tutoring.controller;

import com.ai.tutoring.dto.QuizSubmitRequest;
import com.ai.tutoring.dto.QuizView;
import com.ai.tutoring.model.QuizAttempt;
import com.ai.tutoring.model.SessionQuiz;
import com.ai.tutoring.service.QuizAttemptService;
import com.ai.tutoring.service.QuizGenerationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/sessions/{id}")
@RequiredArgsConstructor
@CrossOrigin(origins = { "http://localhost:5173", "http://localhost:3000" })
public class SessionQuizController {

    private final QuizGenerationService quizGenerationService;
    private final QuizAttemptService quizAttemptService;

    // ── POST /api/sessions/{id}/generate-quiz ────────────────────────────────

    @PostMapping("/generate-quiz")
    public ResponseEntity<SessionQuiz> generateQuiz(@PathVariable String id) {
        return ResponseEntity.ok(quizGenerationService.generateQuiz(id));
    }

    // ── GET /api/sessions/{id}/quiz ──────────────────────────────────────────

    @GetMapping("/quiz")
    public ResponseEntity<QuizView> getQuiz(@PathVariable String id) {
        return ResponseEntity.ok(quizAttemptService.getQuiz(id));
    }

    // ── GET /api/sessions/{id}/quiz/attempts ─────────────────────────────────

    @GetMapping("/quiz/attempts")
    public ResponseEntity<List<QuizAttempt>> getAttemptHistory(@PathVariable String id) {
        return ResponseEntity.ok(quizAttemptService.getAttemptHistory(id));
    }

    // ── POST /api/sessions/{id}/quiz/submit ──────────────────────────────────

    @PostMapping("/quiz/submit")
    public ResponseEntity<QuizAttempt> submitQuiz(
            @PathVariable String id,
            @Valid @RequestBody QuizSubmitRequest request) {
        return ResponseEntity.ok(quizAttemptService.submitQuizAnswers(id, request.getAnswers()));
    }
}
