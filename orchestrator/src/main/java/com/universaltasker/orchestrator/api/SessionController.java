package com.universaltasker.orchestrator.api;

import com.universaltasker.orchestrator.api.dto.PostMortemResponse;
import com.universaltasker.orchestrator.api.dto.SessionResponse;
import com.universaltasker.orchestrator.api.dto.StartSessionRequest;
import com.universaltasker.orchestrator.api.dto.StepRecordResponse;
import com.universaltasker.orchestrator.model.Session;
import com.universaltasker.orchestrator.service.SessionConflictException;
import com.universaltasker.orchestrator.service.SessionRunner;
import com.universaltasker.orchestrator.service.SessionService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for the session lifecycle.
 *
 * POST /sessions                  start a session in the active slot
 * GET  /sessions                  50 most recent sessions
 * GET  /sessions/{id}             one session
 * GET  /sessions/{id}/steps       its step audit trail
 * GET  /sessions/{id}/post-mortem  lessons learned, once synthesized
 * POST /sessions/active/advance   run exactly one step of the active session
 */
@RestController
@RequestMapping("/sessions")
public class SessionController {

    private final SessionService sessionService;
    private final SessionRunner  runner;
    private final int            defaultStepBudget;

    public SessionController(SessionService sessionService,
                             SessionRunner runner,
                             @Value("${tasker.session.default-step-budget:10}") int defaultStepBudget) {
        this.sessionService    = sessionService;
        this.runner            = runner;
        this.defaultStepBudget = defaultStepBudget;
    }

    /**
     * Start a session.
     *
     * Example:
     *   curl -X POST http://localhost:8080/sessions \
     *     -H "Content-Type: application/json" \
     *     -d '{"goal":"Open Calculator and compute 3+3","stepBudget":5}'
     */
    @PostMapping
    public ResponseEntity<SessionResponse> start(@Valid @RequestBody StartSessionRequest req) {
        int budget = req.stepBudget() == null ? defaultStepBudget : req.stepBudget();
        try {
            Session session = runner.start(req.goal(), budget, req.browser());
            return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.from(session));
        } catch (SessionConflictException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    @GetMapping
    public List<SessionResponse> recent() {
        return sessionService.recent().stream()
                .map(SessionResponse::from)
                .toList();
    }

    /**
     * Returns 404 if the session ID is not found.
     */
    @GetMapping("/{id}")
    public SessionResponse getSession(@PathVariable UUID id) {
        return sessionService.find(id)
                .map(SessionResponse::from)
                .orElseThrow(() -> notFound(id));
    }

    @GetMapping("/{id}/steps")
    public List<StepRecordResponse> getSteps(@PathVariable UUID id) {
        sessionService.find(id).orElseThrow(() -> notFound(id));
        return sessionService.steps(id).stream()
                .map(StepRecordResponse::from)
                .toList();
    }

    /**
     * HTTP 200  post-mortem available
     * HTTP 202  session still running or post-mortem not yet written
     * HTTP 404  session ID not found
     */
    @GetMapping("/{id}/post-mortem")
    public ResponseEntity<?> getPostMortem(@PathVariable UUID id) {
        Session session = sessionService.find(id).orElseThrow(() -> notFound(id));
        return sessionService.postMortem(id)
                .<ResponseEntity<?>>map(p -> ResponseEntity.ok(PostMortemResponse.from(p)))
                .orElseGet(() -> ResponseEntity.accepted()
                        .body(Map.of("status", "pending", "sessionStatus", session.getStatus().label())));
    }

    /**
     * Manual trigger: run one step of the active session.
     * 404 when no session is running, 409 when a step is already in progress.
     */
    @PostMapping("/active/advance")
    public SessionResponse advance() {
        try {
            return runner.advanceActive()
                    .map(SessionResponse::from)
                    .orElseThrow(() -> new ResponseStatusException(
                            HttpStatus.NOT_FOUND, "No session is running"));
        } catch (SessionConflictException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    private static ResponseStatusException notFound(UUID id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found: " + id);
    }
}
