package com.universaltasker.orchestrator.service;

import com.universaltasker.orchestrator.model.PostMortem;
import com.universaltasker.orchestrator.model.Session;
import com.universaltasker.orchestrator.model.SessionStatus;
import com.universaltasker.orchestrator.model.StepRecord;
import com.universaltasker.orchestrator.repository.PostMortemRepository;
import com.universaltasker.orchestrator.repository.SessionRepository;
import com.universaltasker.orchestrator.repository.StepRecordRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence side of the session lifecycle: sessions, their step audit trail,
 * and post-mortems.
 *
 * Each write is its own transaction so a step record is durable before the
 * pipeline moves on to the next stage.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final SessionRepository    sessionRepo;
    private final StepRecordRepository stepRepo;
    private final PostMortemRepository postMortemRepo;
    private final MeterRegistry        meterRegistry;

    public SessionService(SessionRepository sessionRepo,
                          StepRecordRepository stepRepo,
                          PostMortemRepository postMortemRepo,
                          MeterRegistry meterRegistry) {
        this.sessionRepo    = sessionRepo;
        this.stepRepo       = stepRepo;
        this.postMortemRepo = postMortemRepo;
        this.meterRegistry  = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Sessions
    // ------------------------------------------------------------------

    @Transactional
    public Session start(String goal, int stepBudget, String browserHint) {
        Session session = sessionRepo.save(new Session(goal, stepBudget, browserHint));
        log.info("Session {} started: budget={} goal={}", session.getId(), stepBudget, goal);
        return session;
    }

    /** Persist budget/checkpoint changes made on the first step. */
    @Transactional
    public Session update(Session session) {
        return sessionRepo.save(session);
    }

    /**
     * Move a session to a terminal status. A session that is already terminal
     * is returned unchanged.
     */
    @Transactional
    public Session terminate(Session session, SessionStatus status, String reason) {
        if (!session.terminate(status, reason)) {
            log.debug("Session {} already {}, ignoring {}", session.getId(), session.getStatus(), status);
            return session;
        }
        Session saved = sessionRepo.save(session);
        meterRegistry.counter("tasker.session.terminal", "status", status.label()).increment();
        log.info("Session {} → {}: {}", saved.getId(), status.label(), reason);
        return saved;
    }

    /**
     * Sessions still marked running in the store cannot be resumed after a
     * restart: their in-memory history is gone. Mark them failed.
     */
    @Transactional
    public int failInterrupted() {
        List<Session> orphans = sessionRepo.findByStatus(SessionStatus.RUNNING);
        for (Session session : orphans) {
            log.warn("Session {} was still running at startup, marking error", session.getId());
            terminate(session, SessionStatus.ERROR, "Interrupted by a restart");
        }
        return orphans.size();
    }

    @Transactional(readOnly = true)
    public Optional<Session> find(UUID id) {
        return sessionRepo.findById(id);
    }

    /** Used by GET /sessions. */
    @Transactional(readOnly = true)
    public List<Session> recent() {
        return sessionRepo.findTop50ByOrderByCreatedAtDesc();
    }

    // ------------------------------------------------------------------
    // Step records
    // ------------------------------------------------------------------

    /**
     * Append one step record. Records are insert-only: a second record for the
     * same step number is rejected.
     */
    @Transactional
    public StepRecord appendStep(StepRecord record) {
        UUID sessionId = record.getSession().getId();
        if (stepRepo.existsBySessionIdAndStepNumber(sessionId, record.getStepNumber())) {
            throw new IllegalStateException(
                    "Step %d of session %s already recorded".formatted(record.getStepNumber(), sessionId));
        }
        StepRecord saved = stepRepo.save(record);
        meterRegistry.counter("tasker.step.outcomes", "outcome", saved.getOutcome().name().toLowerCase()).increment();
        return saved;
    }

    /** Used by GET /sessions/{id}/steps and the post-mortem. */
    @Transactional(readOnly = true)
    public List<StepRecord> steps(UUID sessionId) {
        return stepRepo.findBySessionIdOrderByStepNumberAsc(sessionId);
    }

    // ------------------------------------------------------------------
    // Post-mortems
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<PostMortem> postMortem(UUID sessionId) {
        return postMortemRepo.findBySessionId(sessionId);
    }

    /** Write-once: an existing post-mortem for the session wins. */
    @Transactional
    public PostMortem savePostMortem(PostMortem postMortem) {
        Optional<PostMortem> existing = postMortemRepo.findBySessionId(postMortem.getSessionId());
        if (existing.isPresent()) {
            log.debug("Post-mortem for session {} already exists, keeping it", postMortem.getSessionId());
            return existing.get();
        }
        return postMortemRepo.save(postMortem);
    }
}
