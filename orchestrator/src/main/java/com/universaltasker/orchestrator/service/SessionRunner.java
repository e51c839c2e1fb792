package com.universaltasker.orchestrator.service;

import com.universaltasker.orchestrator.agent.SessionRun;
import com.universaltasker.orchestrator.agent.StepPipeline;
import com.universaltasker.orchestrator.model.Session;
import com.universaltasker.orchestrator.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single active-session slot and triggers its steps.
 *
 * Steps are advanced either by the fixed-delay tick (when auto-advance is on)
 * or by an explicit call from the API. The lock guarantees two steps of the
 * same session never overlap.
 */
@Component
@EnableScheduling
public class SessionRunner {

    private static final Logger log = LoggerFactory.getLogger(SessionRunner.class);

    private final SessionService        sessionService;
    private final StepPipeline          pipeline;
    private final PostMortemSynthesizer postMortems;
    private final boolean               autoAdvance;

    private final ReentrantLock stepLock = new ReentrantLock();
    private volatile SessionRun active;

    public SessionRunner(SessionService sessionService,
                         StepPipeline pipeline,
                         PostMortemSynthesizer postMortems,
                         @Value("${tasker.runner.auto-advance:true}") boolean autoAdvance) {
        this.sessionService = sessionService;
        this.pipeline       = pipeline;
        this.postMortems    = postMortems;
        this.autoAdvance    = autoAdvance;
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * Start a new session in the active slot.
     *
     * @throws SessionConflictException if another session is still running
     */
    public synchronized Session start(String goal, int stepBudget, String browserHint) {
        if (active != null) {
            throw new SessionConflictException(
                    "Session " + active.session().getId() + " is still running");
        }
        Session session = sessionService.start(goal, stepBudget, browserHint);
        active = new SessionRun(session);
        return session;
    }

    public Optional<Session> activeSession() {
        SessionRun run = active;
        return run == null ? Optional.empty() : Optional.of(run.session());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void failInterruptedSessions() {
        int count = sessionService.failInterrupted();
        if (count > 0) {
            log.warn("Marked {} interrupted session(s) as error", count);
        }
    }

    // ------------------------------------------------------------------
    // Triggers
    // ------------------------------------------------------------------

    /**
     * Run exactly one step of the active session.
     *
     * @return the session after the step, or empty when nothing is running
     * @throws SessionConflictException if a step is already in progress
     */
    public Optional<Session> advanceActive() {
        if (active == null) return Optional.empty();
        if (!stepLock.tryLock()) {
            throw new SessionConflictException("A step is already in progress");
        }
        try {
            return Optional.ofNullable(advanceOnce());
        } finally {
            stepLock.unlock();
        }
    }

    /**
     * Tick: advance the active session by one step, if there is one and no
     * step is already running.
     */
    @Scheduled(fixedDelayString = "${tasker.runner.tick-delay-ms:1500}")
    public void tick() {
        if (!autoAdvance || active == null || !stepLock.tryLock()) return;
        try {
            advanceOnce();
        } finally {
            stepLock.unlock();
        }
    }

    // Caller holds stepLock.
    private Session advanceOnce() {
        SessionRun run = active;
        if (run == null) return null;

        SessionStatus status;
        try {
            status = pipeline.advance(run);
        } catch (Exception e) {
            log.error("Unhandled error advancing session {}: {}", run.session().getId(), e.getMessage(), e);
            status = SessionStatus.ERROR;
            try {
                sessionService.terminate(run.session(), SessionStatus.ERROR, "Unhandled error: " + e.getMessage());
            } catch (Exception inner) {
                log.error("Could not mark session {} as error: {}", run.session().getId(), inner.getMessage());
            }
        }

        if (status.isTerminal()) {
            complete(run);
        }
        return run.session();
    }

    private void complete(SessionRun run) {
        try {
            postMortems.synthesize(run);
        } catch (Exception e) {
            log.warn("Could not synthesize post-mortem for session {}: {}",
                    run.session().getId(), e.getMessage());
        } finally {
            active = null;
        }
    }
}
