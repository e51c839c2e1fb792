package com.universaltasker.orchestrator.agent;

import com.universaltasker.orchestrator.action.ActionExecutor;
import com.universaltasker.orchestrator.capture.CaptureResult;
import com.universaltasker.orchestrator.capture.SnapshotStore;
import com.universaltasker.orchestrator.capture.SnapshotStore.Phase;
import com.universaltasker.orchestrator.environment.EnvironmentDescriber;
import com.universaltasker.orchestrator.model.Session;
import com.universaltasker.orchestrator.model.SessionStatus;
import com.universaltasker.orchestrator.model.StepRecord;
import com.universaltasker.orchestrator.service.SessionService;
import com.universaltasker.orchestrator.translator.ActionTranslator;
import com.universaltasker.orchestrator.verification.VerificationResult;
import com.universaltasker.orchestrator.verification.VisionVerifier;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import java.util.Optional;

/**
 * The observe → decide → act → verify loop, one step per call.
 *
 * For the session's current step this class:
 *   1. Takes a "before" screenshot (failure ends the session in ERROR)
 *   2. Asks the reasoning engine for a decision, or uses the offline stub
 *   3. Fills a no-op instruction from the thought: rule translator first,
 *      then the engine's translate-only call
 *   4. On step 1, adopts the engine's plan length and checkpoints
 *   5. Executes the instruction (a fault ends the session in ERROR, never retried)
 *   6. Takes an "after" screenshot and asks the verifier whether the step
 *      visibly happened (a definite "no" ends the session in ERROR)
 *   7. Takes a validation screenshot on checkpoint steps
 *   8. Persists the step record
 *   9. Applies the decision status
 *
 * Whatever happens, every step leaves exactly one record behind before the
 * session status changes.
 */
@Component
public class StepPipeline {

    private static final Logger log = LoggerFactory.getLogger(StepPipeline.class);

    static final int MIN_BUDGET          = 2;
    static final int FAILURE_DETAIL_LIMIT = 8192;

    private final SnapshotStore        snapshots;
    private final ReasoningClient      reasoning;
    private final ActionTranslator     translator;
    private final ActionExecutor       executor;
    private final VisionVerifier       verifier;
    private final EnvironmentDescriber environment;
    private final SessionService       sessionService;
    private final MeterRegistry        meterRegistry;

    public StepPipeline(SnapshotStore snapshots,
                        ReasoningClient reasoning,
                        ActionTranslator translator,
                        ActionExecutor executor,
                        VisionVerifier verifier,
                        EnvironmentDescriber environment,
                        SessionService sessionService,
                        MeterRegistry meterRegistry) {
        this.snapshots      = snapshots;
        this.reasoning      = reasoning;
        this.translator     = translator;
        this.executor       = executor;
        this.verifier       = verifier;
        this.environment    = environment;
        this.sessionService = sessionService;
        this.meterRegistry  = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    /**
     * Run the current step of {@code run} to completion and return the
     * session's status afterwards. A terminal session is left untouched.
     */
    public SessionStatus advance(SessionRun run) {
        Session session = run.session();
        if (session.getStatus().isTerminal()) {
            return session.getStatus();
        }
        int step = run.stepNumber();

        MDC.put("sessionId", session.getId().toString());
        MDC.put("step",      String.valueOf(step));
        try {
            StepRecord record = new StepRecord(session, step);
            try {
                return runStep(run, record);
            } catch (Exception e) {
                log.error("Unexpected error in step {} of session {}", step, session.getId(), e);
                if (run.lastRecordedStep() < step) {
                    record.fail(failureDetail(e));
                    persistQuietly(run, record);
                }
                return finish(run, SessionStatus.ERROR, "Unexpected error: " + e.getMessage());
            }
        } finally {
            // Pool threads are reused by the scheduler.
            MDC.clear();
        }
    }

    // ------------------------------------------------------------------
    // One step
    // ------------------------------------------------------------------

    private SessionStatus runStep(SessionRun run, StepRecord record) {
        Session session = run.session();
        int step = run.stepNumber();
        String env = environment.describe(session.getBrowserHint());

        // --- 1. Before snapshot ---
        CaptureResult before = snapshots.take(session.getId(), step, Phase.BEFORE);
        record.setSnapshotBeforePath(before.pathOrMarker());
        if (!before.success()) {
            String reason = "Screenshot capture failed: " + before.error();
            record.setThought("Step aborted before a decision was made.");
            record.fail(reason);
            persist(run, record);
            return finish(run, SessionStatus.ERROR, reason);
        }
        run.setLatestSnapshot(before.path());

        // --- 2. Decide ---
        Decision decision = reasoning.decide(session.getGoal(), run.history(), step == 1, env, before.path())
                .orElseGet(() -> {
                    log.info("No usable decision from the engine, using stub for step {}", step);
                    meterRegistry.counter("tasker.reasoning.calls", "result", "stub").increment();
                    return StubDecisions.forStep(step);
                });

        // --- 3. Translate a bare thought into an instruction ---
        String thought = decision.thought();
        if (decision.hasNoopInstruction() && thought != null && !thought.isBlank()) {
            Optional<String> translated = translator.translate(thought, env)
                    .or(() -> reasoning.translateStep(thought, env));
            if (translated.isPresent()) {
                log.info("Translated thought into instruction: {}", translated.get());
                decision = decision.withInstruction(translated.get());
            }
        }
        record.setThought(decision.thought());
        record.setInstruction(decision.instruction());
        record.setDecisionStatus(decision.status());

        // --- 4. First-step plan ---
        if (step == 1) {
            adoptPlan(run, decision);
        }

        // --- 5. Execute ---
        try {
            executor.execute(decision.instruction());
        } catch (Exception e) {
            log.warn("Step {} failed (no retry): {}", step, e.getMessage());
            record.fail(failureDetail(e));
            record.setSnapshotAfterPath(snapshots.take(session.getId(), step, Phase.AFTER).pathOrMarker());
            persist(run, record);
            return finish(run, SessionStatus.ERROR, "Step " + step + " failed: " + e.getMessage());
        }

        // --- 6. After snapshot + step verification ---
        CaptureResult after = snapshots.take(session.getId(), step, Phase.AFTER);
        record.setSnapshotAfterPath(after.pathOrMarker());
        if (after.success()) {
            run.setLatestSnapshot(after.path());
            Optional<VerificationResult> verdict = verifier.verifyStep(decision.thought(), after.path(), env);
            if (verdict.isPresent()) {
                VerificationResult v = verdict.get();
                record.setVerification(v.achieved(), v.reason());
                if (!v.achieved()) {
                    record.fail("Step verification: " + v.reason());
                    persist(run, record);
                    return finish(run, SessionStatus.ERROR, "Step verification failed: " + v.reason());
                }
            }
        } else {
            log.warn("After-step screenshot failed, skipping verification: {}", after.error());
        }

        // --- 7. Checkpoint ---
        if (run.session().getCheckpointList().contains(step)) {
            CaptureResult validation = snapshots.take(session.getId(), step, Phase.VALIDATION);
            log.info("Checkpoint at step {}: validation snapshot {}", step, validation.pathOrMarker());
        }

        // --- 8. Persist ---
        persist(run, record);

        // --- 9. Transition ---
        return switch (decision.status()) {
            case SUCCESS -> finish(run, SessionStatus.SUCCESS, "Goal reported achieved at step " + step);
            case LOST    -> finish(run, SessionStatus.STUCK, "Agent reported it is stuck at step " + step);
            case CONTINUE -> {
                int budget = run.session().getStepBudget();
                if (step + 1 > budget) {
                    yield finish(run, SessionStatus.LOST, "Step budget of " + budget + " exhausted");
                }
                run.nextStep();
                yield SessionStatus.RUNNING;
            }
        };
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void adoptPlan(SessionRun run, Decision decision) {
        Session session = run.session();
        boolean changed = false;
        if (decision.plannedStepCount() != null
                && session.reviseBudget(decision.plannedStepCount(), MIN_BUDGET, run.stepNumber())) {
            log.info("Step budget set to {} (engine planned {})",
                    session.getStepBudget(), decision.plannedStepCount());
            changed = true;
        }
        List<Integer> checkpoints = decision.checkpoints();
        if (!checkpoints.isEmpty()) {
            session.setCheckpointList(checkpoints);
            checkpoints.stream()
                    .filter(c -> c < 1 || c > session.getStepBudget())
                    .forEach(c -> log.warn("Checkpoint {} is outside the step budget of {} and will never fire",
                            c, session.getStepBudget()));
            changed = true;
        }
        if (changed) {
            run.setSession(sessionService.update(session));
        }
    }

    private void persist(SessionRun run, StepRecord record) {
        run.recorded(sessionService.appendStep(record));
    }

    // Used on the unexpected-error path, where the store itself may be the problem.
    private void persistQuietly(SessionRun run, StepRecord record) {
        try {
            persist(run, record);
        } catch (Exception e) {
            log.error("Could not persist failure record for step {}: {}", record.getStepNumber(), e.getMessage());
        }
    }

    private SessionStatus finish(SessionRun run, SessionStatus status, String reason) {
        run.setSession(sessionService.terminate(run.session(), status, reason));
        return run.session().getStatus();
    }

    /** Message plus stack trace, capped so one bad step cannot bloat the audit table. */
    static String failureDetail(Throwable e) {
        StringWriter trace = new StringWriter();
        e.printStackTrace(new PrintWriter(trace));
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        String detail = message + "\n\nTrace:\n" + trace;
        return detail.length() > FAILURE_DETAIL_LIMIT ? detail.substring(0, FAILURE_DETAIL_LIMIT) : detail;
    }
}
