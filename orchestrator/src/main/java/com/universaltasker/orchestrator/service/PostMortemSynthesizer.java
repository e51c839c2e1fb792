package com.universaltasker.orchestrator.service;

import com.universaltasker.orchestrator.agent.SessionRun;
import com.universaltasker.orchestrator.environment.EnvironmentDescriber;
import com.universaltasker.orchestrator.model.PostMortem;
import com.universaltasker.orchestrator.model.Session;
import com.universaltasker.orchestrator.model.SessionStatus;
import com.universaltasker.orchestrator.model.StepOutcome;
import com.universaltasker.orchestrator.model.StepRecord;
import com.universaltasker.orchestrator.verification.VerificationResult;
import com.universaltasker.orchestrator.verification.VisionVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns a finished session's failures into an improved prompt for next time.
 */
@Component
public class PostMortemSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(PostMortemSynthesizer.class);

    static final String NO_ERRORS = "No errors encountered.";

    private final SessionService       sessionService;
    private final VisionVerifier       verifier;
    private final EnvironmentDescriber environment;

    public PostMortemSynthesizer(SessionService sessionService,
                                 VisionVerifier verifier,
                                 EnvironmentDescriber environment) {
        this.sessionService = sessionService;
        this.verifier       = verifier;
        this.environment    = environment;
    }

    /**
     * Build and store the post-mortem of a terminal session. If one already
     * exists it is returned as is.
     */
    public PostMortem synthesize(SessionRun run) {
        Session session = run.session();
        Optional<PostMortem> existing = sessionService.postMortem(session.getId());
        if (existing.isPresent()) {
            return existing.get();
        }

        List<StepRecord> steps = sessionService.steps(session.getId());
        PostMortem postMortem = new PostMortem(
                session.getId(),
                session.getGoal(),
                optimizedPrompt(session.getGoal(), steps),
                summary(session, steps));

        if (session.getStatus() == SessionStatus.SUCCESS && run.latestSnapshot().isPresent()) {
            String env = environment.describe(session.getBrowserHint());
            Optional<VerificationResult> validation = run.goalValidation(
                    () -> verifier.verifyGoal(session.getGoal(), run.latestSnapshot().get(), env));
            validation.ifPresentOrElse(
                    v -> postMortem.setValidation(v.achieved(), v.reason()),
                    () -> log.info("Goal validation skipped for session {}", session.getId()));
        }

        PostMortem saved = sessionService.savePostMortem(postMortem);
        log.info("Post-mortem stored for session {}", session.getId());
        return saved;
    }

    // ------------------------------------------------------------------
    // Templates
    // ------------------------------------------------------------------

    static String optimizedPrompt(String goal, List<StepRecord> steps) {
        List<String> notes = steps.stream()
                .filter(PostMortemSynthesizer::isFailure)
                .map(r -> "- Avoided: " + r.getInstruction() + " because " + firstLine(r.getFailureDetail()))
                .collect(Collectors.toList());
        String improvementNotes = notes.isEmpty() ? NO_ERRORS : String.join("\n", notes);

        return """
                OPTIMIZED PROMPT FOR '%s':
                Lessons from the previous attempt:
                %s

                Original Goal: %s""".formatted(goal, improvementNotes, goal);
    }

    static boolean isFailure(StepRecord record) {
        return record.getOutcome() == StepOutcome.FAIL
                || (record.getFailureDetail() != null && record.getFailureDetail().contains("Error"));
    }

    static String summary(Session session, List<StepRecord> steps) {
        return "Session ended %s after %d step(s): %s".formatted(
                session.getStatus().label(), steps.size(),
                session.getStatusReason() == null ? "no reason recorded" : session.getStatusReason());
    }

    // Stack traces stay in the audit trail; the prompt only cites the message.
    private static String firstLine(String detail) {
        if (detail == null || detail.isBlank()) return "no detail recorded";
        int nl = detail.indexOf('\n');
        return (nl < 0 ? detail : detail.substring(0, nl)).strip();
    }
}
