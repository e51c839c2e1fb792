package com.universaltasker.orchestrator.verification;

import com.fasterxml.jackson.databind.JsonNode;
import com.universaltasker.orchestrator.agent.Prompts;
import com.universaltasker.orchestrator.agent.ReplyParser;
import com.universaltasker.orchestrator.minimax.MiniMaxClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Vision-grounded checks against a screenshot.
 *
 * verifyStep runs after every executed step; verifyGoal once at the end of a
 * successful run. Both return empty when the verdict is unknown (engine off,
 * no image, transport fault, unparseable reply).
 */
@Component
public class VisionVerifier {

    private static final Logger log = LoggerFactory.getLogger(VisionVerifier.class);

    private static final int MAX_TOKENS = 256;

    private final MiniMaxClient engine;
    private final Prompts       prompts;
    private final Duration      timeout;

    public VisionVerifier(MiniMaxClient engine,
                          Prompts prompts,
                          @Value("${tasker.verification.timeout:30s}") Duration timeout) {
        this.engine  = engine;
        this.prompts = prompts;
        this.timeout = timeout;
    }

    /** Did the action described by {@code intendedThought} visibly happen? */
    public Optional<VerificationResult> verifyStep(String intendedThought, Path afterSnapshot, String environment) {
        return ask("Step verification",
                prompts.verifyStepSystem(environment),
                prompts.verifyStepUser(intendedThought, environment),
                afterSnapshot);
    }

    /** Is the goal visibly satisfied on the final screen? */
    public Optional<VerificationResult> verifyGoal(String goal, Path finalSnapshot, String environment) {
        return ask("Goal validation",
                prompts.verifyGoalSystem(environment),
                prompts.verifyGoalUser(goal, environment),
                finalSnapshot);
    }

    private Optional<VerificationResult> ask(String what, String system, String user, Path image) {
        if (!engine.isEnabled() || image == null || !Files.isReadable(image)) {
            return Optional.empty();
        }
        String reply;
        try {
            reply = engine.complete(system, user, image, timeout, MAX_TOKENS);
        } catch (Exception e) {
            log.warn("{} request failed: {}", what, e.getMessage());
            return Optional.empty();
        }
        Optional<JsonNode> parsed = ReplyParser.extractObject(reply);
        if (parsed.isEmpty()) {
            log.warn("{} reply could not be parsed", what);
            return Optional.empty();
        }
        VerificationResult result = VerificationResult.fromReply(parsed.get());
        log.info("{}: achieved={} reason={}", what, result.achieved(), result.reason());
        return Optional.of(result);
    }
}
