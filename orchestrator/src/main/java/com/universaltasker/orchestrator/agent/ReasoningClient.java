package com.universaltasker.orchestrator.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.universaltasker.orchestrator.minimax.MiniMaxClient;
import com.universaltasker.orchestrator.model.StepRecord;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Logical contract to the reasoning engine.
 *
 * Every failure mode (disabled, timeout, HTTP error, unparseable reply) comes
 * back as Optional.empty(); the caller owns the fallback.
 */
@Component
public class ReasoningClient {

    private static final Logger log = LoggerFactory.getLogger(ReasoningClient.class);

    private static final int DECIDE_MAX_TOKENS    = 1024;
    private static final int TRANSLATE_MAX_TOKENS = 256;

    private final MiniMaxClient  engine;
    private final Prompts        prompts;
    private final MeterRegistry  meterRegistry;
    private final Duration       decideTimeout;
    private final Duration       translateTimeout;

    public ReasoningClient(MiniMaxClient engine,
                           Prompts prompts,
                           MeterRegistry meterRegistry,
                           @Value("${tasker.reasoning.timeout:60s}") Duration decideTimeout,
                           @Value("${tasker.verification.timeout:30s}") Duration translateTimeout) {
        this.engine           = engine;
        this.prompts          = prompts;
        this.meterRegistry    = meterRegistry;
        this.decideTimeout    = decideTimeout;
        this.translateTimeout = translateTimeout;
    }

    public boolean isEnabled() {
        return engine.isEnabled();
    }

    /**
     * Ask the engine for the next step.
     *
     * @param history  prior records of this session, oldest first
     * @param snapshot "before" screenshot to attach, may be null
     */
    public Optional<Decision> decide(String goal, List<StepRecord> history, boolean firstStep,
                                     String environment, Path snapshot) {
        if (!engine.isEnabled()) return Optional.empty();

        String reply;
        try {
            reply = engine.complete(
                    prompts.decideSystem(firstStep, environment),
                    prompts.decideUser(goal, formatHistory(history), firstStep),
                    snapshot, decideTimeout, DECIDE_MAX_TOKENS);
        } catch (Exception e) {
            log.warn("Reasoning request failed: {}", e.getMessage());
            count("none");
            return Optional.empty();
        }

        Optional<JsonNode> parsed = ReplyParser.extractObject(reply);
        if (parsed.isEmpty()) {
            log.warn("Reasoning reply could not be parsed as JSON. Raw: {}", truncate(reply, 300));
            count("none");
            return Optional.empty();
        }

        Decision decision = Decision.fromReply(parsed.get(), firstStep);
        log.info("Next step: thought={} instruction={} status={}",
                truncate(decision.thought(), 200), truncate(decision.instruction(), 300), decision.status());
        count("parsed");
        return Optional.of(decision);
    }

    /**
     * Translate-only call: turn a step description into an instruction.
     * Empty when disabled, failed, or the reply is blank.
     */
    public Optional<String> translateStep(String stepDescription, String environment) {
        if (!engine.isEnabled() || stepDescription == null || stepDescription.isBlank()) {
            return Optional.empty();
        }
        try {
            String reply = engine.complete(
                    prompts.translateSystem(environment),
                    prompts.translateUser(stepDescription.strip()),
                    null, translateTimeout, TRANSLATE_MAX_TOKENS);
            return ReplyParser.stripFences(reply);
        } catch (Exception e) {
            log.warn("Step translation request failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** One line per prior step, trimmed so long sessions stay within the prompt budget. */
    static String formatHistory(List<StepRecord> history) {
        if (history == null || history.isEmpty()) return "";
        return history.stream()
                .map(r -> "Step %d: thought=%s instruction=%s status=%s outcome=%s".formatted(
                        r.getStepNumber(),
                        truncate(r.getThought(), 200),
                        truncate(r.getInstruction(), 150),
                        r.getDecisionStatus() == null ? "" : r.getDecisionStatus().name(),
                        r.getOutcome() == null ? "" : r.getOutcome().name()))
                .collect(Collectors.joining("\n"));
    }

    static String truncate(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : text.substring(0, max);
    }

    private void count(String result) {
        meterRegistry.counter("tasker.reasoning.calls", "result", result).increment();
    }
}
