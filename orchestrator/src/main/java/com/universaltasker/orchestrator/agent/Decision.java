package com.universaltasker.orchestrator.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.universaltasker.orchestrator.action.InstructionParser;
import com.universaltasker.orchestrator.model.DecisionStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * The engine's structured output for one step.
 *
 * {@code plannedStepCount} and {@code checkpoints} are only read on the first
 * step of a session; on later steps they are null and empty.
 */
public record Decision(String thought,
                       String instruction,
                       DecisionStatus status,
                       Integer plannedStepCount,
                       List<Integer> checkpoints) {

    public static final String DEFAULT_THOUGHT = "No thought.";

    public Decision {
        checkpoints = checkpoints == null ? List.of() : List.copyOf(checkpoints);
    }

    public Decision(String thought, String instruction, DecisionStatus status) {
        this(thought, instruction, status, null, List.of());
    }

    /** Same decision with a different instruction. */
    public Decision withInstruction(String newInstruction) {
        return new Decision(thought, newInstruction, status, plannedStepCount, checkpoints);
    }

    public boolean hasNoopInstruction() {
        return InstructionParser.isNoop(instruction);
    }

    /**
     * Build a decision from a parsed reply object, filling defaults:
     * missing thought → {@value #DEFAULT_THOUGHT}, missing instruction → no-op,
     * unknown status → CONTINUE.
     */
    public static Decision fromReply(JsonNode reply, boolean firstStep) {
        String thought = firstText(reply, "thought", "reasoning");
        String instruction = firstText(reply, "instruction", "code");
        DecisionStatus status = DecisionStatus.parse(firstText(reply, "status"));

        if (thought == null) thought = DEFAULT_THOUGHT;
        if (instruction == null) instruction = InstructionParser.NOOP;

        if (!firstStep) {
            return new Decision(thought, instruction, status);
        }
        JsonNode planned = reply.has("planned_step_count")
                ? reply.get("planned_step_count")
                : reply.get("total_steps");
        return new Decision(thought, instruction, status,
                positiveInt(planned), integerList(reply.get("checkpoints")));
    }

    // First non-blank value among the given keys, as text.
    private static String firstText(JsonNode reply, String... keys) {
        for (String key : keys) {
            JsonNode value = reply.get(key);
            if (value == null || value.isNull()) continue;
            String text = value.isValueNode() ? value.asText() : value.toString();
            if (!text.isBlank()) return text.strip();
        }
        return null;
    }

    static Integer positiveInt(JsonNode node) {
        if (node == null || node.isNull()) return null;
        int value;
        if (node.isNumber()) {
            value = node.intValue();
        } else if (node.isTextual()) {
            try {
                value = Integer.parseInt(node.asText().strip());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return value > 0 ? value : null;
    }

    static List<Integer> integerList(JsonNode node) {
        List<Integer> values = new ArrayList<>();
        if (node == null || !node.isArray()) return values;
        for (JsonNode item : node) {
            if (item.isNumber()) values.add(item.intValue());
        }
        return values;
    }
}
