package com.universaltasker.orchestrator.agent;

import com.universaltasker.orchestrator.action.InstructionParser;
import com.universaltasker.orchestrator.model.DecisionStatus;

import java.util.List;

/**
 * Deterministic offline decisions, keyed only on the step number.
 * Used whenever the engine is disabled, unreachable, or answers garbage.
 */
public final class StubDecisions {

    private StubDecisions() {}

    public static Decision forStep(int stepNumber) {
        if (stepNumber == 1) {
            return new Decision(
                    "Demo stub: Opening Calculator via Run dialog",
                    "hotkey(win, r); type(\"calc\"); press(enter)",
                    DecisionStatus.CONTINUE,
                    3,
                    List.of(2));
        }
        if (stepNumber == 2) {
            return new Decision(
                    "Demo stub: Typing 'Hello World' in Calculator",
                    "type(\"Hello World\")",
                    DecisionStatus.SUCCESS);
        }
        return new Decision("Goal achieved", InstructionParser.NOOP, DecisionStatus.SUCCESS);
    }
}
