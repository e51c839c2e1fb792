package com.universaltasker.orchestrator.agent;

import com.universaltasker.orchestrator.action.PrimitiveRegistry;
import org.springframework.stereotype.Component;

/**
 * Prompt texts for the four engine calls: decide, translate, verify step, verify goal.
 *
 * The instruction vocabulary is generated from {@link PrimitiveRegistry}, so a new
 * primitive shows up in every prompt without touching this class.
 */
@Component
public class Prompts {

    private final String instructionDocs;

    public Prompts(PrimitiveRegistry registry) {
        this.instructionDocs = registry.buildInstructionDocumentation();
    }

    // ------------------------------------------------------------------
    // Decide
    // ------------------------------------------------------------------

    public String decideSystem(boolean firstStep, String environment) {
        return DECIDE_SYSTEM
                .replace("{{INSTRUCTION_DOCS}}", instructionDocs)
                .replace("{{USER_CONTEXT}}", contextLine(environment))
                .replace("{{FIRST_STEP}}", firstStep ? FIRST_STEP_EXTRA : "")
                .replace("{{EXAMPLE}}", firstStep ? "" : EXAMPLE_RESPONSE);
    }

    public String decideUser(String goal, String historyText, boolean firstStep) {
        String historyBlock = historyText == null || historyText.isBlank()
                ? ""
                : "Steps already taken (for context):\n" + historyText + "\n\n";
        String keys = firstStep
                ? "thought, instruction, status, planned_step_count, checkpoints"
                : "thought, instruction, status";
        return """
                Goal: %s

                %sLook at the screenshot and decide the single next action.
                Reply with one JSON object with keys: %s.""".formatted(goal, historyBlock, keys);
    }

    // ------------------------------------------------------------------
    // Translate
    // ------------------------------------------------------------------

    public String translateSystem(String environment) {
        return TRANSLATE_SYSTEM
                .replace("{{INSTRUCTION_DOCS}}", instructionDocs)
                .replace("{{USER_CONTEXT}}", contextLine(environment));
    }

    public String translateUser(String stepDescription) {
        return "Step: " + stepDescription + "\n\nReply with the instruction only.";
    }

    // ------------------------------------------------------------------
    // Verification
    // ------------------------------------------------------------------

    public String verifyStepSystem(String environment) {
        return VERIFY_STEP_SYSTEM.replace("{{USER_CONTEXT}}", contextLine(environment));
    }

    public String verifyStepUser(String intendedThought, String environment) {
        return contextBlock(environment)
                + "Intended action: " + intendedThought + "\n\n"
                + "Does the screenshot show that this action actually happened?";
    }

    public String verifyGoalSystem(String environment) {
        return VERIFY_GOAL_SYSTEM.replace("{{USER_CONTEXT}}", contextLine(environment));
    }

    public String verifyGoalUser(String goal, String environment) {
        return contextBlock(environment)
                + "Goal: " + goal + "\n\n"
                + "Was what was asked achieved in this screenshot?";
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static String contextLine(String environment) {
        return environment == null || environment.isBlank() ? "" : "\nUser context: " + environment + "\n";
    }

    private static String contextBlock(String environment) {
        return environment == null || environment.isBlank() ? "" : "User context: " + environment + "\n\n";
    }

    // ------------------------------------------------------------------
    // Templates
    // ------------------------------------------------------------------

    private static final String DECIDE_SYSTEM = """
            You are a computer-use agent. You see a screenshot of the user's screen and
            pursue their goal one atomic action at a time.
            {{USER_CONTEXT}}
            {{INSTRUCTION_DOCS}}
            WHAT TO PRODUCE:
            Reply with a single JSON object and nothing else:
              {
                "thought":     "What you see and what the next action is",
                "instruction": "The instruction to run now, or noop",
                "status":      "CONTINUE" | "SUCCESS" | "LOST"
              }

            Use SUCCESS when the goal is visibly achieved after this action, LOST when
            you cannot make progress, CONTINUE otherwise.
            {{FIRST_STEP}}{{EXAMPLE}}""";

    private static final String FIRST_STEP_EXTRA = """

            This is the first step. Also plan the whole task and add:
              "planned_step_count": total number of steps you expect (integer, at least 2)
              "checkpoints":        step numbers after which the screen should be re-checked
            """;

    private static final String EXAMPLE_RESPONSE = """

            Example response:
            {"thought": "Calculator is open. I will type 42.", "instruction": "type(\\"42\\"); press(enter)", "status": "SUCCESS"}
            """;

    private static final String TRANSLATE_SYSTEM = """
            You translate one natural-language step into a single instruction for a
            desktop automation runner.
            {{USER_CONTEXT}}
            {{INSTRUCTION_DOCS}}
            Reply with the instruction text only: no JSON, no explanation.
            """;

    private static final String VERIFY_STEP_SYSTEM = """
            You check whether an intended desktop action visibly happened.
            You are given the intended action and a screenshot taken right after it ran.
            {{USER_CONTEXT}}
            Reply with a single JSON object:
              {"achieved": true | false, "reason": "one short sentence"}
            """;

    private static final String VERIFY_GOAL_SYSTEM = """
            You judge whether a user's goal is visibly satisfied on screen.
            You are given the goal and the final screenshot of the run.
            {{USER_CONTEXT}}
            Reply with a single JSON object:
              {"achieved": true | false, "reason": "one short sentence"}
            """;
}
