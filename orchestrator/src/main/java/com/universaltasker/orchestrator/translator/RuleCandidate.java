package com.universaltasker.orchestrator.translator;

import com.universaltasker.orchestrator.model.StepOutcome;

/**
 * One (thought, instruction, outcome) group from the audit trail.
 */
public record RuleCandidate(String thought, String instruction, StepOutcome outcome, long count) {}
