package com.universaltasker.orchestrator.model;

/** Execution outcome recorded on every StepRecord. */
public enum StepOutcome {
    PASS,
    FAIL
}
