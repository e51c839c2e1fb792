package com.universaltasker.orchestrator.model;

/**
 * Lifecycle of one Session.
 *
 * Transitions:
 *   RUNNING → SUCCESS  (engine reported SUCCESS)
 *   RUNNING → STUCK    (engine reported LOST)
 *   RUNNING → LOST     (step budget exhausted while still CONTINUE)
 *   RUNNING → ERROR    (capture fault, execution fault, or failed step verification)
 *
 * Every state except RUNNING is terminal; nothing ever returns to RUNNING.
 */
public enum SessionStatus {
    RUNNING,
    SUCCESS,
    STUCK,
    LOST,
    ERROR;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    /** Lower-case form stored in the sessions table and shown to users. */
    public String label() {
        return name().toLowerCase();
    }
}
