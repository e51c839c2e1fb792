package com.universaltasker.orchestrator.model;

/**
 * Status the reasoning engine attaches to each decision.
 */
public enum DecisionStatus {
    CONTINUE,
    SUCCESS,
    LOST;

    /**
     * Case-insensitive parse; null, blank and unknown values all become CONTINUE.
     */
    public static DecisionStatus parse(String raw) {
        if (raw == null || raw.isBlank()) return CONTINUE;
        return switch (raw.strip().toUpperCase()) {
            case "SUCCESS" -> SUCCESS;
            case "LOST"    -> LOST;
            default        -> CONTINUE;
        };
    }
}
