package com.universaltasker.orchestrator.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request body for POST /sessions.
 *
 * Required: goal
 * Optional: stepBudget (1..100, defaults to tasker.session.default-step-budget),
 *           browser (hint passed to the engine, e.g. "Firefox")
 */
public record StartSessionRequest(
        @NotBlank String goal,
        @Min(1) @Max(100) Integer stepBudget,
        String browser
) {
    public StartSessionRequest {
        if (goal != null) goal = goal.strip();
        if (browser != null && browser.isBlank()) browser = null;
    }
}
