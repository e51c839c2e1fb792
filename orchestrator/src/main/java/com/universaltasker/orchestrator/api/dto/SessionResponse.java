package com.universaltasker.orchestrator.api.dto;

import com.universaltasker.orchestrator.model.Session;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response body for POST /sessions and GET /sessions[/{id}].
 */
public record SessionResponse(
        UUID          id,
        String        goal,
        String        status,
        String        statusReason,
        int           stepBudget,
        Integer       plannedStepCount,
        List<Integer> checkpoints,
        String        browser,
        Instant       createdAt,
        Instant       updatedAt
) {
    public static SessionResponse from(Session s) {
        return new SessionResponse(
                s.getId(),
                s.getGoal(),
                s.getStatus().label(),
                s.getStatusReason(),
                s.getStepBudget(),
                s.getPlannedStepCount(),
                s.getCheckpointList(),
                s.getBrowserHint(),
                s.getCreatedAt(),
                s.getUpdatedAt()
        );
    }
}
