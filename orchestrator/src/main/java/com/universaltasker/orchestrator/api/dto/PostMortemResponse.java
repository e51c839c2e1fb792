package com.universaltasker.orchestrator.api.dto;

import com.universaltasker.orchestrator.model.PostMortem;

import java.time.Instant;
import java.util.UUID;

public record PostMortemResponse(
        UUID    sessionId,
        String  originalGoal,
        String  optimizedPrompt,
        String  summary,
        Boolean validationAchieved,
        String  validationReason,
        Instant createdAt
) {
    public static PostMortemResponse from(PostMortem p) {
        return new PostMortemResponse(
                p.getSessionId(),
                p.getOriginalGoal(),
                p.getOptimizedPrompt(),
                p.getSummary(),
                p.getValidationAchieved(),
                p.getValidationReason(),
                p.getCreatedAt()
        );
    }
}
