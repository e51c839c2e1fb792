package com.universaltasker.orchestrator.api.dto;

import com.universaltasker.orchestrator.model.StepRecord;

import java.time.Instant;

/**
 * Read-only view of one audit record returned by GET /sessions/{id}/steps.
 */
public record StepRecordResponse(
        int     stepNumber,
        String  thought,
        String  instruction,
        String  action,
        String  decisionStatus,
        String  outcome,
        String  failureDetail,
        String  snapshotBefore,
        String  snapshotAfter,
        Boolean verificationAchieved,
        String  verificationReason,
        Instant createdAt
) {
    public static StepRecordResponse from(StepRecord r) {
        return new StepRecordResponse(
                r.getStepNumber(),
                r.getThought(),
                r.getInstruction(),
                r.getActionSummary(),
                r.getDecisionStatus() == null ? null : r.getDecisionStatus().name(),
                r.getOutcome().name(),
                r.getFailureDetail(),
                r.getSnapshotBeforePath(),
                r.getSnapshotAfterPath(),
                r.getVerificationAchieved(),
                r.getVerificationReason(),
                r.getCreatedAt()
        );
    }
}
