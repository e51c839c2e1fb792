package com.universaltasker.orchestrator.repository;

import com.universaltasker.orchestrator.model.StepRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.UUID;

/**
 * Append + read-back for the step_records table.
 */
public interface StepRecordRepository extends JpaRepository<StepRecord, UUID> {

    /** The audit trail of one session, in step order. */
    List<StepRecord> findBySessionIdOrderByStepNumberAsc(UUID sessionId);

    boolean existsBySessionIdAndStepNumber(UUID sessionId, int stepNumber);

    /**
     * Steps that executed something real, grouped for rule ingestion.
     * Each row is {thought, instruction, outcome, count}, most frequent first.
     */
    @Query("""
            SELECT r.thought, r.instruction, r.outcome, COUNT(r)
            FROM StepRecord r
            WHERE r.instruction IS NOT NULL
              AND TRIM(r.instruction) <> ''
              AND LOWER(TRIM(r.instruction)) NOT IN ('noop', 'pass')
            GROUP BY r.thought, r.instruction, r.outcome
            ORDER BY COUNT(r) DESC, r.thought ASC
            """)
    List<Object[]> groupExecutedInstructions();
}
