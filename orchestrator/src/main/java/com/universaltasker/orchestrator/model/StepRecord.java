package com.universaltasker.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Audit trail of one step: what the engine thought, what ran, and how it went.
 *
 * Rows are insert-only. The pipeline fills a record in memory while the step
 * runs and hands it to the store exactly once.
 *
 * DB table: step_records  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "step_records",
       uniqueConstraints = @UniqueConstraint(columnNames = {"session_id", "step_number"}))
public class StepRecord {

    private static final int SUMMARY_LIMIT = 120;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "session_id", nullable = false)
    private Session session;

    @Column(name = "step_number", nullable = false)
    private int stepNumber;

    @Column(columnDefinition = "TEXT")
    private String thought;

    @Column(columnDefinition = "TEXT")
    private String instruction;

    @Column(name = "action_summary", columnDefinition = "TEXT")
    private String actionSummary;

    // Null when the step died before a decision was made (capture fault).
    @Enumerated(EnumType.STRING)
    @Column(name = "decision_status")
    private DecisionStatus decisionStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StepOutcome outcome = StepOutcome.PASS;

    @Column(name = "failure_detail", columnDefinition = "TEXT")
    private String failureDetail;

    @Column(name = "snapshot_before_path")
    private String snapshotBeforePath;

    @Column(name = "snapshot_after_path")
    private String snapshotAfterPath;

    // Null when the verifier was unavailable (unknown, not a failure).
    @Column(name = "verification_achieved")
    private Boolean verificationAchieved;

    @Column(name = "verification_reason", columnDefinition = "TEXT")
    private String verificationReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected StepRecord() {}   // required by JPA

    public StepRecord(Session session, int stepNumber) {
        this.session    = session;
        this.stepNumber = stepNumber;
    }

    /** Sets the thought and derives the short action summary shown in listings. */
    public void setThought(String thought) {
        this.thought = thought;
        if (thought == null || thought.isBlank()) {
            this.actionSummary = "—";
        } else if (thought.length() > SUMMARY_LIMIT) {
            this.actionSummary = thought.substring(0, SUMMARY_LIMIT) + "…";
        } else {
            this.actionSummary = thought;
        }
    }

    /** Marks the step failed with the given detail. */
    public void fail(String detail) {
        this.outcome       = StepOutcome.FAIL;
        this.failureDetail = detail;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID           getId()                   { return id; }
    public Session        getSession()              { return session; }
    public int            getStepNumber()           { return stepNumber; }
    public String         getThought()              { return thought; }
    public String         getInstruction()          { return instruction; }
    public String         getActionSummary()        { return actionSummary; }
    public DecisionStatus getDecisionStatus()       { return decisionStatus; }
    public StepOutcome    getOutcome()              { return outcome; }
    public String         getFailureDetail()        { return failureDetail; }
    public String         getSnapshotBeforePath()   { return snapshotBeforePath; }
    public String         getSnapshotAfterPath()    { return snapshotAfterPath; }
    public Boolean        getVerificationAchieved() { return verificationAchieved; }
    public String         getVerificationReason()   { return verificationReason; }
    public Instant        getCreatedAt()            { return createdAt; }

    public void setInstruction(String instruction)          { this.instruction = instruction; }
    public void setDecisionStatus(DecisionStatus status)    { this.decisionStatus = status; }
    public void setSnapshotBeforePath(String path)          { this.snapshotBeforePath = path; }
    public void setSnapshotAfterPath(String path)           { this.snapshotAfterPath = path; }

    public void setVerification(boolean achieved, String reason) {
        this.verificationAchieved = achieved;
        this.verificationReason   = reason;
    }
}
