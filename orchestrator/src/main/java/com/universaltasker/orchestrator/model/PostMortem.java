package com.universaltasker.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Lessons learned from one finished session. At most one row per session.
 *
 * DB table: post_mortems  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "post_mortems")
public class PostMortem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "session_id", nullable = false, unique = true, updatable = false)
    private UUID sessionId;

    @Column(name = "original_goal", columnDefinition = "TEXT")
    private String originalGoal;

    @Column(name = "optimized_prompt", columnDefinition = "TEXT")
    private String optimizedPrompt;

    @Column(columnDefinition = "TEXT")
    private String summary;

    // Null when end-of-run validation was skipped or unavailable.
    @Column(name = "validation_achieved")
    private Boolean validationAchieved;

    @Column(name = "validation_reason", columnDefinition = "TEXT")
    private String validationReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected PostMortem() {}   // required by JPA

    public PostMortem(UUID sessionId, String originalGoal, String optimizedPrompt, String summary) {
        this.sessionId       = sessionId;
        this.originalGoal    = originalGoal;
        this.optimizedPrompt = optimizedPrompt;
        this.summary         = summary;
    }

    public UUID    getId()                 { return id; }
    public UUID    getSessionId()          { return sessionId; }
    public String  getOriginalGoal()       { return originalGoal; }
    public String  getOptimizedPrompt()    { return optimizedPrompt; }
    public String  getSummary()            { return summary; }
    public Boolean getValidationAchieved() { return validationAchieved; }
    public String  getValidationReason()   { return validationReason; }
    public Instant getCreatedAt()          { return createdAt; }

    public void setValidation(boolean achieved, String reason) {
        this.validationAchieved = achieved;
        this.validationReason   = reason;
    }
}
