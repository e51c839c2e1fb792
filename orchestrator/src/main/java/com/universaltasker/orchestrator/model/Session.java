package com.universaltasker.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * One run of the loop toward one goal.
 *
 * The step budget may be revised exactly once, on the first decision, to the
 * engine's declared plan length. Status only ever moves out of RUNNING.
 *
 * DB table: sessions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "sessions")
public class Session {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String goal;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SessionStatus status = SessionStatus.RUNNING;

    @Column(name = "step_budget", nullable = false)
    private int stepBudget;

    // Set once from the first decision; null when the engine did not declare one.
    @Column(name = "planned_step_count")
    private Integer plannedStepCount;

    @Column(name = "budget_revised", nullable = false)
    private boolean budgetRevised = false;

    // Comma-separated step numbers, e.g. "2,4".
    @Column(name = "checkpoints")
    private String checkpoints;

    @Column(name = "browser_hint")
    private String browserHint;

    // One-line human-readable reason for the terminal state.
    @Column(name = "status_reason", columnDefinition = "TEXT")
    private String statusReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected Session() {}   // required by JPA

    public Session(String goal, int stepBudget, String browserHint) {
        this.goal        = goal;
        this.stepBudget  = stepBudget;
        this.browserHint = browserHint;
    }

    // ------------------------------------------------------------------
    // State transitions
    // ------------------------------------------------------------------

    /**
     * Move to a terminal status. Calls on an already-terminal session are ignored,
     * which keeps the terminal state idempotent.
     *
     * @return true if the status changed
     */
    public boolean terminate(SessionStatus terminal, String reason) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        if (status.isTerminal()) return false;
        this.status       = terminal;
        this.statusReason = reason;
        return true;
    }

    /**
     * Adopt the engine's plan length as the new budget. Only the first call has any
     * effect. The result is never below {@code floor} nor below {@code currentStep}.
     */
    public boolean reviseBudget(int planned, int floor, int currentStep) {
        if (budgetRevised || planned <= 0) return false;
        this.plannedStepCount = planned;
        this.stepBudget       = Math.max(Math.max(floor, planned), currentStep);
        this.budgetRevised    = true;
        return true;
    }

    public List<Integer> getCheckpointList() {
        if (checkpoints == null || checkpoints.isBlank()) return List.of();
        return Arrays.stream(checkpoints.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .map(Integer::valueOf)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    public void setCheckpointList(List<Integer> values) {
        this.checkpoints = (values == null || values.isEmpty())
                ? null
                : values.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()               { return id; }
    public String        getGoal()             { return goal; }
    public SessionStatus getStatus()           { return status; }
    public int           getStepBudget()       { return stepBudget; }
    public Integer       getPlannedStepCount() { return plannedStepCount; }
    public boolean       isBudgetRevised()     { return budgetRevised; }
    public String        getBrowserHint()      { return browserHint; }
    public String        getStatusReason()     { return statusReason; }
    public Instant       getCreatedAt()        { return createdAt; }
    public Instant       getUpdatedAt()        { return updatedAt; }
}
