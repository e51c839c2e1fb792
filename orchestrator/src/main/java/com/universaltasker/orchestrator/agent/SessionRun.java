package com.universaltasker.orchestrator.agent;

import com.universaltasker.orchestrator.model.Session;
import com.universaltasker.orchestrator.model.StepRecord;
import com.universaltasker.orchestrator.verification.VerificationResult;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * In-memory state of one session while it runs: the current step number,
 * the records written so far, and the latest screenshot.
 *
 * Owned by one caller at a time; the runner serialises access.
 */
public class SessionRun {

    private Session          session;
    private int              stepNumber = 1;
    private final List<StepRecord> history = new ArrayList<>();
    private Path             latestSnapshot;

    private boolean                      goalChecked;
    private Optional<VerificationResult> goalValidation = Optional.empty();

    public SessionRun(Session session) {
        this.session = session;
    }

    public Session session()    { return session; }
    public int     stepNumber() { return stepNumber; }

    public List<StepRecord> history() {
        return Collections.unmodifiableList(history);
    }

    /** Step number of the last persisted record, 0 when none. */
    public int lastRecordedStep() {
        return history.isEmpty() ? 0 : history.get(history.size() - 1).getStepNumber();
    }

    public Optional<Path> latestSnapshot() {
        return Optional.ofNullable(latestSnapshot);
    }

    void setSession(Session session)     { this.session = session; }
    public void setLatestSnapshot(Path path) { this.latestSnapshot = path; }
    void recorded(StepRecord record)      { history.add(record); }
    void nextStep()                       { stepNumber++; }

    /**
     * End-of-run goal validation, computed at most once per run.
     */
    public Optional<VerificationResult> goalValidation(Supplier<Optional<VerificationResult>> check) {
        if (!goalChecked) {
            goalValidation = check.get();
            goalChecked = true;
        }
        return goalValidation;
    }
}
