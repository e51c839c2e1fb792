package com.universaltasker.orchestrator.service;

import com.universaltasker.orchestrator.TestSessions;
import com.universaltasker.orchestrator.model.PostMortem;
import com.universaltasker.orchestrator.model.Session;
import com.universaltasker.orchestrator.model.SessionStatus;
import com.universaltasker.orchestrator.model.StepOutcome;
import com.universaltasker.orchestrator.model.StepRecord;
import com.universaltasker.orchestrator.repository.PostMortemRepository;
import com.universaltasker.orchestrator.repository.SessionRepository;
import com.universaltasker.orchestrator.repository.StepRecordRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionServiceTest {

    @Mock SessionRepository    sessionRepo;
    @Mock StepRecordRepository stepRepo;
    @Mock PostMortemRepository postMortemRepo;

    SimpleMeterRegistry meters;
    SessionService      service;

    @BeforeEach
    void setUp() {
        meters  = new SimpleMeterRegistry();
        service = new SessionService(sessionRepo, stepRepo, postMortemRepo, meters);
    }

    @Test
    void start_savesRunningSession() {
        when(sessionRepo.save(any(Session.class))).thenAnswer(inv -> inv.getArgument(0));

        Session session = service.start("compute 3+3", 10, "Firefox");

        assertThat(session.getStatus()).isEqualTo(SessionStatus.RUNNING);
        assertThat(session.getStepBudget()).isEqualTo(10);
        assertThat(session.getBrowserHint()).isEqualTo("Firefox");
    }

    // ------------------------------------------------------------------
    // terminate
    // ------------------------------------------------------------------

    @Test
    void terminate_running_savesAndCounts() {
        Session session = TestSessions.session("goal", 3);
        when(sessionRepo.save(session)).thenReturn(session);

        Session result = service.terminate(session, SessionStatus.LOST, "Step budget of 3 exhausted");

        assertThat(result.getStatus()).isEqualTo(SessionStatus.LOST);
        assertThat(result.getStatusReason()).isEqualTo("Step budget of 3 exhausted");
        assertThat(meters.counter("tasker.session.terminal", "status", "lost").count()).isEqualTo(1.0);
    }

    @Test
    void terminate_alreadyTerminal_isIgnored() {
        Session session = TestSessions.session("goal", 3);
        session.terminate(SessionStatus.SUCCESS, "done");

        Session result = service.terminate(session, SessionStatus.ERROR, "late failure");

        assertThat(result.getStatus()).isEqualTo(SessionStatus.SUCCESS);
        assertThat(result.getStatusReason()).isEqualTo("done");
        verify(sessionRepo, never()).save(any());
    }

    @Test
    void terminate_nonTerminalStatus_throws() {
        Session session = TestSessions.session("goal", 3);

        assertThatThrownBy(() -> service.terminate(session, SessionStatus.RUNNING, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failInterrupted_marksRunningSessionsError() {
        Session a = TestSessions.session("a", 3);
        Session b = TestSessions.session("b", 3);
        when(sessionRepo.findByStatus(SessionStatus.RUNNING)).thenReturn(List.of(a, b));
        when(sessionRepo.save(any(Session.class))).thenAnswer(inv -> inv.getArgument(0));

        assertThat(service.failInterrupted()).isEqualTo(2);

        assertThat(a.getStatus()).isEqualTo(SessionStatus.ERROR);
        assertThat(b.getStatusReason()).isEqualTo("Interrupted by a restart");
    }

    // ------------------------------------------------------------------
    // appendStep
    // ------------------------------------------------------------------

    @Test
    void appendStep_new_savesAndCountsOutcome() {
        Session session = TestSessions.session("goal", 3);
        StepRecord record = TestSessions.step(session, 1, "t", "press(win)", StepOutcome.FAIL, "boom");
        when(stepRepo.existsBySessionIdAndStepNumber(session.getId(), 1)).thenReturn(false);
        when(stepRepo.save(record)).thenReturn(record);

        assertThat(service.appendStep(record)).isSameAs(record);
        assertThat(meters.counter("tasker.step.outcomes", "outcome", "fail").count()).isEqualTo(1.0);
    }

    @Test
    void appendStep_duplicateStepNumber_isRejected() {
        Session session = TestSessions.session("goal", 3);
        StepRecord record = TestSessions.step(session, 2, "t", "noop", StepOutcome.PASS, null);
        when(stepRepo.existsBySessionIdAndStepNumber(session.getId(), 2)).thenReturn(true);

        assertThatThrownBy(() -> service.appendStep(record))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Step 2");
        verify(stepRepo, never()).save(any());
    }

    // ------------------------------------------------------------------
    // Post-mortems
    // ------------------------------------------------------------------

    @Test
    void savePostMortem_existing_isKept() {
        Session session = TestSessions.session("goal", 3);
        PostMortem first  = new PostMortem(session.getId(), "goal", "first", "s");
        PostMortem second = new PostMortem(session.getId(), "goal", "second", "s");
        when(postMortemRepo.findBySessionId(session.getId())).thenReturn(Optional.of(first));

        assertThat(service.savePostMortem(second)).isSameAs(first);
        verify(postMortemRepo, never()).save(any());
    }

    @Test
    void savePostMortem_new_isSaved() {
        Session session = TestSessions.session("goal", 3);
        PostMortem pm = new PostMortem(session.getId(), "goal", "prompt", "s");
        when(postMortemRepo.findBySessionId(session.getId())).thenReturn(Optional.empty());
        when(postMortemRepo.save(pm)).thenReturn(pm);

        assertThat(service.savePostMortem(pm)).isSameAs(pm);
    }
}
