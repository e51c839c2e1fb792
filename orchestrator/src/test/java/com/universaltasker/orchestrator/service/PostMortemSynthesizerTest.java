package com.universaltasker.orchestrator.service;

import com.universaltasker.orchestrator.TestSessions;
import com.universaltasker.orchestrator.agent.SessionRun;
import com.universaltasker.orchestrator.environment.EnvironmentDescriber;
import com.universaltasker.orchestrator.model.PostMortem;
import com.universaltasker.orchestrator.model.Session;
import com.universaltasker.orchestrator.model.SessionStatus;
import com.universaltasker.orchestrator.model.StepOutcome;
import com.universaltasker.orchestrator.model.StepRecord;
import com.universaltasker.orchestrator.verification.VerificationResult;
import com.universaltasker.orchestrator.verification.VisionVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PostMortemSynthesizerTest {

    @Mock SessionService       sessionService;
    @Mock VisionVerifier       verifier;
    @Mock EnvironmentDescriber environment;

    PostMortemSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        synthesizer = new PostMortemSynthesizer(sessionService, verifier, environment);
    }

    private void noExistingPostMortem(Session session, List<StepRecord> steps) {
        when(sessionService.postMortem(session.getId())).thenReturn(Optional.empty());
        when(sessionService.steps(session.getId())).thenReturn(steps);
        when(sessionService.savePostMortem(any())).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void synthesize_errorSession_citesFailedInstruction() {
        Session session = TestSessions.session("open calculator", 5);
        session.terminate(SessionStatus.ERROR, "Step 2 failed: [BAD_ARGUMENT] Coordinates out of bounds");
        List<StepRecord> steps = List.of(
                TestSessions.step(session, 1, "Open run", "hotkey(win, r)", StepOutcome.PASS, null),
                TestSessions.step(session, 2, "Click", "click(99999, 99999)", StepOutcome.FAIL,
                        "[BAD_ARGUMENT] Coordinates out of bounds\n\nTrace:\njava.lang..."));
        noExistingPostMortem(session, steps);

        PostMortem pm = synthesizer.synthesize(new SessionRun(session));

        assertThat(pm.getOptimizedPrompt()).isEqualTo("""
                OPTIMIZED PROMPT FOR 'open calculator':
                Lessons from the previous attempt:
                - Avoided: click(99999, 99999) because [BAD_ARGUMENT] Coordinates out of bounds

                Original Goal: open calculator""");
        assertThat(pm.getSummary()).isEqualTo(
                "Session ended error after 2 step(s): Step 2 failed: [BAD_ARGUMENT] Coordinates out of bounds");
        assertThat(pm.getValidationAchieved()).isNull();
        verifyNoInteractions(verifier);
    }

    @Test
    void synthesize_cleanSuccess_validatesGoalOnce() {
        Session session = TestSessions.session("compute 3+3", 5);
        session.terminate(SessionStatus.SUCCESS, "Goal reported achieved at step 2");
        noExistingPostMortem(session, List.of(
                TestSessions.step(session, 1, "t", "press(win)", StepOutcome.PASS, null)));
        when(environment.describe(any())).thenReturn("Windows 11");
        when(verifier.verifyGoal(eq("compute 3+3"), eq(Path.of("final.png")), eq("Windows 11")))
                .thenReturn(Optional.of(new VerificationResult(true, "Display shows 6")));
        SessionRun run = new SessionRun(session);
        run.setLatestSnapshot(Path.of("final.png"));

        PostMortem pm = synthesizer.synthesize(run);

        assertThat(pm.getOptimizedPrompt()).contains(PostMortemSynthesizer.NO_ERRORS);
        assertThat(pm.getValidationAchieved()).isTrue();
        assertThat(pm.getValidationReason()).isEqualTo("Display shows 6");

        run.goalValidation(() -> { throw new AssertionError("must not validate twice"); });
        verify(verifier, times(1)).verifyGoal(any(), any(), any());
    }

    @Test
    void synthesize_successWithoutSnapshot_skipsValidation() {
        Session session = TestSessions.session("goal", 5);
        session.terminate(SessionStatus.SUCCESS, "done");
        noExistingPostMortem(session, List.of());

        PostMortem pm = synthesizer.synthesize(new SessionRun(session));

        assertThat(pm.getValidationAchieved()).isNull();
        verifyNoInteractions(verifier);
    }

    @Test
    void synthesize_existing_isReturnedUnchanged() {
        Session session = TestSessions.session("goal", 5);
        session.terminate(SessionStatus.STUCK, "stuck");
        PostMortem existing = new PostMortem(session.getId(), "goal", "old", "old");
        when(sessionService.postMortem(session.getId())).thenReturn(Optional.of(existing));

        assertThat(synthesizer.synthesize(new SessionRun(session))).isSameAs(existing);
        verify(sessionService, never()).savePostMortem(any());
    }

    @Test
    void isFailure_onlyFailedSteps() {
        Session session = TestSessions.session("goal", 5);
        StepRecord failed = TestSessions.step(session, 1, "t", "press(a)", StepOutcome.FAIL, "TimeoutError: late");
        StepRecord clean = TestSessions.step(session, 2, "t", "press(b)", StepOutcome.PASS, null);

        assertThat(PostMortemSynthesizer.isFailure(failed)).isTrue();
        assertThat(PostMortemSynthesizer.isFailure(clean)).isFalse();
    }

    @Test
    void optimizedPrompt_multipleFailures_oneLineEach() {
        Session session = TestSessions.session("g", 5);
        String prompt = PostMortemSynthesizer.optimizedPrompt("g", List.of(
                TestSessions.step(session, 1, "t", "press(a)", StepOutcome.FAIL, "first"),
                TestSessions.step(session, 2, "t", "press(b)", StepOutcome.FAIL, null)));

        assertThat(prompt).contains("- Avoided: press(a) because first\n- Avoided: press(b) because no detail recorded");
    }
}
