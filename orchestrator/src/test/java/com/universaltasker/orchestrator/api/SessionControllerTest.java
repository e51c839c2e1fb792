package com.universaltasker.orchestrator.api;

import com.universaltasker.orchestrator.TestSessions;
import com.universaltasker.orchestrator.model.*;
import com.universaltasker.orchestrator.service.SessionConflictException;
import com.universaltasker.orchestrator.service.SessionRunner;
import com.universaltasker.orchestrator.service.SessionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for SessionController.
 *
 * @WebMvcTest spins up only the web layer (no DB, no scheduler, no engine).
 */
@WebMvcTest(SessionController.class)
class SessionControllerTest {

    @Autowired MockMvc        mockMvc;
    @MockitoBean SessionService sessionService;
    @MockitoBean SessionRunner  runner;

    // ------------------------------------------------------------------
    // POST /sessions
    // ------------------------------------------------------------------

    @Test
    void start_validRequest_returns201() throws Exception {
        Session session = TestSessions.session("Open Calculator and compute 3+3", 5);
        when(runner.start("Open Calculator and compute 3+3", 5, null)).thenReturn(session);

        mockMvc.perform(post("/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"goal":"  Open Calculator and compute 3+3 ","stepBudget":5,"browser":" "}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(session.getId().toString()))
                .andExpect(jsonPath("$.status").value("running"))
                .andExpect(jsonPath("$.stepBudget").value(5));
    }

    @Test
    void start_noBudget_usesDefault() throws Exception {
        Session session = TestSessions.session("goal", 10);
        when(runner.start("goal", 10, "Firefox")).thenReturn(session);

        mockMvc.perform(post("/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"goal":"goal","browser":"Firefox"}
                                """))
                .andExpect(status().isCreated());
    }

    @Test
    void start_blankGoal_returns400() throws Exception {
        mockMvc.perform(post("/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"goal":"   "}
                                """))
                .andExpect(status().isBadRequest());

        verify(runner, never()).start(any(), anyInt(), any());
    }

    @Test
    void start_budgetOutOfRange_returns400() throws Exception {
        mockMvc.perform(post("/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"goal":"goal","stepBudget":0}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void start_anotherSessionRunning_returns409() throws Exception {
        when(runner.start(eq("goal"), anyInt(), isNull()))
                .thenThrow(new SessionConflictException("Session x is still running"));

        mockMvc.perform(post("/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"goal":"goal"}
                                """))
                .andExpect(status().isConflict());
    }

    // ------------------------------------------------------------------
    // GET /sessions[/{id}]
    // ------------------------------------------------------------------

    @Test
    void recent_listsSessions() throws Exception {
        Session done = TestSessions.session("a", 3);
        done.terminate(SessionStatus.STUCK, "Agent reported it is stuck at step 1");
        when(sessionService.recent()).thenReturn(List.of(done, TestSessions.session("b", 3)));

        mockMvc.perform(get("/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].status").value("stuck"))
                .andExpect(jsonPath("$[0].statusReason").value("Agent reported it is stuck at step 1"));
    }

    @Test
    void getSession_existingId_returns200WithCheckpoints() throws Exception {
        Session session = TestSessions.session("goal", 3);
        session.setCheckpointList(List.of(2, 3));
        when(sessionService.find(session.getId())).thenReturn(Optional.of(session));

        mockMvc.perform(get("/sessions/{id}", session.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.checkpoints[0]").value(2))
                .andExpect(jsonPath("$.checkpoints[1]").value(3));
    }

    @Test
    void getSession_unknownId_returns404() throws Exception {
        when(sessionService.find(any())).thenReturn(Optional.empty());

        mockMvc.perform(get("/sessions/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound());
    }

    @Test
    void getSteps_returnsAuditTrailInOrder() throws Exception {
        Session session = TestSessions.session("goal", 3);
        StepRecord first = TestSessions.step(session, 1, "Open the Run dialog", "hotkey(win, r)", StepOutcome.PASS, null);
        first.setDecisionStatus(DecisionStatus.CONTINUE);
        StepRecord second = TestSessions.step(session, 2, "Click", "click(1, 2)", StepOutcome.FAIL, "boom");
        when(sessionService.find(session.getId())).thenReturn(Optional.of(session));
        when(sessionService.steps(session.getId())).thenReturn(List.of(first, second));

        mockMvc.perform(get("/sessions/{id}/steps", session.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].stepNumber").value(1))
                .andExpect(jsonPath("$[0].action").value("Open the Run dialog"))
                .andExpect(jsonPath("$[0].decisionStatus").value("CONTINUE"))
                .andExpect(jsonPath("$[1].outcome").value("FAIL"))
                .andExpect(jsonPath("$[1].failureDetail").value("boom"));
    }

    @Test
    void getSteps_unknownSession_returns404() throws Exception {
        when(sessionService.find(any())).thenReturn(Optional.empty());

        mockMvc.perform(get("/sessions/{id}/steps", UUID.randomUUID()))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // GET /sessions/{id}/post-mortem
    // ------------------------------------------------------------------

    @Test
    void getPostMortem_available_returns200() throws Exception {
        Session session = TestSessions.session("goal", 3);
        PostMortem pm = new PostMortem(session.getId(), "goal", "OPTIMIZED PROMPT FOR 'goal'", "summary");
        when(sessionService.find(session.getId())).thenReturn(Optional.of(session));
        when(sessionService.postMortem(session.getId())).thenReturn(Optional.of(pm));

        mockMvc.perform(get("/sessions/{id}/post-mortem", session.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.optimizedPrompt").value("OPTIMIZED PROMPT FOR 'goal'"));
    }

    @Test
    void getPostMortem_notYetWritten_returns202() throws Exception {
        Session session = TestSessions.session("goal", 3);
        when(sessionService.find(session.getId())).thenReturn(Optional.of(session));
        when(sessionService.postMortem(session.getId())).thenReturn(Optional.empty());

        mockMvc.perform(get("/sessions/{id}/post-mortem", session.getId()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.sessionStatus").value("running"));
    }

    // ------------------------------------------------------------------
    // POST /sessions/active/advance
    // ------------------------------------------------------------------

    @Test
    void advance_running_returnsSession() throws Exception {
        Session session = TestSessions.session("goal", 3);
        when(runner.advanceActive()).thenReturn(Optional.of(session));

        mockMvc.perform(post("/sessions/active/advance"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(session.getId().toString()));
    }

    @Test
    void advance_nothingRunning_returns404() throws Exception {
        when(runner.advanceActive()).thenReturn(Optional.empty());

        mockMvc.perform(post("/sessions/active/advance"))
                .andExpect(status().isNotFound());
    }

    @Test
    void advance_stepInProgress_returns409() throws Exception {
        when(runner.advanceActive()).thenThrow(new SessionConflictException("A step is already in progress"));

        mockMvc.perform(post("/sessions/active/advance"))
                .andExpect(status().isConflict());
    }
}
