package com.stone.orchestrator.api;

import com.stone.orchestrator.conflict.ConflictResolutionException;
import com.stone.orchestrator.conflict.ConflictResolver;
import com.stone.orchestrator.engine.StageTransitionEngine;
import com.stone.orchestrator.forge.ForgeException;
import com.stone.orchestrator.model.ConflictReport;
import com.stone.orchestrator.model.WorkflowStage;
import com.stone.orchestrator.runner.WorkflowRunner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for IssueController.
 *
 * Only the web layer starts; the runner, engine and resolver are mocks.
 */
@WebMvcTest(IssueController.class)
class IssueControllerTest {

    @Autowired MockMvc mockMvc;

    @MockitoBean WorkflowRunner        runner;
    @MockitoBean StageTransitionEngine engine;
    @MockitoBean ConflictResolver      conflictResolver;

    @Test
    void process_returnsStageTheIssueWasIn() throws Exception {
        when(runner.process(42)).thenReturn(WorkflowStage.INTAKE);

        mockMvc.perform(post("/issues/42/process"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.issue").value(42))
                .andExpect(jsonPath("$.stage").value("intake"));
    }

    @Test
    void stage_unknownIssue_returns404() throws Exception {
        when(engine.currentStage(404)).thenThrow(new ForgeException("Not Found", 404));

        mockMvc.perform(get("/issues/404/stage"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("forge"));
    }

    @Test
    void stage_noStageLabel_reportsUnknown() throws Exception {
        when(engine.currentStage(5)).thenReturn(WorkflowStage.ERROR);

        mockMvc.perform(get("/issues/5/stage"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stage").value("unknown"));
    }

    @Test
    void process_forgeOutage_returns502() throws Exception {
        when(runner.process(42)).thenThrow(new ForgeException("HTTP 503", 503));

        mockMvc.perform(post("/issues/42/process"))
                .andExpect(status().isBadGateway());
    }

    @Test
    void resolveConflicts_missingIssue_returns404() throws Exception {
        when(runner.resolveConflicts(404)).thenThrow(new ForgeException("Not Found", 404));

        mockMvc.perform(post("/issues/404/conflicts/resolve"))
                .andExpect(status().isNotFound());
    }

    @Test
    void resolveConflicts_gitFailure_returns502() throws Exception {
        when(runner.resolveConflicts(7)).thenThrow(new ConflictResolutionException("rebase failed", null));

        mockMvc.perform(post("/issues/7/conflicts/resolve"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("conflict"));
    }

    @Test
    void conflicts_returnsReport() throws Exception {
        when(conflictResolver.detectConflicts(7))
                .thenReturn(new ConflictReport("main", "stone/7", true, List.of("src/App.java")));

        mockMvc.perform(get("/issues/7/conflicts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hasConflicts").value(true))
                .andExpect(jsonPath("$.conflictingPaths[0]").value("src/App.java"));
    }

    @Test
    void feedback_nothingFound_returnsNullIssue() throws Exception {
        when(runner.feedback(42)).thenReturn(Optional.empty());

        mockMvc.perform(post("/issues/42/feedback"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.feedbackIssue").doesNotExist());
    }

    @Test
    void mergeStatus_returns202() throws Exception {
        mockMvc.perform(post("/issues/42/merge-status"))
                .andExpect(status().isAccepted());
    }
}
