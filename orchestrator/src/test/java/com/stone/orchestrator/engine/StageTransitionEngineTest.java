package com.stone.orchestrator.engine;

import com.stone.orchestrator.TestProperties;
import com.stone.orchestrator.audit.AuditEvaluator;
import com.stone.orchestrator.conflict.ConflictResolver;
import com.stone.orchestrator.forge.ForgeClient;
import com.stone.orchestrator.forge.ForgeException;
import com.stone.orchestrator.forge.dto.GitHubUser;
import com.stone.orchestrator.forge.dto.IssueComment;
import com.stone.orchestrator.model.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * Unit tests for StageTransitionEngine.
 *
 * The forge, audit evaluator and conflict resolver are mocked; each test
 * drives exactly one invocation and checks the label operations it issued.
 */
@ExtendWith(MockitoExtension.class)
class StageTransitionEngineTest {

    private static final long ISSUE = 42;

    @Mock ForgeClient      forge;
    @Mock AuditEvaluator   auditEvaluator;
    @Mock ConflictResolver conflictResolver;
    @Mock HistoryRecorder  history;

    SimpleMeterRegistry   meterRegistry;
    StageTransitionEngine engine;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        engine = new StageTransitionEngine(forge, auditEvaluator, conflictResolver, history,
                TestProperties.defaults(), meterRegistry);
    }

    // ------------------------------------------------------------------
    // Intake / planning
    // ------------------------------------------------------------------

    @Test
    void intake_postsProgressThenSpecification_thenAddsNextBeforeRemovingCurrent() {
        givenIssue("""
                ## Acceptance Criteria
                - Users can log in with email
                - Users see an error on a wrong password
                """, "stone-process");

        WorkflowStage result = engine.processIssue(ISSUE);

        assertThat(result).isEqualTo(WorkflowStage.INTAKE);
        ArgumentCaptor<String> comments = ArgumentCaptor.forClass(String.class);
        InOrder order = inOrder(forge);
        order.verify(forge, times(2)).createComment(eq(ISSUE), comments.capture());
        order.verify(forge).addLabels(ISSUE, List.of("stone-pm"));
        order.verify(forge).removeLabel(ISSUE, "stone-process");

        assertThat(comments.getAllValues().get(0)).startsWith("## Stone Workflow Started");
        String spec = comments.getAllValues().get(1);
        assertThat(spec).startsWith("## Gherkin Specification");
        assertThat(spec.split("Scenario:", -1)).hasSize(3);
        assertThat(spec).contains("Then Users can log in with email")
                        .contains("Then Users see an error on a wrong password");
    }

    @Test
    void planning_withoutSpecification_generatesItAndStays() {
        givenIssue("No criteria here.", "stone-pm");
        when(forge.listComments(ISSUE)).thenReturn(List.of());

        engine.processIssue(ISSUE);

        ArgumentCaptor<String> comments = ArgumentCaptor.forClass(String.class);
        verify(forge, times(2)).createComment(eq(ISSUE), comments.capture());
        assertThat(comments.getAllValues().get(1)).contains("Scenario: Successful implementation");
        verify(forge, never()).addLabels(anyLong(), anyList());
        verify(forge, never()).removeLabel(anyLong(), anyString());
    }

    @Test
    void planning_withSpecification_movesToQa() {
        givenIssue("", "stone-pm");
        when(forge.listComments(ISSUE)).thenReturn(List.of(specComment()));

        engine.processIssue(ISSUE);

        InOrder order = inOrder(forge);
        order.verify(forge).addLabels(ISSUE, List.of("stone-qa"));
        order.verify(forge).removeLabel(ISSUE, "stone-pm");
        verify(history).record(ISSUE, "Workflow Stage: qa-spec");
    }

    @Test
    void interruptedTransition_bothLabelsPresent_repeatsEarlierTransition() {
        givenIssue("", "stone-qa", "stone-pm");
        when(forge.listComments(ISSUE)).thenReturn(List.of(specComment()));

        WorkflowStage result = engine.processIssue(ISSUE);

        assertThat(result).isEqualTo(WorkflowStage.PLANNING);
        verify(forge).addLabels(ISSUE, List.of("stone-qa"));
        verify(forge).removeLabel(ISSUE, "stone-pm");
    }

    @Test
    void simpleStages_advanceOneStep() {
        assertAdvances("stone-qa", "stone-feature-implement");
        assertAdvances("stone-feature-implement", "stone-audit");
        assertAdvances("stone-ready-for-tests", "stone-docs");
        assertAdvances("stone-docs", "stone-pr");
    }

    // ------------------------------------------------------------------
    // Audit
    // ------------------------------------------------------------------

    @Test
    void audit_passed_movesToReadyForTest_andClearsFailedLabel() {
        givenIssue("", "stone-audit", "stone-audit-failed");
        AuditVerdict verdict = verdict(true);
        when(auditEvaluator.evaluate(ISSUE)).thenReturn(verdict);

        engine.processIssue(ISSUE);

        InOrder order = inOrder(auditEvaluator, forge);
        order.verify(auditEvaluator).processAuditResults(ISSUE, verdict);
        order.verify(forge).addLabels(ISSUE, List.of("stone-ready-for-tests"));
        order.verify(forge).removeLabel(ISSUE, "stone-audit");
        verify(forge).removeLabel(ISSUE, "stone-audit-failed");
    }

    @Test
    void audit_failed_addsFailedLabel_andStays() {
        givenIssue("", "stone-audit");
        AuditVerdict verdict = verdict(false);
        when(auditEvaluator.evaluate(ISSUE)).thenReturn(verdict);

        engine.processIssue(ISSUE);

        verify(auditEvaluator).processAuditResults(ISSUE, verdict);
        verify(forge).addLabels(ISSUE, List.of("stone-audit-failed"));
        verify(forge, never()).removeLabel(anyLong(), anyString());
        verify(forge, never()).addLabels(ISSUE, List.of("stone-ready-for-tests"));
    }

    // ------------------------------------------------------------------
    // Pull request / conflicts
    // ------------------------------------------------------------------

    @Test
    void pullRequest_none_staysAndAsksForOne() {
        givenIssue("", "stone-pr");
        when(forge.searchOpenPullRequestsReferencing(ISSUE)).thenReturn(List.of());

        engine.processIssue(ISSUE);

        verify(conflictResolver, never()).detectConflicts(anyLong());
        verify(forge, never()).addLabels(anyLong(), anyList());
        verify(forge).createComment(eq(ISSUE), contains("No open pull request references #42"));
    }

    @Test
    void pullRequest_conflicting_movesToConflictResolution() {
        givenIssue("", "stone-pr");
        when(forge.searchOpenPullRequestsReferencing(ISSUE)).thenReturn(List.of(7L));
        when(conflictResolver.detectConflicts(ISSUE))
                .thenReturn(new ConflictReport("main", "stone/42", true, List.of("src/App.java")));

        engine.processIssue(ISSUE);

        verify(forge).addLabels(ISSUE, List.of("stone-conflict"));
        verify(forge).removeLabel(ISSUE, "stone-pr");
    }

    @Test
    void pullRequest_clean_completes() {
        givenIssue("", "stone-pr");
        when(forge.searchOpenPullRequestsReferencing(ISSUE)).thenReturn(List.of(7L));
        when(conflictResolver.detectConflicts(ISSUE)).thenReturn(ConflictReport.clean("main", "stone/42"));

        engine.processIssue(ISSUE);

        verify(forge).addLabels(ISSUE, List.of("stone-complete"));
        verify(forge).removeLabel(ISSUE, "stone-pr");
    }

    @Test
    void conflictResolution_manualLabelPresent_onlyWaits() {
        givenIssue("", "stone-conflict", "stone-manual-resolution-needed");

        engine.processIssue(ISSUE);

        verifyNoInteractions(conflictResolver);
        verify(forge).createComment(eq(ISSUE), contains("Waiting for manual conflict resolution"));
        verify(forge, never()).addLabels(anyLong(), anyList());
    }

    @Test
    void conflictResolution_resolved_movesToReadyForTest() {
        givenIssue("", "stone-conflict");
        when(conflictResolver.resolveConflicts(ISSUE))
                .thenReturn(ConflictResolutionResult.resolved(List.of("src/App.java")));

        engine.processIssue(ISSUE);

        verify(forge).addLabels(ISSUE, List.of("stone-ready-for-tests"));
        verify(forge).removeLabel(ISSUE, "stone-conflict");
    }

    @Test
    void interruptedMoveToConflictResolution_dropsLeftoverPullRequestLabel() {
        givenIssue("", "stone-pr", "stone-conflict");
        when(conflictResolver.resolveConflicts(ISSUE))
                .thenReturn(ConflictResolutionResult.failed("deleted on feature branch"));

        WorkflowStage result = engine.processIssue(ISSUE);

        assertThat(result).isEqualTo(WorkflowStage.CONFLICT_RESOLUTION);
        InOrder order = inOrder(forge, conflictResolver);
        order.verify(forge).removeLabel(ISSUE, "stone-pr");
        order.verify(conflictResolver).resolveConflicts(ISSUE);
        verify(forge, never()).removeLabel(ISSUE, "stone-conflict");
    }

    @Test
    void waitingForManualResolution_stillDropsLeftoverPullRequestLabel() {
        givenIssue("", "stone-conflict", "stone-pr", "stone-manual-resolution-needed");

        engine.processIssue(ISSUE);

        verify(forge).removeLabel(ISSUE, "stone-pr");
        verifyNoInteractions(conflictResolver);
    }

    @Test
    void conflictResolution_unresolvable_stays() {
        givenIssue("", "stone-conflict");
        when(conflictResolver.resolveConflicts(ISSUE))
                .thenReturn(ConflictResolutionResult.failed("deleted on feature branch"));

        engine.processIssue(ISSUE);

        verify(forge, never()).addLabels(anyLong(), anyList());
        verify(forge, never()).removeLabel(anyLong(), anyString());
    }

    // ------------------------------------------------------------------
    // Terminal, unknown, failures
    // ------------------------------------------------------------------

    @Test
    void complete_isTerminal() {
        givenIssue("", "stone-complete");

        assertThat(engine.processIssue(ISSUE)).isEqualTo(WorkflowStage.COMPLETE);

        verify(history).record(ISSUE, "Workflow complete");
        verify(forge, never()).addLabels(anyLong(), anyList());
        verify(forge, never()).createComment(anyLong(), anyString());
    }

    @Test
    void noStageLabel_recordsHistoryOnly() {
        givenIssue("", "bug");

        WorkflowStage result = engine.processIssue(ISSUE);

        assertThat(result).isEqualTo(WorkflowStage.ERROR);
        assertThat(result.stageName()).isEqualTo("unknown");
        verify(history).record(ISSUE, "Unknown stage");
        verify(forge, never()).createComment(anyLong(), anyString());
        verify(forge, never()).addLabels(anyLong(), anyList());
        verify(forge, never()).removeLabel(anyLong(), anyString());
    }

    @Test
    void forgeFailure_propagatesUnmodified() {
        ForgeException boom = new ForgeException("HTTP 500", 500);
        when(forge.getIssue(ISSUE)).thenThrow(boom);

        assertThatThrownBy(() -> engine.processIssue(ISSUE)).isSameAs(boom);
    }

    @Test
    void processedStage_isCounted_andMdcIsCleared() {
        givenIssue("", "stone-qa");

        engine.processIssue(ISSUE);

        assertThat(meterRegistry.counter("stone.stage.processed", "stage", "qa-spec").count()).isEqualTo(1.0);
        assertThat(MDC.get("issue")).isNull();
        assertThat(MDC.get("stage")).isNull();
    }

    @Test
    void currentStage_isReadOnly() {
        givenIssue("", "stone-docs");

        assertThat(engine.currentStage(ISSUE)).isEqualTo(WorkflowStage.DOCS);
        verify(forge, never()).createComment(anyLong(), anyString());
        verifyNoInteractions(history);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void givenIssue(String body, String... labels) {
        when(forge.getIssue(ISSUE)).thenReturn(new IssueSnapshot(
                ISSUE, "Login", body, true, List.of(labels), Instant.parse("2026-01-01T00:00:00Z"), null));
    }

    private void assertAdvances(String from, String to) {
        clearInvocations(forge);
        givenIssue("", from);

        engine.processIssue(ISSUE);

        InOrder order = inOrder(forge);
        order.verify(forge).addLabels(ISSUE, List.of(to));
        order.verify(forge).removeLabel(ISSUE, from);
    }

    private static IssueComment specComment() {
        return new IssueComment(1, "## Gherkin Specification\n\nFeature: Login", new GitHubUser("stone"), null);
    }

    private static AuditVerdict verdict(boolean passed) {
        return new AuditVerdict(AuditCriteria.none(), new ImplementationVerification(passed, List.of()),
                new CodeQuality(passed, passed, passed), passed, List.of());
    }
}
