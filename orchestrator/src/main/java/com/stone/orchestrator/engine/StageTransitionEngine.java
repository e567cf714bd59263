package com.stone.orchestrator.engine;

import com.stone.orchestrator.audit.AuditEvaluator;
import com.stone.orchestrator.config.StoneProperties;
import com.stone.orchestrator.conflict.ConflictResolver;
import com.stone.orchestrator.forge.ForgeClient;
import com.stone.orchestrator.model.AuditVerdict;
import com.stone.orchestrator.model.ConflictReport;
import com.stone.orchestrator.model.ConflictResolutionResult;
import com.stone.orchestrator.model.IssueSnapshot;
import com.stone.orchestrator.model.SpecificationScenario;
import com.stone.orchestrator.model.WorkflowStage;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Advances one issue by at most one stage per invocation.
 *
 * The issue's labels are the only workflow state. Every handler follows the
 * same order: post a progress comment, do the stage's work, add the next
 * stage label, then remove the current one. A crash between the last two
 * steps leaves both labels on the issue; the matcher prefers the earlier
 * stage, so the next invocation simply repeats the transition. The one
 * backward edge, pull request to conflict resolution, lands on the earlier
 * stage instead, so the conflict resolution handler finishes it by removing
 * any later stage label still on the issue.
 *
 * Nothing here is synchronised. Two concurrent invocations on the same issue
 * may both act; callers that care must serialise per issue.
 */
@Service
public class StageTransitionEngine {

    private static final Logger log = LoggerFactory.getLogger(StageTransitionEngine.class);

    private final ForgeClient              forge;
    private final AuditEvaluator           auditEvaluator;
    private final ConflictResolver         conflictResolver;
    private final HistoryRecorder          history;
    private final StoneProperties.Labels   labels;
    private final StageMatcher             matcher;
    private final MeterRegistry            meterRegistry;

    public StageTransitionEngine(ForgeClient forge,
                                 AuditEvaluator auditEvaluator,
                                 ConflictResolver conflictResolver,
                                 HistoryRecorder history,
                                 StoneProperties properties,
                                 MeterRegistry meterRegistry) {
        this.forge            = forge;
        this.auditEvaluator   = auditEvaluator;
        this.conflictResolver = conflictResolver;
        this.history          = history;
        this.labels           = properties.labels();
        this.matcher          = new StageMatcher(properties.labels());
        this.meterRegistry    = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /**
     * Reads the issue, dispatches on its current stage and performs that
     * stage's work.
     *
     * @return the stage the issue was in when the invocation started
     * @throws com.stone.orchestrator.forge.ForgeException unmodified, on any forge failure
     */
    public WorkflowStage processIssue(long issueNumber) {
        IssueSnapshot issue = forge.getIssue(issueNumber);
        WorkflowStage stage = matcher.match(issue.labels());

        MDC.put("issue", String.valueOf(issueNumber));
        MDC.put("stage", stage.stageName());
        try {
            log.info("Processing issue #{} in stage {}", issueNumber, stage.stageName());
            switch (stage) {
                case INTAKE              -> handleIntake(issue);
                case PLANNING            -> handlePlanning(issue);
                case QA_SPEC             -> handleQaSpec(issue);
                case IMPLEMENTATION      -> handleImplementation(issue);
                case AUDIT               -> handleAudit(issue);
                case CONFLICT_RESOLUTION -> handleConflictResolution(issue);
                case READY_FOR_TEST      -> handleReadyForTest(issue);
                case DOCS                -> handleDocs(issue);
                case PULL_REQUEST        -> handlePullRequest(issue);
                case COMPLETE            -> history.record(issueNumber, "Workflow complete");
                case ERROR               -> {
                    log.warn("Issue #{} carries no recognised stage label", issueNumber);
                    history.record(issueNumber, "Unknown stage");
                }
            }
            meterRegistry.counter("stone.stage.processed", "stage", stage.stageName()).increment();
            return stage;
        } finally {
            MDC.remove("stage");
            MDC.remove("issue");
        }
    }

    /** Read-only: the stage the issue is in right now. */
    public WorkflowStage currentStage(long issueNumber) {
        return matcher.match(forge.getIssue(issueNumber).labels());
    }

    // ------------------------------------------------------------------
    // Stage handlers
    // ------------------------------------------------------------------

    private void handleIntake(IssueSnapshot issue) {
        forge.createComment(issue.number(), """
                ## Stone Workflow Started

                This issue is now tracked by the Stone workflow. \
                A Gherkin specification is being generated from the description.""");
        postSpecification(issue);
        transition(issue, WorkflowStage.INTAKE, WorkflowStage.PLANNING);
    }

    private void handlePlanning(IssueSnapshot issue) {
        boolean specified = GherkinSpecification.find(forge.listComments(issue.number())).isPresent();
        if (!specified) {
            forge.createComment(issue.number(), """
                    ## Planning Stage

                    No Gherkin specification found on this issue; generating one now.""");
            postSpecification(issue);
            history.record(issue.number(), "Specification generated");
            return;
        }
        forge.createComment(issue.number(), """
                ## Planning Stage

                The specification is in place. Moving to QA to define the test plan.""");
        transition(issue, WorkflowStage.PLANNING, WorkflowStage.QA_SPEC);
    }

    private void handleQaSpec(IssueSnapshot issue) {
        forge.createComment(issue.number(), """
                ## QA Stage

                Test scenarios follow the Gherkin specification above. \
                Moving to implementation.""");
        transition(issue, WorkflowStage.QA_SPEC, WorkflowStage.IMPLEMENTATION);
    }

    private void handleImplementation(IssueSnapshot issue) {
        forge.createComment(issue.number(), """
                ## Implementation Stage

                Implementation recorded. The pull request will now be audited \
                against the specification and quality thresholds.""");
        transition(issue, WorkflowStage.IMPLEMENTATION, WorkflowStage.AUDIT);
    }

    private void handleAudit(IssueSnapshot issue) {
        forge.createComment(issue.number(), """
                ## Audit Stage

                Auditing the implementation against the specification and quality thresholds.""");
        AuditVerdict verdict = auditEvaluator.evaluate(issue.number());
        auditEvaluator.processAuditResults(issue.number(), verdict);

        if (verdict.passed()) {
            transition(issue, WorkflowStage.AUDIT, WorkflowStage.READY_FOR_TEST);
            if (issue.hasLabel(labels.auditFailed())) {
                forge.removeLabel(issue.number(), labels.auditFailed());
            }
        } else {
            log.info("Audit failed for issue #{}; staying in audit", issue.number());
            if (!issue.hasLabel(labels.auditFailed())) {
                forge.addLabels(issue.number(), List.of(labels.auditFailed()));
            }
            history.record(issue.number(), "Audit failed");
        }
    }

    private void handleConflictResolution(IssueSnapshot issue) {
        removeLaterStageLabels(issue, WorkflowStage.CONFLICT_RESOLUTION);
        if (issue.hasLabel(labels.manualResolutionNeeded())) {
            forge.createComment(issue.number(), """
                    ## Conflict Resolution Stage

                    Waiting for manual conflict resolution. Remove the `%s` label \
                    once the branch has been updated.""".formatted(labels.manualResolutionNeeded()));
            return;
        }
        forge.createComment(issue.number(), """
                ## Conflict Resolution Stage

                Attempting to rebase the feature branch onto the base branch.""");
        ConflictResolutionResult result = conflictResolver.resolveConflicts(issue.number());
        if (result.success()) {
            transition(issue, WorkflowStage.CONFLICT_RESOLUTION, WorkflowStage.READY_FOR_TEST);
        } else {
            history.record(issue.number(), "Manual conflict resolution needed");
        }
    }

    private void handleReadyForTest(IssueSnapshot issue) {
        forge.createComment(issue.number(), """
                ## Ready for Testing

                The implementation passed the audit. Moving to documentation.""");
        transition(issue, WorkflowStage.READY_FOR_TEST, WorkflowStage.DOCS);
    }

    private void handleDocs(IssueSnapshot issue) {
        forge.createComment(issue.number(), """
                ## Documentation Stage

                Documentation recorded. Moving to pull request review.""");
        transition(issue, WorkflowStage.DOCS, WorkflowStage.PULL_REQUEST);
    }

    private void handlePullRequest(IssueSnapshot issue) {
        forge.createComment(issue.number(), """
                ## Pull Request Stage

                Looking for the pull request that implements this issue.""");
        List<Long> pullRequests = forge.searchOpenPullRequestsReferencing(issue.number());
        if (pullRequests.isEmpty()) {
            forge.createComment(issue.number(), """
                    No open pull request references #%d yet. \
                    Open one that mentions this issue in its description.""".formatted(issue.number()));
            return;
        }

        ConflictReport report = conflictResolver.detectConflicts(issue.number());
        if (report.hasConflicts()) {
            log.info("PR #{} for issue #{} conflicts with {}",
                    pullRequests.get(0), issue.number(), report.baseRef());
            transition(issue, WorkflowStage.PULL_REQUEST, WorkflowStage.CONFLICT_RESOLUTION);
        } else {
            forge.createComment(issue.number(), "Pull request #%d is ready. Workflow complete."
                    .formatted(pullRequests.get(0)));
            transition(issue, WorkflowStage.PULL_REQUEST, WorkflowStage.COMPLETE);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Add first, remove second: an interruption leaves both labels, never none. */
    private void transition(IssueSnapshot issue, WorkflowStage from, WorkflowStage to) {
        String next    = matcher.labelFor(to).orElseThrow();
        String current = matcher.labelFor(from).orElseThrow();
        forge.addLabels(issue.number(), List.of(next));
        forge.removeLabel(issue.number(), current);
        history.record(issue.number(), "Workflow Stage: " + to.stageName());
        log.info("Issue #{} moved {} -> {}", issue.number(), from.stageName(), to.stageName());
    }

    /** Drops stage labels ranked after {@code stage}, left by an interrupted backward transition. */
    private void removeLaterStageLabels(IssueSnapshot issue, WorkflowStage stage) {
        boolean later = false;
        for (StageMatcher.Rule rule : matcher.table()) {
            if (later && issue.hasLabel(rule.label())) {
                log.info("Removing stale stage label '{}' from issue #{}", rule.label(), issue.number());
                forge.removeLabel(issue.number(), rule.label());
            }
            later |= rule.stage() == stage;
        }
    }

    private void postSpecification(IssueSnapshot issue) {
        List<SpecificationScenario> scenarios = GherkinSpecification.scenariosFor(issue.body());
        forge.createComment(issue.number(),
                GherkinSpecification.render(issue.title(), issue.body(), scenarios));
        log.info("Posted specification with {} scenario(s) on issue #{}", scenarios.size(), issue.number());
    }
}
