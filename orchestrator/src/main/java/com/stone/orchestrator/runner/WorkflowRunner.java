package com.stone.orchestrator.runner;

import com.stone.orchestrator.audit.AuditEvaluator;
import com.stone.orchestrator.config.StoneProperties;
import com.stone.orchestrator.conflict.ConflictResolver;
import com.stone.orchestrator.engine.StageTransitionEngine;
import com.stone.orchestrator.feedback.FeedbackHandler;
import com.stone.orchestrator.forge.ForgeClient;
import com.stone.orchestrator.model.AuditVerdict;
import com.stone.orchestrator.model.ConflictResolutionResult;
import com.stone.orchestrator.model.WorkflowStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Single entry point for triggered work on an issue.
 *
 * Any failure is logged, flagged on the issue with the error label and an
 * explanatory comment, then rethrown unchanged. The error label is not a
 * stage label, so the issue stays in the stage it failed in and the next
 * invocation retries it.
 */
@Service
public class WorkflowRunner {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRunner.class);

    private final StageTransitionEngine engine;
    private final AuditEvaluator        auditEvaluator;
    private final ConflictResolver      conflictResolver;
    private final FeedbackHandler       feedbackHandler;
    private final ForgeClient           forge;
    private final String                errorLabel;

    public WorkflowRunner(StageTransitionEngine engine,
                          AuditEvaluator auditEvaluator,
                          ConflictResolver conflictResolver,
                          FeedbackHandler feedbackHandler,
                          ForgeClient forge,
                          StoneProperties properties) {
        this.engine           = engine;
        this.auditEvaluator   = auditEvaluator;
        this.conflictResolver = conflictResolver;
        this.feedbackHandler  = feedbackHandler;
        this.forge            = forge;
        this.errorLabel       = properties.labels().error();
    }

    public WorkflowStage process(long issueNumber) {
        return guarded(WorkflowType.PROCESS, issueNumber, () -> engine.processIssue(issueNumber));
    }

    /** Evaluates and posts an audit report without moving the issue. */
    public AuditVerdict audit(long issueNumber) {
        return guarded(WorkflowType.AUDIT, issueNumber, () -> {
            AuditVerdict verdict = auditEvaluator.evaluate(issueNumber);
            auditEvaluator.processAuditResults(issueNumber, verdict);
            return verdict;
        });
    }

    public ConflictResolutionResult resolveConflicts(long issueNumber) {
        return guarded(WorkflowType.CONFLICT_RESOLUTION, issueNumber,
                () -> conflictResolver.resolveConflicts(issueNumber));
    }

    public void mergeStatus(long issueNumber) {
        guarded(WorkflowType.MERGE_STATUS, issueNumber, () -> {
            conflictResolver.trackMergeStatus(issueNumber);
            return null;
        });
    }

    public Optional<Long> feedback(long issueNumber) {
        return guarded(WorkflowType.FEEDBACK, issueNumber, () -> feedbackHandler.processFeedback(issueNumber));
    }

    /** Dispatch by type id ({@code process}, {@code audit}, ...). */
    public void run(String type, long issueNumber) {
        switch (WorkflowType.fromId(type)) {
            case PROCESS             -> process(issueNumber);
            case AUDIT               -> audit(issueNumber);
            case CONFLICT_RESOLUTION -> resolveConflicts(issueNumber);
            case MERGE_STATUS        -> mergeStatus(issueNumber);
            case FEEDBACK            -> feedback(issueNumber);
        }
    }

    // ------------------------------------------------------------------
    // Error recovery
    // ------------------------------------------------------------------

    private <T> T guarded(WorkflowType type, long issueNumber, Supplier<T> work) {
        MDC.put("workflow", type.id());
        try {
            return work.get();
        } catch (RuntimeException e) {
            log.error("{} workflow failed for issue #{}", type.id(), issueNumber, e);
            reportFailure(type, issueNumber, e);
            throw e;
        } finally {
            MDC.remove("workflow");
        }
    }

    /** Best effort: a failure here is logged and attached to the original exception. */
    private void reportFailure(WorkflowType type, long issueNumber, RuntimeException cause) {
        try {
            forge.addLabels(issueNumber, List.of(errorLabel));
            forge.createComment(issueNumber, """
                    ## Error in %s workflow

                    %s

                    The `%s` label has been added. Fix the cause and trigger the workflow again."""
                    .formatted(type.id(), cause.getMessage(), errorLabel));
        } catch (RuntimeException e) {
            log.warn("Could not report {} failure on issue #{}: {}", type.id(), issueNumber, e.getMessage());
            cause.addSuppressed(e);
        }
    }
}
