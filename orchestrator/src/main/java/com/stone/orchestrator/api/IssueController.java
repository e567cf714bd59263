package com.stone.orchestrator.api;

import com.stone.orchestrator.api.dto.FeedbackResponse;
import com.stone.orchestrator.api.dto.StageResponse;
import com.stone.orchestrator.conflict.ConflictResolver;
import com.stone.orchestrator.engine.StageTransitionEngine;
import com.stone.orchestrator.model.AuditVerdict;
import com.stone.orchestrator.model.ConflictReport;
import com.stone.orchestrator.model.ConflictResolutionResult;
import com.stone.orchestrator.runner.WorkflowRunner;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST surface for webhook handlers and operators.
 *
 * POST /issues/{n}/process            : advance the issue by one stage
 * GET  /issues/{n}/stage              : current stage, read-only
 * POST /issues/{n}/audit              : evaluate and post an audit report
 * GET  /issues/{n}/conflicts          : simulate the merge, read-only
 * POST /issues/{n}/conflicts/resolve  : rebase and resolve the feature branch
 * POST /issues/{n}/merge-status       : post a merge status report
 * POST /issues/{n}/feedback           : file PR review feedback as an issue
 */
@RestController
@RequestMapping("/issues/{number}")
public class IssueController {

    private final WorkflowRunner        runner;
    private final StageTransitionEngine engine;
    private final ConflictResolver      conflictResolver;

    public IssueController(WorkflowRunner runner,
                           StageTransitionEngine engine,
                           ConflictResolver conflictResolver) {
        this.runner           = runner;
        this.engine           = engine;
        this.conflictResolver = conflictResolver;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/issues/42/process
     *
     * The response carries the stage the issue was in before this call.
     */
    @PostMapping("/process")
    public StageResponse process(@PathVariable long number) {
        return StageResponse.from(number, runner.process(number));
    }

    @GetMapping("/stage")
    public StageResponse stage(@PathVariable long number) {
        return StageResponse.from(number, engine.currentStage(number));
    }

    @PostMapping("/audit")
    public AuditVerdict audit(@PathVariable long number) {
        return runner.audit(number);
    }

    @GetMapping("/conflicts")
    public ConflictReport conflicts(@PathVariable long number) {
        return conflictResolver.detectConflicts(number);
    }

    @PostMapping("/conflicts/resolve")
    public ConflictResolutionResult resolve(@PathVariable long number) {
        return runner.resolveConflicts(number);
    }

    @PostMapping("/merge-status")
    public ResponseEntity<Void> mergeStatus(@PathVariable long number) {
        runner.mergeStatus(number);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/feedback")
    public FeedbackResponse feedback(@PathVariable long number) {
        return new FeedbackResponse(number, runner.feedback(number).orElse(null));
    }
}
