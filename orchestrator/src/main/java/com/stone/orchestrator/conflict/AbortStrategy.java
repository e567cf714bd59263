package com.stone.orchestrator.conflict;

import com.stone.orchestrator.git.GitClient;
import com.stone.orchestrator.git.RebaseOutcome;
import com.stone.orchestrator.git.WorkingCopy;
import com.stone.orchestrator.model.ConflictResolutionResult;
import org.springframework.stereotype.Component;

/** Never resolves anything; every conflict goes to a human. */
@Component
public class AbortStrategy implements ConflictResolutionStrategy {

    @Override
    public String name() {
        return "abort";
    }

    @Override
    public ConflictResolutionResult resolve(GitClient git, WorkingCopy workingCopy, RebaseOutcome stop) {
        git.abortRebase(workingCopy);
        return ConflictResolutionResult.failed(
                "Automatic resolution is disabled; conflicting paths: " + String.join(", ", stop.conflictedPaths()));
    }
}
