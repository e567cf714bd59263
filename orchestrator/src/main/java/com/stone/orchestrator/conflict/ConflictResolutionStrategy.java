package com.stone.orchestrator.conflict;

import com.stone.orchestrator.git.GitClient;
import com.stone.orchestrator.git.RebaseOutcome;
import com.stone.orchestrator.git.WorkingCopy;
import com.stone.orchestrator.model.ConflictResolutionResult;

/**
 * Decides what to do when a rebase stops on conflicts.
 *
 * Implementations either finish the rebase (success) or leave the working
 * copy with the rebase aborted (failure). They never push.
 */
public interface ConflictResolutionStrategy {

    /** Value of {@code stone.conflicts.strategy} that selects this strategy. */
    String name();

    ConflictResolutionResult resolve(GitClient git, WorkingCopy workingCopy, RebaseOutcome stop);
}
