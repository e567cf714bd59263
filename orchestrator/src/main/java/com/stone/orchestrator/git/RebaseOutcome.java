package com.stone.orchestrator.git;

import java.util.List;

/**
 * State of a rebase after {@code git rebase} or {@code git rebase --continue}.
 *
 * @param clean           true when the rebase ran to completion
 * @param conflictedPaths unmerged paths at the current stop; empty when clean
 */
public record RebaseOutcome(boolean clean, List<String> conflictedPaths) {

    public RebaseOutcome {
        conflictedPaths = List.copyOf(conflictedPaths);
    }

    public static RebaseOutcome completed() {
        return new RebaseOutcome(true, List.of());
    }

    public static RebaseOutcome stopped(List<String> conflictedPaths) {
        return new RebaseOutcome(false, conflictedPaths);
    }
}
