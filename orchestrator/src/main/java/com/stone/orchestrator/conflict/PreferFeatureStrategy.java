package com.stone.orchestrator.conflict;

import com.stone.orchestrator.git.GitClient;
import com.stone.orchestrator.git.GitCommandException;
import com.stone.orchestrator.git.RebaseOutcome;
import com.stone.orchestrator.git.WorkingCopy;
import com.stone.orchestrator.model.ConflictResolutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Resolves every conflicted path in favour of the feature branch and
 * continues the rebase, one replayed commit at a time.
 *
 * During a rebase "theirs" is the commit being replayed, i.e. the feature
 * side. A path git cannot check out from that side (deleted on the feature
 * branch) ends the attempt with the rebase aborted.
 */
@Component
public class PreferFeatureStrategy implements ConflictResolutionStrategy {

    private static final Logger log = LoggerFactory.getLogger(PreferFeatureStrategy.class);

    static final int MAX_STEPS = 50;

    @Override
    public String name() {
        return "prefer-feature";
    }

    @Override
    public ConflictResolutionResult resolve(GitClient git, WorkingCopy workingCopy, RebaseOutcome stop) {
        Set<String> resolved = new LinkedHashSet<>();
        RebaseOutcome outcome = stop;
        for (int step = 0; step < MAX_STEPS && !outcome.clean(); step++) {
            for (String path : outcome.conflictedPaths()) {
                try {
                    git.checkoutSide(workingCopy, path, GitClient.Side.THEIRS);
                } catch (GitCommandException e) {
                    log.warn("Cannot take feature side of {}: {}", path, e.getMessage());
                    git.abortRebase(workingCopy);
                    return ConflictResolutionResult.failed("Cannot resolve " + path + " automatically");
                }
                git.stage(workingCopy, path);
                resolved.add(path);
            }
            outcome = git.continueRebase(workingCopy);
        }
        if (!outcome.clean()) {
            git.abortRebase(workingCopy);
            return ConflictResolutionResult.failed(
                    "Rebase still conflicting after " + MAX_STEPS + " steps");
        }
        log.info("Rebase of {} completed, {} path(s) resolved", workingCopy.branch(), resolved.size());
        return ConflictResolutionResult.resolved(new ArrayList<>(resolved));
    }
}
