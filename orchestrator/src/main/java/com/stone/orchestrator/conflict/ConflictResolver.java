package com.stone.orchestrator.conflict;

import com.stone.orchestrator.config.StoneProperties;
import com.stone.orchestrator.forge.ForgeClient;
import com.stone.orchestrator.forge.ForgeException;
import com.stone.orchestrator.forge.dto.PullRequest;
import com.stone.orchestrator.forge.dto.TimelineEvent;
import com.stone.orchestrator.git.GitClient;
import com.stone.orchestrator.git.RebaseOutcome;
import com.stone.orchestrator.git.WorkingCopy;
import com.stone.orchestrator.model.ConflictReport;
import com.stone.orchestrator.model.ConflictResolutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Detects, resolves and reports on merge conflicts between an issue's
 * feature branch and the base branch.
 *
 * Detection is read-only. Resolution works in a throwaway clone that is
 * removed on every exit path. Neither changes the issue's stage label;
 * only the auxiliary conflicts-resolved / manual-resolution-needed labels.
 */
@Service
public class ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    private final ForgeClient                forge;
    private final GitClient                  git;
    private final StoneProperties            properties;
    private final ConflictResolutionStrategy strategy;

    public ConflictResolver(ForgeClient forge,
                            GitClient git,
                            StoneProperties properties,
                            List<ConflictResolutionStrategy> strategies) {
        this.forge      = forge;
        this.git        = git;
        this.properties = properties;
        String wanted   = properties.conflicts().strategy();
        this.strategy   = strategies.stream()
                .filter(s -> s.name().equals(wanted))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "Unknown conflict strategy '" + wanted + "'"));
        log.info("Conflict resolution strategy: {}", strategy.name());
    }

    // ------------------------------------------------------------------
    // Detection
    // ------------------------------------------------------------------

    /** Simulates merging the feature branch into the base branch. Touches no ref. */
    public ConflictReport detectConflicts(long issueNumber) {
        String base = properties.branches().main();
        String head = properties.branches().featureBranch(issueNumber);

        String mergeBase = git.mergeBase(base, head);
        MergeTreeParser.Parsed parsed = MergeTreeParser.parse(git.simulateMerge(mergeBase, base, head));
        if (!parsed.hasConflicts()) {
            log.debug("No conflicts between {} and {}", base, head);
            return ConflictReport.clean(base, head);
        }
        List<String> paths = parsed.conflictingPaths().isEmpty()
                ? git.changedPaths(base, head)
                : parsed.conflictingPaths();
        log.info("Conflicts between {} and {}: {}", base, head, paths);
        return new ConflictReport(base, head, true, paths);
    }

    // ------------------------------------------------------------------
    // Resolution
    // ------------------------------------------------------------------

    /**
     * Rebases the feature branch onto the base branch and resolves what the
     * configured strategy can.
     *
     * A conflict the strategy cannot resolve is a failed result (the issue is
     * labelled for manual resolution). A forge failure propagates unmodified;
     * any other failure is rethrown as {@link ConflictResolutionException}.
     * Reporting either on the issue is the caller's job.
     */
    public ConflictResolutionResult resolveConflicts(long issueNumber) {
        try {
            ConflictReport report = detectConflicts(issueNumber);
            if (!report.hasConflicts()) {
                forge.createComment(issueNumber, """
                        ## Conflict Resolution

                        No merge conflicts detected between `%s` and `%s`.""".formatted(
                        report.headRef(), report.baseRef()));
                return ConflictResolutionResult.resolved(List.of());
            }

            ConflictResolutionResult result = rebase(report);
            if (result.success()) {
                forge.createComment(issueNumber, resolvedComment(report, result));
                forge.addLabels(issueNumber, List.of(properties.labels().conflictsResolved()));
            } else {
                forge.createComment(issueNumber, manualComment(report, result));
                forge.addLabels(issueNumber, List.of(properties.labels().manualResolutionNeeded()));
            }
            return result;
        } catch (ForgeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConflictResolutionException(
                    "Conflict resolution failed for issue #" + issueNumber + ": " + e.getMessage(), e);
        }
    }

    private ConflictResolutionResult rebase(ConflictReport report) {
        try (WorkingCopy workingCopy = git.cloneAndCheckout(report.headRef())) {
            RebaseOutcome outcome = git.rebase(workingCopy, report.baseRef());
            ConflictResolutionResult result = outcome.clean()
                    ? ConflictResolutionResult.resolved(report.conflictingPaths())
                    : strategy.resolve(git, workingCopy, outcome);
            if (result.success()) {
                git.push(workingCopy, report.headRef());
            }
            return result;
        }
    }

    private static String resolvedComment(ConflictReport report, ConflictResolutionResult result) {
        StringBuilder sb = new StringBuilder("## Conflicts Resolved\n\n");
        sb.append("Rebased `").append(report.headRef()).append("` onto `").append(report.baseRef())
          .append("`.\n");
        if (!result.resolvedPaths().isEmpty()) {
            sb.append("\nResolved paths:\n");
            result.resolvedPaths().forEach(p -> sb.append("- `").append(p).append("`\n"));
        }
        return sb.toString().stripTrailing();
    }

    private static String manualComment(ConflictReport report, ConflictResolutionResult result) {
        StringBuilder sb = new StringBuilder("## Manual Conflict Resolution Needed\n\n");
        sb.append("`").append(report.headRef()).append("` conflicts with `").append(report.baseRef())
          .append("` in:\n");
        report.conflictingPaths().forEach(p -> sb.append("- `").append(p).append("`\n"));
        if (result.error() != null) {
            sb.append("\nReason: ").append(result.error()).append('\n');
        }
        return sb.toString().stripTrailing();
    }

    // ------------------------------------------------------------------
    // Reporting
    // ------------------------------------------------------------------

    /** Posts the branch's merge status on the issue. Changes no labels. */
    public void trackMergeStatus(long issueNumber) {
        String base   = properties.branches().main();
        String branch = properties.branches().featureBranch(issueNumber);

        boolean exists   = git.branchExists(branch);
        int behind       = exists ? git.behindCount(branch, base) : 0;
        boolean conflict = exists && detectConflicts(issueNumber).hasConflicts();
        List<Long> prs   = forge.searchOpenPullRequestsReferencing(issueNumber);

        StringBuilder sb = new StringBuilder("## Merge Status Report\n\n");
        sb.append("- Branch `").append(branch).append("`: ").append(exists ? "exists" : "not found").append('\n');
        if (exists) {
            sb.append("- Commits behind `").append(base).append("`: ").append(behind).append('\n');
        }
        if (prs.isEmpty()) {
            sb.append("- Pull request: none\n");
        } else {
            PullRequest pr = forge.getPullRequest(prs.get(0));
            sb.append("- Pull request: #").append(pr.number()).append(" (").append(pr.mergeStatus()).append(")\n");
        }
        sb.append("- Conflicts: ").append(conflict ? "Yes" : "No").append('\n');
        lastStageChange(issueNumber).ifPresent(event -> sb.append("- Stage label `")
                .append(event.label().name()).append("` added: ").append(event.created_at()).append('\n'));
        sb.append('\n');
        sb.append("Last updated: ").append(Instant.now());
        forge.createComment(issueNumber, sb.toString());
    }

    /** Most recent "labeled" event for one of the stage labels. */
    private Optional<TimelineEvent> lastStageChange(long issueNumber) {
        List<String> stageLabels = List.copyOf(properties.labels().byStage().values());
        return forge.listTimeline(issueNumber).stream()
                .filter(e -> "labeled".equals(e.event()) && e.label() != null && e.created_at() != null)
                .filter(e -> stageLabels.contains(e.label().name()))
                .max(Comparator.comparing(TimelineEvent::created_at));
    }
}
