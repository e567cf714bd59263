package com.stone.orchestrator.git;

import java.util.List;

/**
 * Local git operations used by conflict detection and resolution.
 *
 * Read-only operations run against the configured local repository;
 * mutating operations only ever touch a {@link WorkingCopy}.
 */
public interface GitClient {

    enum Side { OURS, THEIRS }

    String mergeBase(String base, String head);

    /**
     * Three-way merge of {@code base} and {@code head} against their common
     * ancestor without touching any ref or the index.
     *
     * @return raw merge-tree output; conflict markers mean the merge is not clean
     */
    String simulateMerge(String mergeBase, String base, String head);

    /** Paths that differ between the two refs ({@code base...head}). */
    List<String> changedPaths(String base, String head);

    boolean branchExists(String branch);

    /** Number of commits on {@code base} that {@code branch} does not have. */
    int behindCount(String branch, String base);

    /** Clones the remote into a fresh temporary directory with {@code branch} checked out. */
    WorkingCopy cloneAndCheckout(String branch);

    /** Rebases the checked-out branch onto the remote {@code onto} branch. */
    RebaseOutcome rebase(WorkingCopy workingCopy, String onto);

    List<String> conflictedPaths(WorkingCopy workingCopy);

    void checkoutSide(WorkingCopy workingCopy, String path, Side side);

    void stage(WorkingCopy workingCopy, String path);

    RebaseOutcome continueRebase(WorkingCopy workingCopy);

    void abortRebase(WorkingCopy workingCopy);

    /** Force-pushes (with lease) the working copy's HEAD to {@code branch}. */
    void push(WorkingCopy workingCopy, String branch);
}
