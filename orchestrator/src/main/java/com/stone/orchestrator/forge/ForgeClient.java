package com.stone.orchestrator.forge;

import com.stone.orchestrator.forge.dto.*;
import com.stone.orchestrator.model.IssueSnapshot;

import java.util.List;

/**
 * Every durable effect the workflow has goes through this interface.
 *
 * Implementations perform no caching and no retries; every failure surfaces
 * as a {@link ForgeException} to the caller.
 */
public interface ForgeClient {

    IssueSnapshot getIssue(long issueNumber);

    List<IssueComment> listComments(long issueNumber);

    void createComment(long issueNumber, String body);

    void addLabels(long issueNumber, List<String> labels);

    /** Removing a label the issue does not carry is a no-op. */
    void removeLabel(long issueNumber, String label);

    List<TimelineEvent> listTimeline(long issueNumber);

    PullRequest getPullRequest(long prNumber);

    List<PullRequestFile> listPullRequestFiles(long prNumber);

    List<CheckRun> listCheckRuns(String ref);

    /** Numbers of open pull requests whose body mentions the issue, best match first. */
    List<Long> searchOpenPullRequestsReferencing(long issueNumber);

    /** Review comments left on a pull request's diff. */
    List<IssueComment> listPullRequestComments(long prNumber);

    /** @return the number of the new issue */
    long createIssue(String title, String body, List<String> labels);
}
