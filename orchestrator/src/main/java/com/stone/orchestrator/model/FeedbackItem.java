package com.stone.orchestrator.model;

/**
 * One piece of reviewer feedback taken from a pull request comment.
 *
 * @param sourcePullRequest number of the PR the comment was left on
 */
public record FeedbackItem(
        FeedbackType type,
        String content,
        String author,
        FeedbackPriority priority,
        long sourcePullRequest) {

    public FeedbackItem withPriority(FeedbackPriority newPriority) {
        return new FeedbackItem(type, content, author, newPriority, sourcePullRequest);
    }
}
