package com.stone.orchestrator.forge.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Response from GET /repos/{owner}/{repo}/pulls/{number}.
 *
 * @param mergeable null while the forge is still computing mergeability
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PullRequest(
        long number,
        String title,
        String body,
        String state,
        GitRef head,
        GitRef base,
        List<GitHubUser> requested_reviewers,
        Boolean mergeable,
        boolean merged) {

    public int requestedReviewerCount() {
        return requested_reviewers == null ? 0 : requested_reviewers.size();
    }

    /** Human-readable merge status used in merge reports. */
    public String mergeStatus() {
        if (merged) return "merged";
        if (mergeable == null) return "open";
        return mergeable ? "ready to merge" : "conflicts";
    }
}
