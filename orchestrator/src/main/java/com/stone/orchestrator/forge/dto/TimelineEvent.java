package com.stone.orchestrator.forge.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One entry of GET /repos/{owner}/{repo}/issues/{number}/timeline.
 *
 * @param label set for "labeled" / "unlabeled" events only
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TimelineEvent(String event, String created_at, GitHubUser actor, GitHubLabel label) {}
