package com.stone.orchestrator.forge.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One entry of GET /repos/{owner}/{repo}/pulls/{number}/files.
 *
 * @param changes additions + deletions for this file
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PullRequestFile(String filename, String status, int additions, int deletions, int changes) {}
