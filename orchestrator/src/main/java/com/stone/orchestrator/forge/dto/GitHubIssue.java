package com.stone.orchestrator.forge.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Response from GET /repos/{owner}/{repo}/issues/{number}.
 * Timestamps stay ISO-8601 strings on the wire; the client converts them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubIssue(
        long number,
        String title,
        String body,
        String state,
        List<GitHubLabel> labels,
        String created_at,
        String closed_at) {}
