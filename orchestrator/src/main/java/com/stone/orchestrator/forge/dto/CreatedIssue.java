package com.stone.orchestrator.forge.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Subset of the POST /repos/{owner}/{repo}/issues response we use. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CreatedIssue(long number, String html_url) {}
