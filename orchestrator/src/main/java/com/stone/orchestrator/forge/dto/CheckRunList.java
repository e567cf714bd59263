package com.stone.orchestrator.forge.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/** Response from GET /repos/{owner}/{repo}/commits/{ref}/check-runs. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CheckRunList(int total_count, List<CheckRun> check_runs) {}
