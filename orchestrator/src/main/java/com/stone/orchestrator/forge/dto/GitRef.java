package com.stone.orchestrator.forge.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** The head or base side of a pull request. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitRef(String ref, String sha) {}
