package com.stone.orchestrator.forge.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * @param conclusion "success" | "failure" | "neutral" | ... ; null while still running
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CheckRun(long id, String name, String status, String conclusion, String started_at) {

    public boolean succeeded() {
        return "success".equals(conclusion);
    }
}
