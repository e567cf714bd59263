package com.stone.orchestrator.forge.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/** Response from GET /search/issues. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchResult(int total_count, List<Item> items) {

    /**
     * @param pull_request non-null only when the hit is a pull request
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(long number, Object pull_request) {
        public boolean isPullRequest() {
            return pull_request != null;
        }
    }
}
