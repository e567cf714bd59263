package com.stone.orchestrator.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stone.orchestrator.forge.ForgeClient;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends audit-trail entries to an issue as hidden HTML comments.
 *
 * Entries are write-only: nothing in the workflow reads them back.
 */
@Component
public class HistoryRecorder {

    static final String PREFIX = "<!-- STONE_HISTORY_ENTRY\n";
    static final String SUFFIX = "\n-->";

    private final ForgeClient  forge;
    private final ObjectMapper json;

    public HistoryRecorder(ForgeClient forge, ObjectMapper objectMapper) {
        this.forge = forge;
        this.json  = objectMapper;
    }

    public void record(long issueNumber, String status) {
        Map<String, String> entry = new LinkedHashMap<>();
        entry.put("timestamp", Instant.now().toString());
        entry.put("status", status);
        try {
            forge.createComment(issueNumber, PREFIX + json.writeValueAsString(entry) + SUFFIX);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise history entry", e);
        }
    }
}
