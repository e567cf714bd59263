package com.stone.orchestrator.model;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of an issue at decision time.
 *
 * Built fresh from the forge on every invocation and never cached.
 *
 * @param labels label names in the order the forge returned them
 * @param closedAt null while the issue is open
 */
public record IssueSnapshot(
        long number,
        String title,
        String body,
        boolean open,
        List<String> labels,
        Instant createdAt,
        Instant closedAt) {

    public IssueSnapshot {
        body   = body == null ? "" : body;
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    public boolean hasLabel(String name) {
        return labels.contains(name);
    }
}
