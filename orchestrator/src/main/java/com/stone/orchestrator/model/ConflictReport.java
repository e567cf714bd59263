package com.stone.orchestrator.model;

import java.util.List;

/**
 * Outcome of a merge simulation between a feature branch and its base.
 * Valid only for the refs as they were when it was computed.
 */
public record ConflictReport(
        String baseRef,
        String headRef,
        boolean hasConflicts,
        List<String> conflictingPaths) {

    public ConflictReport {
        conflictingPaths = List.copyOf(conflictingPaths);
    }

    public static ConflictReport clean(String baseRef, String headRef) {
        return new ConflictReport(baseRef, headRef, false, List.of());
    }
}
