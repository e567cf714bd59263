package com.stone.orchestrator.model;

import java.util.List;

/**
 * Result of one automated resolution attempt.
 *
 * @param error null on success, otherwise a human-readable reason
 */
public record ConflictResolutionResult(boolean success, List<String> resolvedPaths, String error) {

    public ConflictResolutionResult {
        resolvedPaths = List.copyOf(resolvedPaths);
    }

    public static ConflictResolutionResult resolved(List<String> paths) {
        return new ConflictResolutionResult(true, paths, null);
    }

    public static ConflictResolutionResult failed(String error) {
        return new ConflictResolutionResult(false, List.of(), error);
    }
}
