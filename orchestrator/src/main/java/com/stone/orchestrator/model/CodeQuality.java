package com.stone.orchestrator.model;

/** Outcome of the lint, type-check and test check-runs on a pull request head. */
public record CodeQuality(boolean lintPassed, boolean typesPassed, boolean testsPassed) {

    public static CodeQuality allFailed() {
        return new CodeQuality(false, false, false);
    }

    public boolean allPassed() {
        return lintPassed && typesPassed && testsPassed;
    }
}
