package com.stone.orchestrator.model;

/**
 * Quality signals derived from a pull request's diff.
 * Recomputed on every audit pass; never persisted.
 *
 * @param codeCoverageEstimatePercent test-to-source changed-line ratio, clamped to [0, 100]
 * @param complexityScore             total changed lines / 10, clamped to [0, 100]
 */
public record AuditCriteria(
        int codeCoverageEstimatePercent,
        int reviewersAssignedCount,
        int complexityScore,
        boolean hasUnitTests) {

    /** Criteria reported when no pull request references the issue. */
    public static AuditCriteria none() {
        return new AuditCriteria(0, 0, 0, false);
    }
}
