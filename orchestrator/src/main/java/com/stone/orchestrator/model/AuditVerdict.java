package com.stone.orchestrator.model;

import java.util.List;

/**
 * Result of one audit pass. {@code passed} is derived from the other
 * three components and the configured thresholds; see AuditEvaluator.
 */
public record AuditVerdict(
        AuditCriteria criteria,
        ImplementationVerification verification,
        CodeQuality quality,
        boolean passed,
        List<String> recommendations) {

    public AuditVerdict {
        recommendations = List.copyOf(recommendations);
    }
}
