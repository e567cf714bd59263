package com.stone.orchestrator.audit;

import com.stone.orchestrator.config.StoneProperties;
import com.stone.orchestrator.model.AuditCriteria;
import com.stone.orchestrator.model.AuditVerdict;
import com.stone.orchestrator.model.CodeQuality;
import org.springframework.stereotype.Component;

/** Markdown rendering of an {@link AuditVerdict} for an issue comment. */
@Component
public class AuditReportRenderer {

    public String render(AuditVerdict verdict, StoneProperties.Audit thresholds) {
        AuditCriteria criteria = verdict.criteria();
        CodeQuality   quality  = verdict.quality();

        StringBuilder sb = new StringBuilder();
        sb.append(verdict.passed() ? "## Audit Passed" : "## Audit Failed").append("\n\n");

        sb.append("### Code Quality\n\n");
        sb.append("- Linting: ").append(mark(quality.lintPassed())).append('\n');
        sb.append("- Type checking: ").append(mark(quality.typesPassed())).append('\n');
        sb.append("- Tests: ").append(mark(quality.testsPassed())).append("\n\n");

        sb.append("### Criteria\n\n");
        sb.append("- Code coverage: %d%% (minimum %d%%)\n".formatted(
                criteria.codeCoverageEstimatePercent(), thresholds.minCodeCoverage()));
        sb.append("- Reviewers assigned: %d (minimum %d)\n".formatted(
                criteria.reviewersAssignedCount(), thresholds.requiredReviewers()));
        sb.append("- Complexity score: %d (maximum %d)\n".formatted(
                criteria.complexityScore(), thresholds.maxComplexity()));
        sb.append("- Unit tests: ").append(criteria.hasUnitTests() ? "present" : "missing").append("\n\n");

        sb.append("### Verification\n\n");
        if (verdict.verification().success()) {
            sb.append("All specified requirements are covered by the pull request.\n");
        } else {
            sb.append("Missing requirements:\n");
            verdict.verification().missingRequirements()
                    .forEach(r -> sb.append("- ").append(r).append('\n'));
        }

        if (!verdict.recommendations().isEmpty()) {
            sb.append("\n### Recommendations\n\n");
            verdict.recommendations().forEach(r -> sb.append("- ").append(r).append('\n'));
        }
        return sb.toString().stripTrailing();
    }

    private static String mark(boolean passed) {
        return passed ? "✅ passed" : "❌ failed";
    }
}
