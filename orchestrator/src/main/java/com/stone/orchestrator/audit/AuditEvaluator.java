package com.stone.orchestrator.audit;

import com.stone.orchestrator.config.StoneProperties;
import com.stone.orchestrator.engine.GherkinSpecification;
import com.stone.orchestrator.forge.ForgeClient;
import com.stone.orchestrator.forge.dto.CheckRun;
import com.stone.orchestrator.forge.dto.IssueComment;
import com.stone.orchestrator.forge.dto.PullRequest;
import com.stone.orchestrator.forge.dto.PullRequestFile;
import com.stone.orchestrator.model.AuditCriteria;
import com.stone.orchestrator.model.AuditVerdict;
import com.stone.orchestrator.model.CodeQuality;
import com.stone.orchestrator.model.ImplementationVerification;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Scores the pull request that implements an issue.
 *
 * Nothing is cached between calls: every method re-reads the pull request,
 * its files and its check-runs from the forge. A missing pull request is not
 * an error; it yields zero-valued criteria and a failed verification.
 */
@Service
public class AuditEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AuditEvaluator.class);

    static final String SPEC_NOT_FOUND = "Gherkin specifications not found";

    private final ForgeClient           forge;
    private final StoneProperties.Audit thresholds;
    private final AuditReportRenderer   renderer;
    private final MeterRegistry         meterRegistry;

    public AuditEvaluator(ForgeClient forge,
                          StoneProperties properties,
                          AuditReportRenderer renderer,
                          MeterRegistry meterRegistry) {
        this.forge         = forge;
        this.thresholds    = properties.audit();
        this.renderer      = renderer;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Public operations
    // ------------------------------------------------------------------

    public AuditCriteria evaluateAuditCriteria(long issueNumber) {
        return criteriaFor(findPullRequest(issueNumber));
    }

    public ImplementationVerification verifyImplementation(long issueNumber) {
        return verificationFor(issueNumber, findPullRequest(issueNumber));
    }

    /** Latest lint, type-check and test runs on the pull request head. */
    public CodeQuality validateCodeQuality(PullRequest pullRequest) {
        String ref = pullRequest.head() == null ? null
                : pullRequest.head().sha() != null ? pullRequest.head().sha() : pullRequest.head().ref();
        if (ref == null) {
            return CodeQuality.allFailed();
        }
        List<CheckRun> runs = forge.listCheckRuns(ref);
        return new CodeQuality(
                latestPassed(runs, "lint"),
                latestPassed(runs, "type", "tsc"),
                latestPassed(runs, "test"));
    }

    /** Runs all three checks against a single pull request lookup and derives the verdict. */
    public AuditVerdict evaluate(long issueNumber) {
        Optional<PullRequest> pullRequest = findPullRequest(issueNumber);
        AuditCriteria criteria                  = criteriaFor(pullRequest);
        ImplementationVerification verification = verificationFor(issueNumber, pullRequest);
        CodeQuality quality = pullRequest.map(this::validateCodeQuality).orElse(CodeQuality.allFailed());
        AuditVerdict verdict = judge(criteria, verification, quality);
        log.info("Audit for issue #{}: passed={} coverage={}% reviewers={} complexity={}",
                issueNumber, verdict.passed(), criteria.codeCoverageEstimatePercent(),
                criteria.reviewersAssignedCount(), criteria.complexityScore());
        return verdict;
    }

    /** Posts the verdict as a Markdown report on the issue. */
    public void processAuditResults(long issueNumber, AuditVerdict verdict) {
        forge.createComment(issueNumber, renderer.render(verdict, thresholds));
        meterRegistry.counter("stone.audit.verdicts",
                "result", verdict.passed() ? "passed" : "failed").increment();
    }

    // ------------------------------------------------------------------
    // Verdict
    // ------------------------------------------------------------------

    /**
     * Pure: passed iff the implementation is verified, every quality gate
     * passed and every threshold is met. Recommendations are emitted in a
     * fixed order regardless of which inputs fail.
     */
    public AuditVerdict judge(AuditCriteria criteria,
                              ImplementationVerification verification,
                              CodeQuality quality) {
        boolean coverageOk   = criteria.codeCoverageEstimatePercent() >= thresholds.minCodeCoverage();
        boolean reviewersOk  = criteria.reviewersAssignedCount() >= thresholds.requiredReviewers();
        boolean complexityOk = criteria.complexityScore() <= thresholds.maxComplexity();

        List<String> recommendations = new ArrayList<>();
        if (!criteria.hasUnitTests()) {
            recommendations.add("Add unit tests for the implementation");
        }
        if (!coverageOk) {
            recommendations.add("Increase test coverage from %d%% to at least %d%%".formatted(
                    criteria.codeCoverageEstimatePercent(), thresholds.minCodeCoverage()));
        }
        if (!reviewersOk) {
            recommendations.add("Request at least %d reviewer(s) for the pull request".formatted(
                    thresholds.requiredReviewers()));
        }
        if (!complexityOk) {
            recommendations.add("Refactor the implementation to reduce complexity");
        }
        if (!quality.lintPassed())  recommendations.add("Fix linting issues");
        if (!quality.typesPassed()) recommendations.add("Fix type errors");
        if (!quality.testsPassed()) recommendations.add("Fix failing tests");
        if (!verification.success()) {
            recommendations.add("Implement missing requirements: "
                    + String.join(", ", verification.missingRequirements()));
        }

        boolean passed = verification.success()
                && quality.allPassed()
                && coverageOk
                && reviewersOk
                && complexityOk
                && criteria.hasUnitTests();
        return new AuditVerdict(criteria, verification, quality, passed, recommendations);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Optional<PullRequest> findPullRequest(long issueNumber) {
        List<Long> numbers = forge.searchOpenPullRequestsReferencing(issueNumber);
        if (numbers.isEmpty()) {
            log.info("No open pull request references issue #{}", issueNumber);
            return Optional.empty();
        }
        return Optional.of(forge.getPullRequest(numbers.get(0)));
    }

    private AuditCriteria criteriaFor(Optional<PullRequest> pullRequest) {
        if (pullRequest.isEmpty()) {
            return AuditCriteria.none();
        }
        PullRequest pr = pullRequest.get();
        return criteriaFrom(forge.listPullRequestFiles(pr.number()),
                pr.requestedReviewerCount(), thresholds.sourceExtensions());
    }

    /**
     * Coverage is the ratio of changed test lines to changed source lines,
     * complexity is total changed lines / 10; both rounded half-up and
     * clamped to 100. Coverage is 0 when no source lines changed.
     */
    static AuditCriteria criteriaFrom(List<PullRequestFile> files, int reviewers, List<String> sourceExtensions) {
        int sourceLines = 0;
        int testLines   = 0;
        int totalLines  = 0;
        boolean hasTests = false;
        for (PullRequestFile file : files) {
            totalLines += file.changes();
            if (isTestFile(file.filename())) {
                hasTests = true;
                testLines += file.changes();
            } else if (isSourceFile(file.filename(), sourceExtensions)) {
                sourceLines += file.changes();
            }
        }
        int coverage   = sourceLines == 0 ? 0 : (int) Math.min(100, Math.round(100.0 * testLines / sourceLines));
        int complexity = (int) Math.min(100, Math.round(totalLines / 10.0));
        return new AuditCriteria(coverage, reviewers, complexity, hasTests);
    }

    private static boolean isTestFile(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        return lower.contains("test") || lower.contains("spec");
    }

    private static boolean isSourceFile(String path, List<String> extensions) {
        return extensions.stream().anyMatch(path::endsWith);
    }

    /**
     * File-count heuristic: the implementation counts as complete when the pull
     * request touches at least as many files as there are scenarios.
     */
    private ImplementationVerification verificationFor(long issueNumber, Optional<PullRequest> pullRequest) {
        List<IssueComment> comments = forge.listComments(issueNumber);
        Optional<IssueComment> spec = GherkinSpecification.find(comments);
        if (spec.isEmpty()) {
            return new ImplementationVerification(false, List.of(SPEC_NOT_FOUND));
        }
        List<String> requirements = GherkinSpecification.requirements(spec.get().body());
        if (pullRequest.isEmpty()) {
            return new ImplementationVerification(false, requirements);
        }
        int changedFiles = forge.listPullRequestFiles(pullRequest.get().number()).size();
        return changedFiles >= requirements.size()
                ? new ImplementationVerification(true, List.of())
                : new ImplementationVerification(false, requirements);
    }

    private static boolean latestPassed(List<CheckRun> runs, String... keywords) {
        return runs.stream()
                .filter(run -> run.name() != null && matchesAny(run.name().toLowerCase(Locale.ROOT), keywords))
                .max(Comparator.comparing(run -> run.started_at() == null ? "" : run.started_at()))
                .map(CheckRun::succeeded)
                .orElse(false);
    }

    private static boolean matchesAny(String name, String... keywords) {
        for (String keyword : keywords) {
            if (name.contains(keyword)) return true;
        }
        return false;
    }
}
