package com.stone.orchestrator.config;

import com.stone.orchestrator.model.WorkflowStage;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All settings the workflow reads, bound once at startup from {@code stone.*}.
 *
 * Every nested group has defaults so an empty application.yml still yields a
 * usable configuration (only the repository owner/name and token are
 * environment specific).
 */
@ConfigurationProperties(prefix = "stone")
public record StoneProperties(
        @DefaultValue Repository repository,
        @DefaultValue Forge forge,
        @DefaultValue Labels labels,
        @DefaultValue Audit audit,
        @DefaultValue Branches branches,
        @DefaultValue Conflicts conflicts,
        @DefaultValue List<Team> teams) {

    public StoneProperties {
        teams = teams == null ? List.of() : List.copyOf(teams);
    }

    /**
     * @param path     local clone used for read-only merge simulation
     * @param cloneUrl remote cloned into working copies; derived from owner/name when blank
     */
    public record Repository(
            @DefaultValue("") String owner,
            @DefaultValue("") String name,
            @DefaultValue(".") String path,
            @DefaultValue("") String cloneUrl) {

        public String fullName() {
            return owner + "/" + name;
        }

        public String effectiveCloneUrl() {
            return cloneUrl.isBlank() ? "https://github.com/" + fullName() + ".git" : cloneUrl;
        }
    }

    public record Forge(
            @DefaultValue("https://api.github.com") String apiUrl,
            @DefaultValue("") String token,
            @DefaultValue("30s") Duration requestTimeout) {
    }

    /** Label names; one per stage plus the auxiliary markers. */
    public record Labels(
            @DefaultValue("stone-process") String intake,
            @DefaultValue("stone-pm") String planning,
            @DefaultValue("stone-qa") String qaSpec,
            @DefaultValue("stone-feature-implement") String implementation,
            @DefaultValue("stone-audit") String audit,
            @DefaultValue("stone-conflict") String conflictResolution,
            @DefaultValue("stone-ready-for-tests") String readyForTest,
            @DefaultValue("stone-docs") String docs,
            @DefaultValue("stone-pr") String pullRequest,
            @DefaultValue("stone-complete") String complete,
            @DefaultValue("stone-error") String error,
            @DefaultValue("stone-audit-failed") String auditFailed,
            @DefaultValue("stone-conflicts-resolved") String conflictsResolved,
            @DefaultValue("stone-manual-resolution-needed") String manualResolutionNeeded,
            @DefaultValue("stone-feedback-processed") String feedbackProcessed) {

        /** Stage label lookup. ERROR has no stage label of its own. */
        public Map<WorkflowStage, String> byStage() {
            Map<WorkflowStage, String> map = new EnumMap<>(WorkflowStage.class);
            map.put(WorkflowStage.INTAKE,              intake);
            map.put(WorkflowStage.PLANNING,            planning);
            map.put(WorkflowStage.QA_SPEC,             qaSpec);
            map.put(WorkflowStage.IMPLEMENTATION,      implementation);
            map.put(WorkflowStage.AUDIT,               audit);
            map.put(WorkflowStage.CONFLICT_RESOLUTION, conflictResolution);
            map.put(WorkflowStage.READY_FOR_TEST,      readyForTest);
            map.put(WorkflowStage.DOCS,                docs);
            map.put(WorkflowStage.PULL_REQUEST,        pullRequest);
            map.put(WorkflowStage.COMPLETE,            complete);
            return map;
        }

        public Optional<String> forStage(WorkflowStage stage) {
            return Optional.ofNullable(byStage().get(stage));
        }
    }

    /**
     * Audit thresholds. The evaluator treats them as opaque inputs.
     *
     * @param sourceExtensions file suffixes counted as implementation code
     */
    public record Audit(
            @DefaultValue("80") int minCodeCoverage,
            @DefaultValue("1") int requiredReviewers,
            @DefaultValue("20") int maxComplexity,
            @DefaultValue({".java", ".kt", ".ts", ".js", ".py", ".go"}) List<String> sourceExtensions) {
    }

    public record Branches(
            @DefaultValue("main") String main,
            @DefaultValue("stone/") String prefix) {

        public String featureBranch(long issueNumber) {
            return prefix + issueNumber;
        }
    }

    /**
     * @param strategy   {@code prefer-feature} or {@code abort}
     * @param gitTimeout wall-clock limit for a single git command
     */
    public record Conflicts(
            @DefaultValue("prefer-feature") String strategy,
            @DefaultValue("120s") Duration gitTimeout) {
    }

    /** A team and the keyword areas feedback is routed to it by. */
    public record Team(String name, @DefaultValue List<String> areas) {
    }
}
