package com.stone.orchestrator.engine;

import com.stone.orchestrator.config.StoneProperties;
import com.stone.orchestrator.model.WorkflowStage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Works out an issue's current stage from its labels.
 *
 * The lookup is a fixed, ordered table: the first row whose label is on the
 * issue wins. When an interrupted transition leaves two stage labels behind,
 * the earlier stage is picked, so the next invocation repeats the same
 * transition and finishes it. Pull request to conflict resolution runs
 * against the table; there the earlier stage is the target, and its
 * handler clears the leftover label instead.
 */
public class StageMatcher {

    /** Match priority. ERROR is not listed: it is the result when no row matches. */
    static final List<WorkflowStage> PRIORITY = List.of(
            WorkflowStage.INTAKE,
            WorkflowStage.PLANNING,
            WorkflowStage.QA_SPEC,
            WorkflowStage.IMPLEMENTATION,
            WorkflowStage.AUDIT,
            WorkflowStage.CONFLICT_RESOLUTION,
            WorkflowStage.READY_FOR_TEST,
            WorkflowStage.DOCS,
            WorkflowStage.PULL_REQUEST,
            WorkflowStage.COMPLETE
    );

    public record Rule(WorkflowStage stage, String label) {}

    private final List<Rule> table;

    public StageMatcher(StoneProperties.Labels labels) {
        List<Rule> rules = new ArrayList<>();
        for (WorkflowStage stage : PRIORITY) {
            rules.add(new Rule(stage, labels.forStage(stage).orElseThrow()));
        }
        this.table = List.copyOf(rules);
    }

    /** Total and side-effect free: every label set maps to exactly one stage. */
    public WorkflowStage match(Collection<String> labels) {
        return table.stream()
                .filter(rule -> labels.contains(rule.label()))
                .map(Rule::stage)
                .findFirst()
                .orElse(WorkflowStage.ERROR);
    }

    public Optional<String> labelFor(WorkflowStage stage) {
        return table.stream()
                .filter(rule -> rule.stage() == stage)
                .map(Rule::label)
                .findFirst();
    }

    /** The priority table in match order. */
    public List<Rule> table() {
        return table;
    }
}
