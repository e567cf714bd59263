package com.stone.orchestrator.model;

/**
 * Stages an issue moves through, encoded on the forge as labels.
 *
 * Happy path:
 *   INTAKE → PLANNING → QA_SPEC → IMPLEMENTATION → AUDIT → READY_FOR_TEST
 *          → DOCS → PULL_REQUEST → COMPLETE
 *
 * CONFLICT_RESOLUTION is entered when the branch-integration label is present
 * and leads back to READY_FOR_TEST once the branch is rebased.
 * ERROR is never carried as a stage label: it is what the matcher returns
 * when no recognised stage label is present.
 */
public enum WorkflowStage {
    INTAKE("intake"),
    PLANNING("planning"),
    QA_SPEC("qa-spec"),
    IMPLEMENTATION("implementation"),
    AUDIT("audit"),
    CONFLICT_RESOLUTION("conflict-resolution"),
    READY_FOR_TEST("ready-for-test"),
    DOCS("docs"),
    PULL_REQUEST("pull-request"),
    COMPLETE("complete"),
    ERROR("unknown");

    private final String stageName;

    WorkflowStage(String stageName) {
        this.stageName = stageName;
    }

    /** Name reported to callers of processIssue. */
    public String stageName() {
        return stageName;
    }
}
