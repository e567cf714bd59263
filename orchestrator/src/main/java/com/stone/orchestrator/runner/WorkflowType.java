package com.stone.orchestrator.runner;

import java.util.Arrays;

/** Kinds of work a caller can trigger for one issue. */
public enum WorkflowType {
    PROCESS("process"),
    AUDIT("audit"),
    CONFLICT_RESOLUTION("conflict-resolution"),
    MERGE_STATUS("merge-status"),
    FEEDBACK("feedback");

    private final String id;

    WorkflowType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static WorkflowType fromId(String id) {
        return Arrays.stream(values())
                .filter(t -> t.id.equals(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown workflow type: " + id));
    }
}
