package com.stone.orchestrator.api.dto;

import com.stone.orchestrator.model.WorkflowStage;

public record StageResponse(long issue, String stage) {

    public static StageResponse from(long issue, WorkflowStage stage) {
        return new StageResponse(issue, stage.stageName());
    }
}
