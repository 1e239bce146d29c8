package com.dashforge.orchestrator.api.dto;

import com.dashforge.orchestrator.model.Task;
import com.dashforge.orchestrator.model.TaskStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.UUID;

/** Response body for POST /api/dashboards/generate. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubmitResponse(UUID taskId, TaskStatus status) {

    public static SubmitResponse from(Task task) {
        return new SubmitResponse(task.id(), task.status());
    }
}
