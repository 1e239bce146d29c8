package com.dashforge.orchestrator.api.dto;

import com.dashforge.orchestrator.model.Diagnostic;
import com.dashforge.orchestrator.model.RepairHint;
import com.dashforge.orchestrator.model.Task;
import com.dashforge.orchestrator.model.TaskStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response body for GET /api/tasks/{id} and the feedback endpoint.
 *
 * result is present when the task is completed or awaiting_human, error only
 * when it failed, diagnostics and hints only while awaiting_human.
 * Field names go out in snake case (task_id, attempt_count, ...).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TaskResponse(
        UUID             taskId,
        TaskStatus       status,
        String           phase,
        String           backend,
        int              maxRetries,
        int              attemptCount,
        JsonNode         result,
        String           error,
        List<Diagnostic> diagnostics,
        List<String>     hints,
        boolean          validationPassed,
        boolean          requiredHumanIntervention,
        boolean          correctedByHuman,
        String           humanFeedback,
        Instant          createdAt,
        Instant          updatedAt
) {
    public static TaskResponse from(Task task) {
        TaskStatus status     = task.status();
        boolean    awaiting   = status == TaskStatus.AWAITING_HUMAN;
        boolean    showResult = (status == TaskStatus.COMPLETED || awaiting) && task.result() != null;

        return new TaskResponse(
                task.id(),
                status,
                task.phase(),
                task.backend(),
                task.maxRetries(),
                task.attemptCount(),
                showResult ? task.result().document() : null,
                status == TaskStatus.FAILED ? task.error() : null,
                awaiting ? task.diagnostics() : null,
                awaiting ? task.hints().stream().map(RepairHint::instruction).toList() : null,
                status == TaskStatus.COMPLETED && !task.correctedByHuman(),
                awaiting,
                task.correctedByHuman(),
                task.humanFeedback(),
                task.createdAt(),
                task.updatedAt()
        );
    }
}
