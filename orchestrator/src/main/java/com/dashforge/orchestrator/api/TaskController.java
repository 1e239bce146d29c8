package com.dashforge.orchestrator.api;

import com.dashforge.orchestrator.api.dto.CorrectionRequest;
import com.dashforge.orchestrator.api.dto.GenerateDashboardRequest;
import com.dashforge.orchestrator.api.dto.SubmitResponse;
import com.dashforge.orchestrator.api.dto.TaskResponse;
import com.dashforge.orchestrator.llm.UnknownModelException;
import com.dashforge.orchestrator.model.GenerationRequest;
import com.dashforge.orchestrator.model.Task;
import com.dashforge.orchestrator.service.TaskService;
import com.dashforge.orchestrator.store.InvalidTaskStateException;
import com.dashforge.orchestrator.store.TaskNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

/**
 * REST API for dashboard generation tasks.
 *
 * POST   /api/dashboards/generate  - submit a prompt, returns 202 with the task id
 * GET    /api/tasks/{id}           - poll the current state of a task
 * POST   /api/tasks/{id}/feedback  - submit a corrected dashboard for an escalated task
 * DELETE /api/tasks/{id}           - forget a task
 */
@RestController
@RequestMapping("/api")
public class TaskController {

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    /**
     * Submit a generation task. The run happens in the background; poll
     * GET /api/tasks/{id} for progress.
     *
     * Example:
     *   curl -X POST http://localhost:8080/api/dashboards/generate \
     *     -H "Content-Type: application/json" \
     *     -d '{"prompt":"CPU and memory usage per host","modelProvider":"gpt-4o","maxRetries":3}'
     */
    @PostMapping("/dashboards/generate")
    public ResponseEntity<SubmitResponse> generate(@RequestBody GenerateDashboardRequest req) {
        GenerationRequest request;
        try {
            request = req.toGenerationRequest();
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }

        try {
            Task task = taskService.submit(request);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(SubmitResponse.from(task));
        } catch (UnknownModelException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    /**
     * Poll a task. Returns 404 if the id is not known.
     */
    @GetMapping("/tasks/{id}")
    public TaskResponse getTask(@PathVariable UUID id) {
        return taskService.findById(id)
                .map(TaskResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Task with ID " + id + " not found"));
    }

    /**
     * Accept a human-corrected dashboard for a task in awaiting_human.
     *
     * HTTP 200 - task is now completed with the corrected dashboard
     * HTTP 400 - correctedJson missing
     * HTTP 404 - task id not found
     * HTTP 409 - task is not awaiting human review (left unchanged)
     */
    @PostMapping("/tasks/{id}/feedback")
    public TaskResponse submitFeedback(@PathVariable UUID id, @RequestBody CorrectionRequest req) {
        if (!req.hasDashboard()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "correctedJson is required");
        }
        try {
            return TaskResponse.from(taskService.submitCorrection(id, req.correctedJson(), req.feedback()));
        } catch (TaskNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (InvalidTaskStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    @DeleteMapping("/tasks/{id}")
    public ResponseEntity<Void> deleteTask(@PathVariable UUID id) {
        if (!taskService.delete(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Task with ID " + id + " not found");
        }
        return ResponseEntity.noContent().build();
    }
}
