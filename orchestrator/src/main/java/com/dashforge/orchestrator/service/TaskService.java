package com.dashforge.orchestrator.service;

import com.dashforge.orchestrator.llm.GenerativeModel;
import com.dashforge.orchestrator.llm.ModelRegistry;
import com.dashforge.orchestrator.llm.UnknownModelException;
import com.dashforge.orchestrator.model.Candidate;
import com.dashforge.orchestrator.model.GenerationRequest;
import com.dashforge.orchestrator.model.Task;
import com.dashforge.orchestrator.model.TaskStatus;
import com.dashforge.orchestrator.store.InvalidTaskStateException;
import com.dashforge.orchestrator.store.TaskNotFoundException;
import com.dashforge.orchestrator.store.TaskStore;
import com.dashforge.orchestrator.workflow.WorkflowScheduler;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;

/**
 * Task lifecycle as seen from the REST boundary: submission, polling,
 * human correction and removal.
 */
@Service
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskStore         taskStore;
    private final WorkflowScheduler scheduler;
    private final ModelRegistry     models;

    public TaskService(TaskStore taskStore, WorkflowScheduler scheduler, ModelRegistry models) {
        this.taskStore = taskStore;
        this.scheduler = scheduler;
        this.models    = models;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Register a pending task and queue its run.
     *
     * The returned snapshot is the one taken before scheduling, so callers
     * always see {@code pending} even when a worker picks the task up at once.
     *
     * @throws UnknownModelException if the backend is not registered
     */
    public Task submit(GenerationRequest request) {
        if (!models.contains(request.backend())) {
            throw new UnknownModelException(request.backend());
        }

        UUID id = taskStore.createTask(request);
        Task created = taskStore.getTask(id).orElseThrow(() -> new TaskNotFoundException(id));

        try {
            scheduler.schedule(id, request);
        } catch (RejectedExecutionException e) {
            log.error("Could not schedule task {}: {}", id, e.getMessage());
            return taskStore.updateTask(id, TaskStatus.FAILED, "Service is shutting down", null);
        }
        return created;
    }

    public Optional<Task> findById(UUID id) {
        return taskStore.getTask(id);
    }

    // ------------------------------------------------------------------
    // Human correction
    // ------------------------------------------------------------------

    /**
     * Accept a reviewer's dashboard for an escalated task. The document is
     * stored as given and is not validated again.
     *
     * @throws TaskNotFoundException     unknown id
     * @throws InvalidTaskStateException task is not awaiting_human; nothing changes
     */
    public Task submitCorrection(UUID id, JsonNode correctedDashboard, String feedback) {
        Candidate corrected = new Candidate(correctedDashboard);
        Task updated = taskStore.update(id, current -> {
            if (current.status() != TaskStatus.AWAITING_HUMAN) {
                throw new InvalidTaskStateException(id, TaskStatus.AWAITING_HUMAN, current.status());
            }
            return current.withHumanCorrection(corrected, feedback).withPhase("DONE", current.attemptCount());
        });
        log.info("Task {} completed by human correction after {} repair attempt(s)", id, updated.attemptCount());
        return updated;
    }

    public boolean delete(UUID id) {
        return taskStore.delete(id);
    }

    public Collection<GenerativeModel> availableModels() {
        return models.all();
    }
}
