package com.dashforge.orchestrator.workflow;

import com.dashforge.orchestrator.model.GenerationRequest;
import com.dashforge.orchestrator.model.TaskStatus;
import com.dashforge.orchestrator.store.TaskNotFoundException;
import com.dashforge.orchestrator.store.TaskStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs workflow runs on a fixed pool of worker threads.
 *
 * The pool caps how many model conversations are in flight at once; extra
 * submissions queue up and stay {@code pending} until a worker frees up.
 */
@Component
public class WorkflowScheduler {

    private static final Logger log = LoggerFactory.getLogger(WorkflowScheduler.class);

    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private final WorkflowController controller;
    private final TaskStore          taskStore;
    private final ExecutorService    workers;

    public WorkflowScheduler(WorkflowController controller,
                             TaskStore taskStore,
                             @Value("${dashforge.workflow.workers:4}") int workerCount) {
        this.controller = controller;
        this.taskStore  = taskStore;

        AtomicInteger sequence = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, workerCount), runnable -> {
            Thread thread = new Thread(runnable, "workflow-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        log.info("Workflow scheduler started with {} worker(s)", Math.max(1, workerCount));
    }

    /**
     * Queue a run for the task. Returns immediately.
     *
     * @throws java.util.concurrent.RejectedExecutionException after shutdown
     */
    public void schedule(UUID taskId, GenerationRequest request) {
        workers.submit(() -> {
            try {
                controller.run(taskId, request);
            } catch (Exception e) {
                log.error("Unhandled error in workflow run for task {}: {}", taskId, e.getMessage(), e);
                markFailed(taskId, "Unhandled exception: " + e.getMessage());
            }
        });
        log.debug("Scheduled task {}", taskId);
    }

    private void markFailed(UUID taskId, String reason) {
        try {
            taskStore.updateTask(taskId, TaskStatus.FAILED, reason, null);
        } catch (TaskNotFoundException e) {
            log.warn("Task {} is gone, failure not recorded: {}", taskId, reason);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping workflow scheduler");
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Workflow runs still active after {}s, interrupting", SHUTDOWN_GRACE_SECONDS);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
