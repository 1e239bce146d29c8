package com.dashforge.orchestrator.store;

import com.dashforge.orchestrator.model.Candidate;
import com.dashforge.orchestrator.model.GenerationRequest;
import com.dashforge.orchestrator.model.Task;
import com.dashforge.orchestrator.model.TaskStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * In-process task lifecycle store.
 *
 * The map is the only shared mutable state in the service. Every update is a
 * {@link ConcurrentHashMap#computeIfPresent} over an immutable {@link Task}, so
 * a read-modify-write on one id never interleaves with another update to the
 * same id, and concurrent readers see either the old or the new snapshot.
 *
 * Nothing is persisted: tasks live until the process stops or a caller
 * deletes them explicitly.
 */
@Component
public class TaskStore {

    private static final Logger log = LoggerFactory.getLogger(TaskStore.class);

    private final Map<UUID, Task> tasks = new ConcurrentHashMap<>();

    public TaskStore(MeterRegistry meterRegistry) {
        for (TaskStatus status : TaskStatus.values()) {
            Gauge.builder("dashforge.tasks", this, store -> store.count(status))
                    .tag("status", status.wireName())
                    .register(meterRegistry);
        }
    }

    public UUID createTask(GenerationRequest request) {
        UUID id = UUID.randomUUID();
        tasks.put(id, Task.pending(id, request));
        log.info("Created task {} (backend={}, maxRetries={})", id, request.backend(), request.maxRetries());
        return id;
    }

    public Optional<Task> getTask(UUID id) {
        return Optional.ofNullable(tasks.get(id));
    }

    /**
     * Atomically apply {@code mutation} to the task.
     *
     * An exception thrown by the mutation propagates and leaves the stored
     * task unchanged.
     *
     * @throws TaskNotFoundException if the id is unknown
     */
    public Task update(UUID id, UnaryOperator<Task> mutation) {
        Task updated = tasks.computeIfPresent(id, (key, current) -> mutation.apply(current));
        if (updated == null) {
            throw new TaskNotFoundException(id);
        }
        log.debug("Updated task {}: status={} phase={} attempt={}",
                id, updated.status().wireName(), updated.phase(), updated.attemptCount());
        return updated;
    }

    /**
     * Convenience form of {@link #update}: null arguments leave the field as is.
     */
    public Task updateTask(UUID id, TaskStatus status, String error, Candidate result) {
        Task updated = update(id, current -> {
            Task next = current;
            if (status != null) next = next.withStatus(status);
            if (error  != null) next = next.withError(error);
            if (result != null) next = next.withResult(result);
            return next;
        });
        log.info("Updated task {}: status={}", id, updated.status().wireName());
        return updated;
    }

    public boolean delete(UUID id) {
        boolean removed = tasks.remove(id) != null;
        if (removed) {
            log.info("Deleted task {}", id);
        }
        return removed;
    }

    public Map<TaskStatus, Long> countByStatus() {
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, count(status));
        }
        return counts;
    }

    private long count(TaskStatus status) {
        return tasks.values().stream().filter(t -> t.status() == status).count();
    }
}
