package com.dashforge.orchestrator.store;

import com.dashforge.orchestrator.model.Candidate;
import com.dashforge.orchestrator.model.GenerationRequest;
import com.dashforge.orchestrator.model.Task;
import com.dashforge.orchestrator.model.TaskStatus;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskStoreTest {

    SimpleMeterRegistry meterRegistry;
    TaskStore           store;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        store = new TaskStore(meterRegistry);
    }

    // ------------------------------------------------------------------
    // create / get
    // ------------------------------------------------------------------

    @Test
    void createTask_startsPendingWithRequestFields() {
        UUID id = store.createTask(new GenerationRequest("CPU dashboard", "anthropic", 2, true));

        Task task = store.getTask(id).orElseThrow();
        assertThat(task.status()).isEqualTo(TaskStatus.PENDING);
        assertThat(task.prompt()).isEqualTo("CPU dashboard");
        assertThat(task.backend()).isEqualTo("anthropic");
        assertThat(task.maxRetries()).isEqualTo(2);
        assertThat(task.attemptCount()).isZero();
        assertThat(task.result()).isNull();
    }

    @Test
    void getTask_unknownId_isEmpty() {
        assertThat(store.getTask(UUID.randomUUID())).isEmpty();
    }

    // ------------------------------------------------------------------
    // updates
    // ------------------------------------------------------------------

    @Test
    void updateTask_nullArgumentsLeaveFieldsUnchanged() {
        UUID id = store.createTask(GenerationRequest.of("CPU"));
        Candidate result = new Candidate(JsonNodeFactory.instance.objectNode().put("title", "CPU"));

        store.updateTask(id, TaskStatus.COMPLETED, null, result);
        Task task = store.updateTask(id, null, null, null);

        assertThat(task.status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(task.result()).isEqualTo(result);
        assertThat(task.error()).isNull();
    }

    @Test
    void updateTask_unknownId_throwsNotFound() {
        UUID id = UUID.randomUUID();
        assertThatThrownBy(() -> store.updateTask(id, TaskStatus.FAILED, "boom", null))
                .isInstanceOf(TaskNotFoundException.class)
                .hasMessage("Task with ID " + id + " not found");
    }

    @Test
    void update_mutationThrows_taskLeftUnchanged() {
        UUID id = store.createTask(GenerationRequest.of("CPU"));
        Task before = store.getTask(id).orElseThrow();

        assertThatThrownBy(() -> store.update(id, t -> {
            throw new InvalidTaskStateException(id, TaskStatus.AWAITING_HUMAN, t.status());
        })).isInstanceOf(InvalidTaskStateException.class);

        assertThat(store.getTask(id)).contains(before);
    }

    @Test
    void update_concurrentIncrements_areNotLost() throws Exception {
        UUID id = store.createTask(GenerationRequest.of("CPU"));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(pool.submit(() ->
                        store.update(id, t -> t.withPhase("REPAIRING", t.attemptCount() + 1))));
            }
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.getTask(id).orElseThrow().attemptCount()).isEqualTo(200);
    }

    // ------------------------------------------------------------------
    // delete / counts
    // ------------------------------------------------------------------

    @Test
    void delete_removesOnce() {
        UUID id = store.createTask(GenerationRequest.of("CPU"));

        assertThat(store.delete(id)).isTrue();
        assertThat(store.delete(id)).isFalse();
        assertThat(store.getTask(id)).isEmpty();
    }

    @Test
    void countByStatus_andGauge_trackStatuses() {
        UUID a = store.createTask(GenerationRequest.of("a"));
        store.createTask(GenerationRequest.of("b"));
        store.updateTask(a, TaskStatus.RUNNING, null, null);

        assertThat(store.countByStatus())
                .containsEntry(TaskStatus.PENDING, 1L)
                .containsEntry(TaskStatus.RUNNING, 1L)
                .containsEntry(TaskStatus.COMPLETED, 0L);
        assertThat(meterRegistry.get("dashforge.tasks").tag("status", "pending").gauge().value())
                .isEqualTo(1.0);
    }
}
