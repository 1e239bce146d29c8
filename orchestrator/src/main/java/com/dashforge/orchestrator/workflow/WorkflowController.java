package com.dashforge.orchestrator.workflow;

import com.dashforge.orchestrator.generation.DriverException;
import com.dashforge.orchestrator.generation.GenerationDriver;
import com.dashforge.orchestrator.generation.RepairDriver;
import com.dashforge.orchestrator.model.Candidate;
import com.dashforge.orchestrator.model.Diagnostic;
import com.dashforge.orchestrator.model.GenerationRequest;
import com.dashforge.orchestrator.model.RepairHint;
import com.dashforge.orchestrator.model.Task;
import com.dashforge.orchestrator.model.TaskStatus;
import com.dashforge.orchestrator.store.TaskNotFoundException;
import com.dashforge.orchestrator.store.TaskStore;
import com.dashforge.orchestrator.validation.DiagnosticEngine;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * The generate / validate / repair loop for one task.
 *
 * A run starts in GENERATING and advances one {@link RunState} at a time
 * until it reaches DONE. Every state entered is written to the
 * {@link TaskStore} before the next phase begins, so a poller always sees
 * the phase that is actually executing.
 *
 * Outcomes map to task statuses:
 *   Succeeded → completed
 *   Escalated → awaiting_human (candidate, diagnostics and hints attached)
 *   Failed    → failed (error message attached)
 *
 * Nothing thrown inside a run escapes {@link #run}: unexpected faults are
 * recorded on the task as {@code Internal error: ...}.
 */
@Component
public class WorkflowController {

    private static final Logger log = LoggerFactory.getLogger(WorkflowController.class);

    private final GenerationDriver generationDriver;
    private final RepairDriver     repairDriver;
    private final DiagnosticEngine diagnosticEngine;
    private final TaskStore        taskStore;
    private final MeterRegistry    meterRegistry;

    public WorkflowController(GenerationDriver generationDriver,
                              RepairDriver repairDriver,
                              DiagnosticEngine diagnosticEngine,
                              TaskStore taskStore,
                              MeterRegistry meterRegistry) {
        this.generationDriver = generationDriver;
        this.repairDriver     = repairDriver;
        this.diagnosticEngine = diagnosticEngine;
        this.taskStore        = taskStore;
        this.meterRegistry    = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Entry point, called by WorkflowScheduler on a worker thread
    // ------------------------------------------------------------------

    /**
     * Drive the task to an outcome. Blocks for the whole run; model calls
     * are the only waits.
     */
    public RunOutcome run(UUID taskId, GenerationRequest request) {
        MDC.put("taskId",  taskId.toString());
        MDC.put("backend", request.backend());
        MDC.put("attempt", "0");
        try {
            log.info("Starting workflow run: backend={} maxRetries={} useContext={}",
                    request.backend(), request.maxRetries(), request.useContext());

            RunOutcome outcome;
            try {
                outcome = drive(taskId, request);
                record(taskId, outcome);
            } catch (TaskNotFoundException e) {
                log.warn("Task {} was deleted mid-run, abandoning it", taskId);
                outcome = new RunOutcome.Failed("internal", e.getMessage(), 0);
            } catch (RuntimeException e) {
                log.error("Unexpected error in workflow run for task {}: {}", taskId, e.getMessage(), e);
                outcome = new RunOutcome.Failed("internal",
                        "Internal error: " + e.getMessage(), attemptsSoFar(taskId));
                recordQuietly(taskId, outcome);
            }

            meterRegistry.counter("dashforge.workflow.runs", "outcome", outcome.label()).increment();
            log.info("Workflow run finished: outcome={} attempts={}", outcome.label(), outcome.attempts());
            return outcome;
        } finally {
            MDC.clear();
        }
    }

    // ------------------------------------------------------------------
    // State machine
    // ------------------------------------------------------------------

    private RunOutcome drive(UUID taskId, GenerationRequest request) {
        RunState state = new RunState.Generating();
        taskStore.update(taskId, t -> t.withStatus(TaskStatus.RUNNING).withPhase("GENERATING", 0));

        while (!(state instanceof RunState.Done)) {
            state = advance(state, request);
            if (!(state instanceof RunState.Done)) {
                enter(taskId, state);
            }
        }
        return ((RunState.Done) state).outcome();
    }

    private RunState advance(RunState state, GenerationRequest request) {
        if (state instanceof RunState.Generating) {
            try {
                return new RunState.Validating(generationDriver.generate(request), 0);
            } catch (DriverException e) {
                return failed(e, 0);
            }
        }

        if (state instanceof RunState.Validating validating) {
            List<Diagnostic> diagnostics = diagnosticEngine.validate(validating.candidate());
            RoutingTable.Route route =
                    RoutingTable.decide(diagnostics, validating.attempt(), request.maxRetries());
            log.info("Validation at attempt {}: {} diagnostic(s) → {}",
                    validating.attempt(), diagnostics.size(), route);
            return switch (route) {
                case FINALIZE -> new RunState.Done(
                        new RunOutcome.Succeeded(validating.candidate(), validating.attempt()));
                case ESCALATE -> new RunState.Escalating(
                        validating.candidate(), diagnostics, validating.attempt());
                // the repair cycle is counted before the repair call is made
                case REPAIR -> new RunState.Repairing(
                        validating.candidate(), diagnostics, validating.attempt() + 1);
            };
        }

        if (state instanceof RunState.Repairing repairing) {
            List<RepairHint> hints = diagnosticEngine.extractHints(repairing.diagnostics());
            try {
                Candidate repaired = repairDriver.repair(repairing.candidate(), hints, request);
                return new RunState.Validating(repaired, repairing.attempt());
            } catch (DriverException e) {
                return failed(e, repairing.attempt());
            }
        }

        if (state instanceof RunState.Escalating escalating) {
            List<RepairHint> hints = diagnosticEngine.extractHints(escalating.diagnostics());
            log.warn("Repair budget of {} exhausted with {} diagnostic(s), escalating to human review",
                    request.maxRetries(), escalating.diagnostics().size());
            return new RunState.Done(new RunOutcome.Escalated(
                    escalating.candidate(), escalating.diagnostics(), hints, escalating.attempt()));
        }

        throw new IllegalStateException("No transition out of " + state.phase());
    }

    private static RunState.Done failed(DriverException e, int attempt) {
        log.warn("{}", e.getMessage());
        String stage = e.getStage().name().toLowerCase(Locale.ROOT);
        return new RunState.Done(new RunOutcome.Failed(stage, e.getMessage(), attempt));
    }

    // ------------------------------------------------------------------
    // Store writes
    // ------------------------------------------------------------------

    private void enter(UUID taskId, RunState state) {
        MDC.put("attempt", String.valueOf(state.attempt()));
        taskStore.update(taskId, t -> t.withPhase(state.phase(), state.attempt()));
    }

    private void record(UUID taskId, RunOutcome outcome) {
        if (outcome instanceof RunOutcome.Succeeded succeeded) {
            taskStore.update(taskId, t -> t
                    .withResult(succeeded.candidate())
                    .withStatus(TaskStatus.COMPLETED)
                    .withPhase("DONE", succeeded.attempts()));
        } else if (outcome instanceof RunOutcome.Escalated escalated) {
            // the task waits in ESCALATING until a reviewer submits a correction
            taskStore.update(taskId, t -> t
                    .withResult(escalated.candidate())
                    .withFindings(escalated.diagnostics(), escalated.hints())
                    .withStatus(TaskStatus.AWAITING_HUMAN)
                    .withPhase("ESCALATING", escalated.attempts()));
        } else if (outcome instanceof RunOutcome.Failed failed) {
            taskStore.update(taskId, t -> t
                    .withError(failed.message())
                    .withStatus(TaskStatus.FAILED)
                    .withPhase("DONE", failed.attempts()));
        }
    }

    private void recordQuietly(UUID taskId, RunOutcome outcome) {
        try {
            record(taskId, outcome);
        } catch (RuntimeException e) {
            log.error("Could not record failure for task {}: {}", taskId, e.getMessage());
        }
    }

    private int attemptsSoFar(UUID taskId) {
        return taskStore.getTask(taskId).map(Task::attemptCount).orElse(0);
    }
}
