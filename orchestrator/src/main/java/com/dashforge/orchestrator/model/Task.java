package com.dashforge.orchestrator.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Immutable snapshot of one generation task.
 *
 * The task store never mutates a Task in place: every transition produces
 * a new snapshot via one of the {@code with...} methods and swaps it in
 * atomically, so a poller always sees a complete state.
 *
 * result is the last Candidate (final when COMPLETED, the one awaiting review
 * when AWAITING_HUMAN). diagnostics and hints are only populated on escalation.
 */
public record Task(
        UUID              id,
        TaskStatus        status,
        String            phase,
        String            prompt,
        String            backend,
        int               maxRetries,
        Candidate         result,
        String            error,
        int               attemptCount,
        List<Diagnostic>  diagnostics,
        List<RepairHint>  hints,
        String            humanFeedback,
        boolean           correctedByHuman,
        Instant           createdAt,
        Instant           updatedAt
) {

    public Task {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        hints       = hints == null ? List.of() : List.copyOf(hints);
    }

    public static Task pending(UUID id, GenerationRequest request) {
        Instant now = Instant.now();
        return new Task(id, TaskStatus.PENDING, null,
                request.prompt(), request.backend(), request.maxRetries(),
                null, null, 0, List.of(), List.of(), null, false, now, now);
    }

    public Task withStatus(TaskStatus newStatus) {
        return new Task(id, newStatus, phase, prompt, backend, maxRetries, result, error,
                attemptCount, diagnostics, hints, humanFeedback, correctedByHuman, createdAt, Instant.now());
    }

    public Task withPhase(String newPhase, int newAttemptCount) {
        return new Task(id, status, newPhase, prompt, backend, maxRetries, result, error,
                newAttemptCount, diagnostics, hints, humanFeedback, correctedByHuman, createdAt, Instant.now());
    }

    public Task withResult(Candidate newResult) {
        return new Task(id, status, phase, prompt, backend, maxRetries, newResult, error,
                attemptCount, diagnostics, hints, humanFeedback, correctedByHuman, createdAt, Instant.now());
    }

    public Task withError(String newError) {
        return new Task(id, status, phase, prompt, backend, maxRetries, result, newError,
                attemptCount, diagnostics, hints, humanFeedback, correctedByHuman, createdAt, Instant.now());
    }

    public Task withFindings(List<Diagnostic> newDiagnostics, List<RepairHint> newHints) {
        return new Task(id, status, phase, prompt, backend, maxRetries, result, error,
                attemptCount, newDiagnostics, newHints, humanFeedback, correctedByHuman, createdAt, Instant.now());
    }

    /** Accept a reviewer's document as the final result. Findings are cleared. */
    public Task withHumanCorrection(Candidate corrected, String feedback) {
        return new Task(id, TaskStatus.COMPLETED, phase, prompt, backend, maxRetries, corrected, null,
                attemptCount, List.of(), List.of(), feedback, true, createdAt, Instant.now());
    }
}
