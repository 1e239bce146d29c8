package com.dashforge.orchestrator.workflow;

import com.dashforge.orchestrator.model.Candidate;
import com.dashforge.orchestrator.model.Diagnostic;
import com.dashforge.orchestrator.model.RepairHint;

import java.util.List;

/**
 * How a workflow run ended. Each variant maps to exactly one task status.
 */
public sealed interface RunOutcome
        permits RunOutcome.Succeeded, RunOutcome.Failed, RunOutcome.Escalated {

    /** Repair cycles consumed by the run. */
    int attempts();

    /** Metric tag and task status name. */
    String label();

    /** The last candidate passed validation. */
    record Succeeded(Candidate candidate, int attempts) implements RunOutcome {
        @Override public String label() { return "completed"; }
    }

    /**
     * Generation or repair could not produce a candidate, or the run hit an
     * unexpected fault. stage is "generation", "repair" or "internal".
     */
    record Failed(String stage, String message, int attempts) implements RunOutcome {
        @Override public String label() { return "failed"; }
    }

    /** Repair budget exhausted; a reviewer gets the last candidate and its findings. */
    record Escalated(Candidate candidate,
                     List<Diagnostic> diagnostics,
                     List<RepairHint> hints,
                     int attempts) implements RunOutcome {
        public Escalated {
            diagnostics = List.copyOf(diagnostics);
            hints       = List.copyOf(hints);
        }

        @Override public String label() { return "awaiting_human"; }
    }
}
