package com.dashforge.orchestrator.workflow;

import com.dashforge.orchestrator.model.Candidate;
import com.dashforge.orchestrator.model.Diagnostic;

import java.util.List;

/**
 * Phase of a single workflow run, with exactly the data that phase needs.
 *
 * <pre>
 *   GENERATING → VALIDATING → DONE
 *                    ↓  ↑
 *                 REPAIRING        (bounded by maxRetries)
 *                    ↓
 *                ESCALATING → DONE (human correction, outside the run)
 * </pre>
 *
 * attempt counts repair cycles; it is raised when entering REPAIRING, before
 * the repair call is made.
 */
public sealed interface RunState
        permits RunState.Generating, RunState.Validating, RunState.Repairing,
                RunState.Escalating, RunState.Done {

    String phase();

    int attempt();

    record Generating() implements RunState {
        @Override public String phase()   { return "GENERATING"; }
        @Override public int    attempt() { return 0; }
    }

    record Validating(Candidate candidate, int attempt) implements RunState {
        @Override public String phase() { return "VALIDATING"; }
    }

    record Repairing(Candidate candidate, List<Diagnostic> diagnostics, int attempt) implements RunState {
        public Repairing {
            diagnostics = List.copyOf(diagnostics);
        }

        @Override public String phase() { return "REPAIRING"; }
    }

    record Escalating(Candidate candidate, List<Diagnostic> diagnostics, int attempt) implements RunState {
        public Escalating {
            diagnostics = List.copyOf(diagnostics);
        }

        @Override public String phase() { return "ESCALATING"; }
    }

    record Done(RunOutcome outcome) implements RunState {
        @Override public String phase()   { return "DONE"; }
        @Override public int    attempt() { return outcome.attempts(); }
    }
}
