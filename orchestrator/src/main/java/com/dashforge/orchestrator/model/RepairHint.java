package com.dashforge.orchestrator.model;

/**
 * Normalised repair instruction derived from a {@link Diagnostic}.
 * The instruction text is what the repair prompt shows the model.
 */
public record RepairHint(Kind kind, String path, String instruction) {

    public enum Kind { MISSING_PROPERTY, TYPE_MISMATCH, NO_MATCHING_SCHEMA, OTHER }

    @Override
    public String toString() {
        return instruction;
    }
}
