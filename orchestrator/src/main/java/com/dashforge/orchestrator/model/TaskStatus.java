package com.dashforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Externally observable status of a generation task.
 *
 * Transitions:
 *   PENDING → RUNNING → COMPLETED | FAILED | AWAITING_HUMAN
 *   AWAITING_HUMAN → COMPLETED   (human correction accepted)
 *
 * Serialised in lower case ("awaiting_human") on the wire.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    AWAITING_HUMAN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
