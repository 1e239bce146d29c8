package com.dashforge.orchestrator.store;

import com.dashforge.orchestrator.model.TaskStatus;

import java.util.UUID;

/**
 * Thrown when an operation requires the task to be in a specific status.
 * The task is left untouched.
 */
public class InvalidTaskStateException extends RuntimeException {

    private final TaskStatus actual;

    public InvalidTaskStateException(UUID id, TaskStatus expected, TaskStatus actual) {
        super("Task %s is %s, expected %s".formatted(id, actual.wireName(), expected.wireName()));
        this.actual = actual;
    }

    public TaskStatus getActual() { return actual; }
}
