package com.dashforge.orchestrator.llm;

public class UnknownModelException extends RuntimeException {
    public UnknownModelException(String id) {
        super("No model backend registered with id: '" + id + "'");
    }
}
