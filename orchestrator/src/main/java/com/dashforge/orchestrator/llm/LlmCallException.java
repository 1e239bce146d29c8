package com.dashforge.orchestrator.llm;

/**
 * A model call failed: non-2xx response, timeout, unreadable body.
 * statusCode is -1 when no HTTP response was received.
 */
public class LlmCallException extends RuntimeException {

    private final int statusCode;

    public LlmCallException(int statusCode, String body) {
        super("Model API error %d: %s".formatted(statusCode, body));
        this.statusCode = statusCode;
    }

    public LlmCallException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int statusCode() { return statusCode; }
}
