package com.dashforge.orchestrator.generation;

/** The model's reply could not be read as a JSON document. */
public class ResponseParseException extends Exception {

    public ResponseParseException(String message) {
        super(message);
    }

    public ResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
