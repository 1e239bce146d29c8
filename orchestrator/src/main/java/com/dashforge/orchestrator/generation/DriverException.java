package com.dashforge.orchestrator.generation;

/**
 * A generation or repair step could not produce a Candidate.
 *
 * Fatal to the run: the workflow never retries these, the repair budget is
 * reserved for structural problems in a document that does exist.
 */
public class DriverException extends RuntimeException {

    public enum Stage { GENERATION, REPAIR }

    public enum Kind { MODEL_CALL, PARSE }

    private final Stage stage;
    private final Kind  kind;

    public DriverException(Stage stage, Kind kind, String message, Throwable cause) {
        super("%s failed (%s): %s".formatted(
                stage.name().toLowerCase(), kind.name().toLowerCase(), message), cause);
        this.stage = stage;
        this.kind  = kind;
    }

    public Stage getStage() { return stage; }
    public Kind  getKind()  { return kind; }
}
