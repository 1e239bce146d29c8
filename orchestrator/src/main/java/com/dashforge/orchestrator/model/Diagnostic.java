package com.dashforge.orchestrator.model;

import java.util.List;

/**
 * One structural violation found in a Candidate.
 *
 * @param path    slash-joined field names and array indices ("panels/0/gridPos"),
 *                or {@link #ROOT} for the document itself
 * @param message checker message, e.g. {@code 'id' is a required property}
 */
public record Diagnostic(String path, String message) {

    public static final String ROOT = "root";

    public static Diagnostic atRoot(String message) {
        return new Diagnostic(ROOT, message);
    }

    public static String pathOf(List<String> segments) {
        return segments.isEmpty() ? ROOT : String.join("/", segments);
    }
}
