package com.dashforge.orchestrator.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * The dashboard document under construction.
 *
 * Every generation or repair step produces a new Candidate; the wrapped
 * tree is copied on the way in and on the way out so no step can mutate
 * another step's output.
 */
public final class Candidate {

    private final JsonNode document;

    public Candidate(JsonNode document) {
        this.document = Objects.requireNonNull(document, "document").deepCopy();
    }

    public JsonNode document() {
        return document.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Candidate other && document.equals(other.document);
    }

    @Override
    public int hashCode() {
        return document.hashCode();
    }

    @Override
    public String toString() {
        return document.toString();
    }
}
