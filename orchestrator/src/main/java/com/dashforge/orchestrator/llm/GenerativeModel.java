package com.dashforge.orchestrator.llm;

/**
 * One selectable model backend.
 *
 * A single request/response call: no streaming, no retry. Implementations
 * must bound each call with a wall-clock timeout and report transport or
 * provider problems as {@link LlmCallException}.
 */
public interface GenerativeModel {

    /** Backend identifier used in generation requests, e.g. "gpt-4o". */
    String id();

    /** Human-readable name for the model catalogue. */
    String displayName();

    String complete(String systemPrompt, String userPrompt);
}
