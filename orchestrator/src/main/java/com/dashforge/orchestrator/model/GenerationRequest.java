package com.dashforge.orchestrator.model;

/**
 * Immutable input of one dashboard generation run.
 *
 * @param prompt     free-text description of the dashboard
 * @param backend    model backend identifier, see {@code ModelRegistry}
 * @param maxRetries repair budget; the initial generation does not count
 * @param useContext whether retrieved context is merged into the prompt
 */
public record GenerationRequest(String prompt, String backend, int maxRetries, boolean useContext) {

    public static final String DEFAULT_BACKEND     = "gpt-4o";
    public static final int    DEFAULT_MAX_RETRIES = 3;

    public GenerationRequest {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt must not be blank");
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be positive, got " + maxRetries);
        }
        if (backend == null || backend.isBlank()) backend = DEFAULT_BACKEND;
    }

    public static GenerationRequest of(String prompt) {
        return new GenerationRequest(prompt, DEFAULT_BACKEND, DEFAULT_MAX_RETRIES, false);
    }
}
