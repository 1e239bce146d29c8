package com.dashforge.orchestrator.api.dto;

import com.dashforge.orchestrator.model.GenerationRequest;
import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Request body for POST /api/dashboards/generate.
 *
 * Required: prompt
 * Optional: modelProvider (default "gpt-4o"), maxRetries (default 3),
 *   useRag (default false). Snake-case names are accepted as well.
 */
public record GenerateDashboardRequest(
        String  prompt,
        @JsonAlias("model_provider") String  modelProvider,
        @JsonAlias("max_retries")    Integer maxRetries,
        @JsonAlias("use_rag")        Boolean useRag
) {

    /**
     * @throws IllegalArgumentException blank prompt or non-positive maxRetries
     */
    public GenerationRequest toGenerationRequest() {
        return new GenerationRequest(
                prompt,
                modelProvider,
                maxRetries == null ? GenerationRequest.DEFAULT_MAX_RETRIES : maxRetries,
                Boolean.TRUE.equals(useRag));
    }
}
