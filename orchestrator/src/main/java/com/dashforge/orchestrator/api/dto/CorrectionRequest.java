package com.dashforge.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request body for POST /api/tasks/{id}/feedback.
 *
 * correctedJson is required and replaces the escalated dashboard as is.
 */
public record CorrectionRequest(
        @JsonAlias("corrected_json") JsonNode correctedJson,
        String feedback
) {
    public CorrectionRequest {
        if (feedback == null) feedback = "";
    }

    public boolean hasDashboard() {
        return correctedJson != null && !correctedJson.isNull() && !correctedJson.isMissingNode();
    }
}
