package com.dashforge.orchestrator.api.dto;

import com.dashforge.orchestrator.llm.GenerativeModel;

/** One entry of GET /api/models. */
public record ModelResponse(String id, String name) {

    public static ModelResponse from(GenerativeModel model) {
        return new ModelResponse(model.id(), model.displayName());
    }
}
