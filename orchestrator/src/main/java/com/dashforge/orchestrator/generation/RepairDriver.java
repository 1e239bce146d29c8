package com.dashforge.orchestrator.generation;

import com.dashforge.orchestrator.generation.DriverException.Kind;
import com.dashforge.orchestrator.generation.DriverException.Stage;
import com.dashforge.orchestrator.llm.LlmCallException;
import com.dashforge.orchestrator.llm.ModelRegistry;
import com.dashforge.orchestrator.llm.UnknownModelException;
import com.dashforge.orchestrator.model.Candidate;
import com.dashforge.orchestrator.model.GenerationRequest;
import com.dashforge.orchestrator.model.RepairHint;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Asks the model to fix a Candidate given its repair hints.
 *
 * Knows how to ask for a fix, not how many fixes are allowed: attempt
 * counting stays in the workflow.
 */
@Component
public class RepairDriver {

    private static final Logger log = LoggerFactory.getLogger(RepairDriver.class);

    private final ModelRegistry   models;
    private final PromptTemplates prompts;
    private final ObjectMapper    objectMapper;

    public RepairDriver(ModelRegistry models, PromptTemplates prompts, ObjectMapper objectMapper) {
        this.models       = models;
        this.prompts      = prompts;
        this.objectMapper = objectMapper;
    }

    /**
     * @throws DriverException with stage REPAIR on model or parse failure
     */
    public Candidate repair(Candidate candidate, List<RepairHint> hints, GenerationRequest request) {
        String userPrompt = prompts.repairPrompt(candidate.document().toPrettyString(), hints);
        log.debug("Requesting repair for {} hint(s) with backend '{}'", hints.size(), request.backend());

        String response;
        try {
            response = models.complete(request.backend(), prompts.repairSystemPrompt(), userPrompt);
        } catch (LlmCallException | UnknownModelException e) {
            throw new DriverException(Stage.REPAIR, Kind.MODEL_CALL, e.getMessage(), e);
        }

        try {
            return ResponseParser.parseCandidate(response, objectMapper);
        } catch (ResponseParseException e) {
            throw new DriverException(Stage.REPAIR, Kind.PARSE, e.getMessage(), e);
        }
    }
}
