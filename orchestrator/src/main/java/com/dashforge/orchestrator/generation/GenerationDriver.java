package com.dashforge.orchestrator.generation;

import com.dashforge.orchestrator.context.ContextFormatter;
import com.dashforge.orchestrator.context.ContextRetriever;
import com.dashforge.orchestrator.generation.DriverException.Kind;
import com.dashforge.orchestrator.generation.DriverException.Stage;
import com.dashforge.orchestrator.llm.LlmCallException;
import com.dashforge.orchestrator.llm.ModelRegistry;
import com.dashforge.orchestrator.llm.UnknownModelException;
import com.dashforge.orchestrator.model.Candidate;
import com.dashforge.orchestrator.model.GenerationRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Produces the first Candidate for a request.
 *
 * One model call, no retry: retry policy belongs to the workflow.
 */
@Component
public class GenerationDriver {

    private static final Logger log = LoggerFactory.getLogger(GenerationDriver.class);

    private final ModelRegistry    models;
    private final PromptTemplates  prompts;
    private final ContextRetriever retriever;
    private final ContextFormatter formatter;
    private final ObjectMapper     objectMapper;

    public GenerationDriver(ModelRegistry models,
                            PromptTemplates prompts,
                            ContextRetriever retriever,
                            ContextFormatter formatter,
                            ObjectMapper objectMapper) {
        this.models       = models;
        this.prompts      = prompts;
        this.retriever    = retriever;
        this.formatter    = formatter;
        this.objectMapper = objectMapper;
    }

    /**
     * Generate a Candidate, retrieving context first when the request asks for it.
     *
     * @throws DriverException with stage GENERATION on model or parse failure
     */
    public Candidate generate(GenerationRequest request) {
        return generate(request, request.useContext() ? retrieveContext(request) : null);
    }

    /**
     * Generate a Candidate with an already rendered context block.
     * A null block means a plain prompt.
     */
    public Candidate generate(GenerationRequest request, String contextBlock) {
        String userPrompt = contextBlock == null
                ? request.prompt()
                : prompts.contextAugmentedPrompt(request.prompt(), contextBlock);

        String response;
        try {
            response = models.complete(request.backend(), prompts.generationSystemPrompt(), userPrompt);
        } catch (LlmCallException | UnknownModelException e) {
            throw new DriverException(Stage.GENERATION, Kind.MODEL_CALL, e.getMessage(), e);
        }

        try {
            Candidate candidate = ResponseParser.parseCandidate(response, objectMapper);
            log.info("Generated candidate ({} chars of JSON) with backend '{}'",
                    candidate.toString().length(), request.backend());
            return candidate;
        } catch (ResponseParseException e) {
            throw new DriverException(Stage.GENERATION, Kind.PARSE, e.getMessage(), e);
        }
    }

    /**
     * Retrieval problems only cost the extra context; generation goes ahead
     * with the plain prompt.
     */
    private String retrieveContext(GenerationRequest request) {
        try {
            return formatter.format(retriever.retrieve(request.prompt()));
        } catch (RuntimeException e) {
            log.warn("Context retrieval failed, generating without context: {}", e.getMessage());
            return null;
        }
    }
}
