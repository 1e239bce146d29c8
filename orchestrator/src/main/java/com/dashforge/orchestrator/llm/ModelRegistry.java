package com.dashforge.orchestrator.llm;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-process registry of model backends.
 *
 * Every {@link GenerativeModel} bean is collected at startup. Responsibilities:
 * <ol>
 *   <li>Lookup by backend id ({@link #get}).</li>
 *   <li>Metrics-instrumented calls ({@link #complete}): every call is timed
 *       and counted, with no per-backend boilerplate.</li>
 * </ol>
 */
@Component
public class ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final Map<String, GenerativeModel> models = new LinkedHashMap<>();
    private final MeterRegistry meterRegistry;

    public ModelRegistry(List<GenerativeModel> allModels, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (GenerativeModel model : allModels) {
            models.put(model.id(), model);
            log.info("Registered model backend '{}' ({})", model.id(), model.displayName());
        }
    }

    public GenerativeModel get(String id) {
        GenerativeModel model = models.get(id);
        if (model == null) {
            throw new UnknownModelException(id);
        }
        return model;
    }

    public boolean contains(String id) {
        return models.containsKey(id);
    }

    /** Registered backends, in registration order. */
    public Collection<GenerativeModel> all() {
        return List.copyOf(models.values());
    }

    /**
     * Call a backend with full observability:
     * <pre>
     *   dashforge.llm.calls{model, status="success|error"}
     *   dashforge.llm.duration{model}
     * </pre>
     *
     * @throws UnknownModelException if no backend has this id
     * @throws LlmCallException      on any provider or transport failure
     */
    public String complete(String id, String systemPrompt, String userPrompt) {
        GenerativeModel model = get(id);

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            String reply = model.complete(systemPrompt, userPrompt);
            log.debug("Model '{}' replied with {} chars", id, reply == null ? 0 : reply.length());
            return reply;
        } catch (LlmCallException e) {
            status = "error";
            throw e;
        } catch (Exception e) {
            status = "error";
            throw new LlmCallException("Unexpected error from model '" + id + "': " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("dashforge.llm.duration", "model", id));
            meterRegistry.counter("dashforge.llm.calls", "model", id, "status", status).increment();
        }
    }
}
