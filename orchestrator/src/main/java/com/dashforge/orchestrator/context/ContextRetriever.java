package com.dashforge.orchestrator.context;

import java.util.Map;

/**
 * Gathers contextual hints for a dashboard request.
 *
 * The result is a nested map (section → entries) that
 * {@link ContextFormatter} renders into the generation prompt.
 */
public interface ContextRetriever {

    Map<String, Object> retrieve(String requestText);
}
