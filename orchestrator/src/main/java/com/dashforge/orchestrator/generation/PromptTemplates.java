package com.dashforge.orchestrator.generation;

import com.dashforge.orchestrator.model.RepairHint;
import com.dashforge.orchestrator.validation.SchemaCatalogue;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Fixed prompt templates for generation and repair.
 *
 * The permitted panel types are read from the {@link SchemaCatalogue} at
 * startup, so the prompts always agree with what the validator accepts.
 */
@Component
public class PromptTemplates {

    private static final Pattern SLOT = Pattern.compile("\\{\\{([A-Z_]+)}}");

    private final String panelTypes;

    public PromptTemplates(SchemaCatalogue catalogue) {
        this.panelTypes = String.join(", ", catalogue.panelTypes());
    }

    public String generationSystemPrompt() {
        return fill(GENERATION_SYSTEM_PROMPT, Map.of("PANEL_TYPES", panelTypes));
    }

    public String repairSystemPrompt() {
        return fill(REPAIR_SYSTEM_PROMPT, Map.of("PANEL_TYPES", panelTypes));
    }

    public String contextAugmentedPrompt(String userPrompt, String context) {
        return fill(CONTEXT_AUGMENTED_PROMPT, Map.of("USER_PROMPT", userPrompt, "CONTEXT", context));
    }

    public String repairPrompt(String dashboardJson, List<RepairHint> hints) {
        String errors = hints.stream()
                .map(h -> "- " + h.instruction())
                .collect(Collectors.joining("\n"));
        return fill(REPAIR_PROMPT, Map.of("DASHBOARD_JSON", dashboardJson, "ERRORS", errors));
    }

    /**
     * Fills every {{SLOT}} of the template in a single pass. Inserted values
     * are never scanned again, so slot-like text inside a user prompt or a
     * candidate document is left as written.
     */
    static String fill(String template, Map<String, String> values) {
        return SLOT.matcher(template).replaceAll(
                slot -> Matcher.quoteReplacement(values.getOrDefault(slot.group(1), slot.group())));
    }

    // ------------------------------------------------------------------
    // Templates ({{...}} slots are filled by fill)
    // ------------------------------------------------------------------

    private static final String PANEL_EXAMPLE = """
            Example of a valid panel structure:
            {
              "id": 1,
              "type": "graph",
              "title": "Panel Title",
              "gridPos": {
                "h": 8,
                "w": 12,
                "x": 0,
                "y": 0
              }
            }
            """;

    private static final String GENERATION_SYSTEM_PROMPT = """
            You are an expert in creating Grafana dashboards.
            Your task is to generate a valid JSON configuration for a Grafana dashboard based on the user's description.

            The generated JSON must follow these guidelines:
            1. Include all required fields: panels, title
            2. Each panel must have id (integer), type, title, and gridPos with integer h, w, x, y
            3. Panel type must be one of: {{PANEL_TYPES}}
            4. Use appropriate data sources and query expressions
            5. Include reasonable visualization options
            6. Keep the dashboard well-organized and visually effective

            IMPORTANT: Output ONLY the JSON object, with no additional text or explanations.

            """ + PANEL_EXAMPLE;

    private static final String REPAIR_SYSTEM_PROMPT = """
            You are an expert in fixing Grafana dashboard JSON configurations.
            You will be given a JSON configuration that has validation errors, along with error descriptions.

            Fix these errors and return the corrected JSON configuration.

            IMPORTANT:
            1. Fix all validation errors
            2. Output ONLY the fixed JSON with no additional text or explanation
            3. Make sure all required fields are present and have the correct types
            4. Panel type must be one of: {{PANEL_TYPES}}
            5. Keep as much of the original structure and intent as possible

            """ + PANEL_EXAMPLE;

    private static final String CONTEXT_AUGMENTED_PROMPT = """
            I am generating a Grafana dashboard for the following description:

            {{USER_PROMPT}}

            I have some additional context that might be helpful:

            {{CONTEXT}}

            Using the context above, generate a complete, valid JSON configuration for a Grafana dashboard
            based on the description.

            Make sure your response follows these guidelines:
            1. Include all required fields for the dashboard (title, panels, etc.)
            2. Each panel must have the required fields (id, type, title, gridPos)
            3. Use panel types that suit the data being displayed
            4. Configure data sources and queries that match the requirements
            5. Set reasonable visualization options and thresholds where applicable
            6. Lay panels out logically with sensible gridPos values
            7. Add descriptive titles and appropriate units for all visualizations

            Your response must be ONLY the JSON object with no additional text or explanations.
            """;

    private static final String REPAIR_PROMPT = """
            Here's a Grafana dashboard JSON with validation errors:

            {{DASHBOARD_JSON}}

            The following errors were found:
            {{ERRORS}}

            Please provide the fixed JSON that resolves these errors.
            """;
}
