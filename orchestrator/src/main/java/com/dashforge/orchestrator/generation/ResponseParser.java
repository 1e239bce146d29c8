package com.dashforge.orchestrator.generation;

import com.dashforge.orchestrator.model.Candidate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the dashboard document from a model reply.
 *
 * Models often wrap JSON in a fenced code block (```json ... ```), sometimes
 * with prose around it. The first fenced block wins; without one the whole
 * reply is parsed.
 */
public class ResponseParser {

    // ```json ... ``` or ``` ... ``` (language label optional)
    private static final Pattern CODE_FENCE = Pattern.compile(
            "```(?:json|JSON)?[ \\t]*\\n?(.*?)\\n?[ \\t]*```",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    /**
     * Returns the content of the first fenced block, or the trimmed reply
     * when there is none. An unterminated opening fence is dropped.
     */
    public static String stripCodeFence(String response) {
        if (response == null) {
            return "";
        }
        Matcher m = CODE_FENCE.matcher(response);
        if (m.find()) {
            return m.group(1).strip();
        }
        String text = response.strip();
        if (text.startsWith("```")) {
            int newline = text.indexOf('\n');
            text = newline < 0 ? "" : text.substring(newline + 1).strip();
        }
        return text;
    }

    /**
     * Parse a model reply into a Candidate. Any JSON value is accepted; whether
     * it is a usable dashboard is for the validator to decide.
     *
     * @throws ResponseParseException if the reply is empty or not JSON
     */
    public static Candidate parseCandidate(String response, ObjectMapper objectMapper)
            throws ResponseParseException {
        String json = stripCodeFence(response);
        if (json.isEmpty()) {
            throw new ResponseParseException("model returned an empty response");
        }
        try {
            JsonNode document = objectMapper.readTree(json);
            if (document == null || document.isMissingNode()) {
                throw new ResponseParseException("model response contains no JSON value");
            }
            return new Candidate(document);
        } catch (JsonProcessingException e) {
            throw new ResponseParseException("model response is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
