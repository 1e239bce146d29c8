package com.dashforge.orchestrator.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Anthropic Messages API.
 *
 * Raw {@link HttpClient} rather than an SDK: the endpoint is a single POST
 * and we want to see exactly what goes over the wire.
 */
public class ClaudeClient implements GenerativeModel {

    /** A single message in a conversation; role is "user" or "assistant". */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Text of the first text block. */
        public String firstText() {
            if (content == null) {
                throw new IllegalStateException("No content in response");
            }
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No text block in response"));
        }
    }

    private static final String API_VER    = "2023-06-01";
    private static final int    MAX_TOKENS = 4096;

    private final String       id;
    private final String       displayName;
    private final String       model;
    private final URI          endpoint;
    private final String       apiKey;
    private final double       temperature;
    private final Duration     timeout;
    private final ObjectMapper json;
    private final HttpClient   http;

    public ClaudeClient(String id, String displayName, String model,
                        String baseUrl, String apiKey, double temperature,
                        Duration timeout, ObjectMapper objectMapper) {
        this.id          = id;
        this.displayName = displayName;
        this.model       = model;
        this.endpoint    = URI.create(baseUrl + "/v1/messages");
        this.apiKey      = apiKey;
        this.temperature = temperature;
        this.timeout     = timeout;
        this.json        = objectMapper;
        this.http        = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override public String id()          { return id; }
    @Override public String displayName() { return displayName; }

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        try {
            String requestBody = json.writeValueAsString(Map.of(
                    "model",       model,
                    "max_tokens",  MAX_TOKENS,
                    "temperature", temperature,
                    "system",      systemPrompt,
                    "messages",    List.of(new Message("user", userPrompt))
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(endpoint)
                    .timeout(timeout)
                    .header("content-type",      "application/json")
                    .header("x-api-key",         apiKey)
                    .header("anthropic-version", API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                throw new LlmCallException(response.statusCode(), response.body());
            }

            // Full response shape: { id, type, role, content: [{type, text}], ... }
            return json.readValue(response.body(), MessagesResponse.class).firstText();

        } catch (LlmCallException e) {
            throw e;
        } catch (HttpTimeoutException e) {
            throw new LlmCallException("Anthropic call timed out after " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmCallException("Anthropic call interrupted", e);
        } catch (Exception e) {
            throw new LlmCallException("Anthropic call failed: " + e.getMessage(), e);
        }
    }
}
