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
 * Thin wrapper around the OpenAI Chat Completions API.
 * Same shape as {@link ClaudeClient}: one POST, Jackson in and out.
 */
public class OpenAiClient implements GenerativeModel {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChatMessage(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CompletionResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Choice(ChatMessage message) {}

        public String firstContent() {
            if (choices == null || choices.isEmpty() || choices.get(0).message() == null) {
                throw new IllegalStateException("No choices in response");
            }
            String content = choices.get(0).message().content();
            return content == null ? "" : content;
        }
    }

    private static final int MAX_TOKENS = 4096;

    private final String       id;
    private final String       displayName;
    private final String       model;
    private final URI          endpoint;
    private final String       apiKey;
    private final double       temperature;
    private final Duration     timeout;
    private final ObjectMapper json;
    private final HttpClient   http;

    public OpenAiClient(String id, String displayName, String model,
                        String baseUrl, String apiKey, double temperature,
                        Duration timeout, ObjectMapper objectMapper) {
        this.id          = id;
        this.displayName = displayName;
        this.model       = model;
        this.endpoint    = URI.create(baseUrl + "/v1/chat/completions");
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
                    "messages",    List.of(
                            new ChatMessage("system", systemPrompt),
                            new ChatMessage("user",   userPrompt))
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(endpoint)
                    .timeout(timeout)
                    .header("content-type",  "application/json")
                    .header("authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                throw new LlmCallException(response.statusCode(), response.body());
            }

            // Response shape: { id, choices: [{ index, message: {role, content}, finish_reason }], usage }
            return json.readValue(response.body(), CompletionResponse.class).firstContent();

        } catch (LlmCallException e) {
            throw e;
        } catch (HttpTimeoutException e) {
            throw new LlmCallException("OpenAI call timed out after " + timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmCallException("OpenAI call interrupted", e);
        } catch (Exception e) {
            throw new LlmCallException("OpenAI call failed: " + e.getMessage(), e);
        }
    }
}
