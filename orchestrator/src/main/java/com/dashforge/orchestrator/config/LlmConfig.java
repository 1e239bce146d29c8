package com.dashforge.orchestrator.config;

import com.dashforge.orchestrator.llm.ClaudeClient;
import com.dashforge.orchestrator.llm.GenerativeModel;
import com.dashforge.orchestrator.llm.OpenAiClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

import java.time.Duration;

/**
 * Model backends selectable per request.
 *
 * Backend ids: "openai", "gpt-4o" (default) and "anthropic".
 * API keys come from the environment, see application.yml.
 */
@Configuration
public class LlmConfig {

    @Value("${dashforge.llm.timeout:120s}")
    private Duration timeout;

    @Value("${dashforge.llm.temperature:0.1}")
    private double temperature;

    @Bean
    @Order(1)
    GenerativeModel openAiTurbo(@Value("${dashforge.llm.openai.base-url}") String baseUrl,
                                @Value("${dashforge.llm.openai.api-key}") String apiKey,
                                @Value("${dashforge.llm.openai.turbo-model:gpt-4-0125-preview}") String model,
                                ObjectMapper objectMapper) {
        return new OpenAiClient("openai", "OpenAI GPT-4 Turbo", model,
                baseUrl, apiKey, temperature, timeout, objectMapper);
    }

    @Bean
    @Order(2)
    GenerativeModel openAi4o(@Value("${dashforge.llm.openai.base-url}") String baseUrl,
                             @Value("${dashforge.llm.openai.api-key}") String apiKey,
                             @Value("${dashforge.llm.openai.omni-model:gpt-4o}") String model,
                             ObjectMapper objectMapper) {
        return new OpenAiClient("gpt-4o", "OpenAI GPT-4o (Default)", model,
                baseUrl, apiKey, temperature, timeout, objectMapper);
    }

    @Bean
    @Order(3)
    GenerativeModel anthropic(@Value("${dashforge.llm.anthropic.base-url}") String baseUrl,
                              @Value("${dashforge.llm.anthropic.api-key}") String apiKey,
                              @Value("${dashforge.llm.anthropic.model:claude-3-opus-20240229}") String model,
                              ObjectMapper objectMapper) {
        return new ClaudeClient("anthropic", "Anthropic Claude 3 Opus", model,
                baseUrl, apiKey, temperature, timeout, objectMapper);
    }
}
