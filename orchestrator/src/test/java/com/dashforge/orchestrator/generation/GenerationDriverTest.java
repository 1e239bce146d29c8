package com.dashforge.orchestrator.generation;

import com.dashforge.orchestrator.context.ContextFormatter;
import com.dashforge.orchestrator.context.ContextRetriever;
import com.dashforge.orchestrator.llm.LlmCallException;
import com.dashforge.orchestrator.llm.ModelRegistry;
import com.dashforge.orchestrator.model.Candidate;
import com.dashforge.orchestrator.model.GenerationRequest;
import com.dashforge.orchestrator.validation.SchemaCatalogue;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.ClassPathResource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for GenerationDriver. The model registry and the retriever are
 * mocked; prompts and context formatting are real.
 */
@ExtendWith(MockitoExtension.class)
class GenerationDriverTest {

    @Mock ModelRegistry    models;
    @Mock ContextRetriever retriever;

    ObjectMapper     mapper = new ObjectMapper();
    PromptTemplates  prompts;
    GenerationDriver driver;

    @BeforeEach
    void setUp() {
        prompts = new PromptTemplates(
                new SchemaCatalogue(mapper, new ClassPathResource("schema/dashboard-schema.json")));
        driver = new GenerationDriver(models, prompts, retriever, new ContextFormatter(), mapper);
    }

    @Test
    void generate_plainPrompt_callsBackendOnceAndParsesReply() {
        when(models.complete(eq("gpt-4o"), anyString(), eq("CPU monitoring dashboard")))
                .thenReturn("```json\n{\"title\": \"CPU\", \"panels\": []}\n```");

        Candidate candidate = driver.generate(GenerationRequest.of("CPU monitoring dashboard"));

        assertThat(candidate.document().path("title").asText()).isEqualTo("CPU");
        verify(models, times(1)).complete(anyString(), anyString(), anyString());
        verifyNoInteractions(retriever);
    }

    @Test
    void generate_systemPromptListsPanelTypes() {
        when(models.complete(anyString(), anyString(), anyString())).thenReturn("{}");

        driver.generate(GenerationRequest.of("anything"));

        ArgumentCaptor<String> system = ArgumentCaptor.forClass(String.class);
        verify(models).complete(anyString(), system.capture(), anyString());
        assertThat(system.getValue()).contains("timeseries", "piechart");
    }

    @Test
    void generate_withContext_mergesRetrievedSections() {
        when(retriever.retrieve("mysql query latency"))
                .thenReturn(Map.of("sql_examples", Map.of("query_rate", "SELECT 1")));
        when(models.complete(anyString(), anyString(), anyString())).thenReturn("{}");

        driver.generate(new GenerationRequest("mysql query latency", "anthropic", 3, true));

        ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
        verify(models).complete(eq("anthropic"), anyString(), user.capture());
        assertThat(user.getValue())
                .contains("mysql query latency")
                .contains("## Sql Examples")
                .contains("- Query Rate: SELECT 1");
    }

    @Test
    void generate_retrievalFails_fallsBackToPlainPrompt() {
        when(retriever.retrieve(any())).thenThrow(new IllegalStateException("corpus unavailable"));
        when(models.complete(anyString(), anyString(), eq("logs dashboard"))).thenReturn("{}");

        Candidate candidate = driver.generate(new GenerationRequest("logs dashboard", "gpt-4o", 3, true));

        assertThat(candidate.document().isObject()).isTrue();
    }

    @Test
    void generate_modelError_isModelCallFailure() {
        when(models.complete(anyString(), anyString(), anyString()))
                .thenThrow(new LlmCallException(503, "overloaded"));

        assertThatThrownBy(() -> driver.generate(GenerationRequest.of("CPU")))
                .isInstanceOf(DriverException.class)
                .hasMessageStartingWith("generation failed (model_call)")
                .isInstanceOfSatisfying(DriverException.class, e -> {
                    assertThat(e.getStage()).isEqualTo(DriverException.Stage.GENERATION);
                    assertThat(e.getKind()).isEqualTo(DriverException.Kind.MODEL_CALL);
                });
    }

    @Test
    void generate_unparseableReply_isParseFailure() {
        when(models.complete(anyString(), anyString(), anyString()))
                .thenReturn("Sorry, I can't help with that.");

        assertThatThrownBy(() -> driver.generate(GenerationRequest.of("CPU")))
                .isInstanceOf(DriverException.class)
                .hasMessageStartingWith("generation failed (parse)")
                .isInstanceOfSatisfying(DriverException.class,
                        e -> assertThat(e.getKind()).isEqualTo(DriverException.Kind.PARSE));
    }
}
