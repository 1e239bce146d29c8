package com.dashforge.orchestrator;

import com.dashforge.orchestrator.generation.PromptTemplates;
import com.dashforge.orchestrator.llm.GenerativeModel;
import com.dashforge.orchestrator.llm.ModelRegistry;
import com.dashforge.orchestrator.model.Diagnostic;
import com.dashforge.orchestrator.model.RepairHint;
import com.dashforge.orchestrator.validation.DiagnosticEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Full context wiring: model backends, schema, hint rule ordering.
 * No model is actually called.
 */
@SpringBootTest
class DashforgeApplicationTest {

    @Autowired ModelRegistry    models;
    @Autowired DiagnosticEngine diagnosticEngine;
    @Autowired PromptTemplates  prompts;

    @Test
    void registersThreeBackends() {
        assertThat(models.all()).extracting(GenerativeModel::id)
                .containsExactly("openai", "gpt-4o", "anthropic");
    }

    @Test
    void hintRulesAreAppliedInOrder() {
        List<RepairHint> hints = diagnosticEngine.extractHints(List.of(
                new Diagnostic("panels/0", "'id' is a required property"),
                new Diagnostic("panels/0/gridPos/x", "'0' is not of type 'integer'"),
                new Diagnostic("panels/0/datasource", "42 is not valid under any of the given schemas")));

        assertThat(hints).extracting(RepairHint::kind).containsExactly(
                RepairHint.Kind.MISSING_PROPERTY,
                RepairHint.Kind.TYPE_MISMATCH,
                RepairHint.Kind.NO_MATCHING_SCHEMA);
    }

    @Test
    void promptsMentionPermittedPanelTypes() {
        assertThat(prompts.generationSystemPrompt()).contains("timeseries");
    }
}
