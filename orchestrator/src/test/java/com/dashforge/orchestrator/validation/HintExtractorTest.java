package com.dashforge.orchestrator.validation;

import com.dashforge.orchestrator.model.Diagnostic;
import com.dashforge.orchestrator.model.RepairHint;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HintExtractorTest {

    HintExtractor extractor = DiagnosticEngineTest.hintExtractor();

    @Test
    void missingProperty_namesFieldAndPath() {
        List<RepairHint> hints = extractor.extract(List.of(
                new Diagnostic("panels/0", "'gridPos' is a required property")));

        assertThat(hints).singleElement().satisfies(hint -> {
            assertThat(hint.kind()).isEqualTo(RepairHint.Kind.MISSING_PROPERTY);
            assertThat(hint.instruction())
                    .isEqualTo("Missing required property 'gridPos' at path 'panels/0'");
        });
    }

    @Test
    void typeMismatch_unquotesExpectedType() {
        List<RepairHint> hints = extractor.extract(List.of(
                new Diagnostic("panels/0/gridPos/x", "'0' is not of type 'integer'")));

        assertThat(hints).extracting(RepairHint::instruction)
                .containsExactly("Type error at 'panels/0/gridPos/x': expected integer");
    }

    @Test
    void typeMismatch_quotedValueContainingMarker_usesLastOccurrence() {
        List<RepairHint> hints = extractor.extract(List.of(
                new Diagnostic("title", "'x is not of type y' is not of type 'object'")));

        assertThat(hints).extracting(RepairHint::instruction)
                .containsExactly("Type error at 'title': expected object");
    }

    @Test
    void noMatchingSchema_isRecognised() {
        List<RepairHint> hints = extractor.extract(List.of(
                new Diagnostic("panels/0/datasource", "42 is not valid under any of the given schemas")));

        assertThat(hints).extracting(RepairHint::instruction)
                .containsExactly("Invalid value at 'panels/0/datasource': doesn't match any valid schema");
    }

    @Test
    void unknownMessage_passesThroughVerbatim() {
        List<RepairHint> hints = extractor.extract(List.of(
                new Diagnostic("panels/0/type", "'fancy' is not one of ['graph']")));

        assertThat(hints).singleElement().satisfies(hint -> {
            assertThat(hint.kind()).isEqualTo(RepairHint.Kind.OTHER);
            assertThat(hint.instruction())
                    .isEqualTo("Validation error at 'panels/0/type': 'fancy' is not one of ['graph']");
        });
    }

    @Test
    void duplicates_areCollapsedInFirstSeenOrder() {
        List<RepairHint> hints = extractor.extract(List.of(
                new Diagnostic("root", "'title' is a required property"),
                new Diagnostic("panels/0", "'id' is a required property"),
                new Diagnostic("root", "'title' is a required property")));

        assertThat(hints).extracting(RepairHint::instruction).containsExactly(
                "Missing required property 'title' at path 'root'",
                "Missing required property 'id' at path 'panels/0'");
    }

    @Test
    void emptyInput_yieldsNoHints() {
        assertThat(extractor.extract(List.of())).isEmpty();
    }
}
