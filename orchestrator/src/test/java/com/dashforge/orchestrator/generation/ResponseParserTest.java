package com.dashforge.orchestrator.generation;

import com.dashforge.orchestrator.model.Candidate;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ResponseParser.
 *
 * Pure static utility: no Spring context, no mocks.
 */
class ResponseParserTest {

    ObjectMapper mapper = new ObjectMapper();

    // ------------------------------------------------------------------
    // stripCodeFence
    // ------------------------------------------------------------------

    @Test
    void stripCodeFence_withJsonFence_returnsBody() {
        String response = """
                Here is your dashboard:
                ```json
                {"title": "CPU"}
                ```
                Let me know if you need changes.
                """;
        assertThat(ResponseParser.stripCodeFence(response)).isEqualTo("{\"title\": \"CPU\"}");
    }

    @Test
    void stripCodeFence_withUnlabelledFence_returnsBody() {
        String response = """
                ```
                {"title": "CPU"}
                ```
                """;
        assertThat(ResponseParser.stripCodeFence(response)).isEqualTo("{\"title\": \"CPU\"}");
    }

    @Test
    void stripCodeFence_withMultipleFences_returnsFirst() {
        String response = """
                ```json
                {"first": true}
                ```
                ```json
                {"second": true}
                ```
                """;
        assertThat(ResponseParser.stripCodeFence(response))
                .contains("first")
                .doesNotContain("second");
    }

    @Test
    void stripCodeFence_withoutFence_returnsTrimmedText() {
        assertThat(ResponseParser.stripCodeFence("  {\"a\": 1}\n")).isEqualTo("{\"a\": 1}");
    }

    @Test
    void stripCodeFence_unterminatedFence_dropsOpeningLine() {
        String response = "```json\n{\"a\": 1}";
        assertThat(ResponseParser.stripCodeFence(response)).isEqualTo("{\"a\": 1}");
    }

    @Test
    void stripCodeFence_null_returnsEmpty() {
        assertThat(ResponseParser.stripCodeFence(null)).isEmpty();
    }

    // ------------------------------------------------------------------
    // parseCandidate
    // ------------------------------------------------------------------

    @Test
    void parseCandidate_fencedJson_returnsDocument() throws Exception {
        Candidate candidate = ResponseParser.parseCandidate("""
                ```json
                {"title": "CPU", "panels": []}
                ```
                """, mapper);

        assertThat(candidate.document().path("title").asText()).isEqualTo("CPU");
        assertThat(candidate.document().path("panels").isArray()).isTrue();
    }

    @Test
    void parseCandidate_nonObjectJson_isAccepted() throws Exception {
        // shape is the validator's business, not the parser's
        Candidate candidate = ResponseParser.parseCandidate("[1, 2, 3]", mapper);
        assertThat(candidate.document().isArray()).isTrue();
    }

    @Test
    void parseCandidate_prose_throws() {
        assertThatThrownBy(() -> ResponseParser.parseCandidate("I cannot build that dashboard.", mapper))
                .isInstanceOf(ResponseParseException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    void parseCandidate_emptyReply_throws() {
        assertThatThrownBy(() -> ResponseParser.parseCandidate("```json\n```", mapper))
                .isInstanceOf(ResponseParseException.class)
                .hasMessageContaining("empty");
    }
}
