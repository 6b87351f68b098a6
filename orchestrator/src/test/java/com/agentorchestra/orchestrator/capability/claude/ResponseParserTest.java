package com.agentorchestra.orchestrator.capability.claude;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ResponseParser.
 *
 * ResponseParser is a pure utility class (only static methods, no I/O),
 * so these tests need zero Spring context and zero mocks.
 */
class ResponseParserTest {

    // ------------------------------------------------------------------
    // extractJsonBlock
    // ------------------------------------------------------------------

    @Test
    void extractJsonBlock_withJsonFence_returnsBody() {
        String response = """
                Here is the design.
                ```json
                {"summary": "Layered service"}
                ```
                """;
        Optional<String> block = ResponseParser.extractJsonBlock(response);
        assertThat(block).contains("{\"summary\": \"Layered service\"}");
    }

    @Test
    void extractJsonBlock_withUnlabelledFence_returnsBody() {
        String response = """
                ```
                {"summary": "x"}
                ```
                """;
        assertThat(ResponseParser.extractJsonBlock(response)).isPresent();
    }

    @Test
    void extractJsonBlock_withNoFence_returnsEmpty() {
        assertThat(ResponseParser.extractJsonBlock("Still thinking.")).isEmpty();
    }

    @Test
    void extractJsonBlock_withMultipleFences_returnsFirst() {
        String response = """
                ```json
                {"summary": "first"}
                ```
                ```json
                {"summary": "second"}
                ```
                """;
        Optional<String> block = ResponseParser.extractJsonBlock(response);
        assertThat(block).isPresent();
        assertThat(block.get()).contains("first").doesNotContain("second");
    }

    // ------------------------------------------------------------------
    // extractResult
    // ------------------------------------------------------------------

    @Test
    void extractResult_withMultilineResult_returnsFullContent() {
        String response = """
                <result>
                {
                  "summary": "Spring Boot service",
                  "tech_stack": ["java"]
                }
                </result>
                """;
        Optional<String> result = ResponseParser.extractResult(response);
        assertThat(result).isPresent();
        assertThat(result.get()).startsWith("{").contains("\"tech_stack\"");
    }

    @Test
    void extractResult_withNoResultTag_returnsEmpty() {
        assertThat(ResponseParser.extractResult("No tags here.")).isEmpty();
    }

    // ------------------------------------------------------------------
    // extractPayload
    // ------------------------------------------------------------------

    @Test
    void extractPayload_prefersResultTagOverFence() {
        String response = """
                ```json
                {"summary": "draft"}
                ```
                <result>{"summary": "final"}</result>
                """;
        assertThat(ResponseParser.extractPayload(response)).isEqualTo("{\"summary\": \"final\"}");
    }

    @Test
    void extractPayload_bareJson_returnsStrippedReply() {
        assertThat(ResponseParser.extractPayload("  {\"summary\": \"ok\"}\n"))
                .isEqualTo("{\"summary\": \"ok\"}");
    }

    @Test
    void extractPayload_null_returnsEmptyString() {
        assertThat(ResponseParser.extractPayload(null)).isEmpty();
    }
}
