package com.agentorchestra.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for TaskRequest parsing and validation.
 */
class TaskRequestTest {

    // ------------------------------------------------------------------
    // Description rules
    // ------------------------------------------------------------------

    @Test
    void fromParameters_validRequest_stripsDescription() {
        TaskRequest request = TaskRequest.fromParameters(Map.of(
                "agent_type", "repository_analyzer",
                "task_description", "  Analyze repo  ",
                "parameters", Map.of("repository_path", "src")));

        assertThat(request.agentType()).isEqualTo(AgentType.REPOSITORY_ANALYZER);
        assertThat(request.taskDescription()).isEqualTo("Analyze repo");
        assertThat(request.parameter("repository_path", ".")).isEqualTo("src");
    }

    @Test
    void constructor_blankDescription_rejected() {
        assertThatThrownBy(() -> new TaskRequest(AgentType.VALIDATOR, "   ", Map.of()))
                .isInstanceOf(RequestValidationException.class)
                .hasMessage("Task description cannot be empty");
    }

    @Test
    void constructor_descriptionAtLimit_accepted() {
        String atLimit = "x".repeat(TaskRequest.MAX_DESCRIPTION_LENGTH);
        assertThat(new TaskRequest(AgentType.VALIDATOR, atLimit, Map.of()).taskDescription())
                .hasSize(1000);
    }

    @Test
    void constructor_descriptionOverLimit_rejected() {
        String tooLong = "x".repeat(TaskRequest.MAX_DESCRIPTION_LENGTH + 1);
        assertThatThrownBy(() -> new TaskRequest(AgentType.VALIDATOR, tooLong, Map.of()))
                .isInstanceOf(RequestValidationException.class)
                .hasMessageContaining("1000");
    }

    // ------------------------------------------------------------------
    // Parameter key denylist
    // ------------------------------------------------------------------

    @Test
    void constructor_keyContainingEval_rejected() {
        assertThatThrownBy(() -> new TaskRequest(AgentType.VALIDATOR, "check",
                Map.of("my_eval_key", 1)))
                .isInstanceOf(RequestValidationException.class)
                .hasMessage("Parameter key 'my_eval_key' contains potentially dangerous content");
    }

    @Test
    void constructor_keyCheckIgnoresCase() {
        assertThatThrownBy(() -> new TaskRequest(AgentType.VALIDATOR, "check",
                Map.of("OpenFiles", 1)))
                .isInstanceOf(RequestValidationException.class);
    }

    @Test
    void constructor_denylistAppliesToKeysOnly() {
        TaskRequest request = new TaskRequest(AgentType.VALIDATOR, "check",
                Map.of("note", "eval(open('file'))"));
        assertThat(request.parameters()).containsKey("note");
    }

    @Test
    void constructor_nullParameters_becomeEmpty() {
        assertThat(new TaskRequest(AgentType.VALIDATOR, "check", null).parameters()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Shape errors
    // ------------------------------------------------------------------

    @Test
    void fromParameters_unknownAgentType_rejected() {
        assertThatThrownBy(() -> TaskRequest.fromParameters(Map.of(
                "agent_type", "summarizer", "task_description", "x")))
                .isInstanceOf(RequestValidationException.class)
                .hasMessageContaining("summarizer");
    }

    @Test
    void fromParameters_missingDescription_rejected() {
        assertThatThrownBy(() -> TaskRequest.fromParameters(Map.of("agent_type", "validator")))
                .isInstanceOf(RequestValidationException.class)
                .hasMessage("task_description is required");
    }

    @Test
    void fromParameters_parametersNotAnObject_rejected() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("agent_type", "validator");
        raw.put("task_description", "x");
        raw.put("parameters", List.of("a"));

        assertThatThrownBy(() -> TaskRequest.fromParameters(raw))
                .isInstanceOf(RequestValidationException.class)
                .hasMessage("parameters must be an object");
    }

    // ------------------------------------------------------------------
    // AgentOutput coercion used when reading parameters
    // ------------------------------------------------------------------

    @Test
    void asObject_nonObjectValue_isWrapped() {
        assertThat(AgentOutput.asObject(List.of("a", "b"))).containsEntry("value", List.of("a", "b"));
        assertThat(AgentOutput.asObject(null)).isEmpty();
        assertThat(AgentOutput.asObject(Map.of("k", 1))).containsEntry("k", 1);
    }
}
