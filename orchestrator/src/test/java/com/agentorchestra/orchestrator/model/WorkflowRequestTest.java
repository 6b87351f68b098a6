package com.agentorchestra.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for WorkflowRequest validation and the WorkflowType catalogue.
 */
class WorkflowRequestTest {

    // ------------------------------------------------------------------
    // repository_path
    // ------------------------------------------------------------------

    @Test
    void repositoryPath_withParentSegment_rejected() {
        assertThatThrownBy(() -> new WorkflowRequest(WorkflowType.FULL_ANALYSIS, "../etc", null))
                .isInstanceOf(RequestValidationException.class)
                .hasMessage("Repository path cannot contain '..'");
    }

    @Test
    void repositoryPath_leadingSlash_isStripped() {
        WorkflowRequest request = new WorkflowRequest(WorkflowType.FULL_ANALYSIS, "/src", null);
        assertThat(request.repositoryPath()).isEqualTo("src");
    }

    @Test
    void repositoryPath_onlySlash_rejected() {
        assertThatThrownBy(() -> new WorkflowRequest(WorkflowType.FULL_ANALYSIS, "/", null))
                .isInstanceOf(RequestValidationException.class)
                .hasMessage("Repository path cannot be empty");
    }

    @Test
    void repositoryPath_absent_staysNull() {
        assertThat(new WorkflowRequest(WorkflowType.ARCHITECTURE_ONLY, null, null).repositoryPath()).isNull();
    }

    // ------------------------------------------------------------------
    // requirements
    // ------------------------------------------------------------------

    @Test
    void requirements_overLimit_rejected() {
        String tooLong = "r".repeat(WorkflowRequest.MAX_REQUIREMENTS_LENGTH + 1);
        assertThatThrownBy(() -> new WorkflowRequest(WorkflowType.FULL_ANALYSIS, "src", tooLong))
                .isInstanceOf(RequestValidationException.class)
                .hasMessageContaining("2000");
    }

    @Test
    void requirements_areStripped() {
        assertThat(new WorkflowRequest(WorkflowType.FULL_ANALYSIS, "src", "  Add caching \n").requirements())
                .isEqualTo("Add caching");
    }

    // ------------------------------------------------------------------
    // fromParameters / WorkflowType
    // ------------------------------------------------------------------

    @Test
    void fromParameters_unknownWorkflowType_rejected() {
        assertThatThrownBy(() -> WorkflowRequest.fromParameters(Map.of("workflow_type", "deploy")))
                .isInstanceOf(RequestValidationException.class)
                .hasMessageContaining("deploy");
    }

    @Test
    void fromParameters_nonStringPath_rejected() {
        assertThatThrownBy(() -> WorkflowRequest.fromParameters(Map.of(
                "workflow_type", "full_analysis", "repository_path", 42)))
                .isInstanceOf(RequestValidationException.class)
                .hasMessage("repository_path must be a string");
    }

    @Test
    void workflowTypes_onlyTwoHaveStageSequences() {
        assertThat(WorkflowType.FULL_ANALYSIS.stages()).hasValueSatisfying(stages ->
                assertThat(stages).containsExactly(
                        Stage.REPOSITORY_ANALYSIS, Stage.REQUIREMENTS_EXTRACTION,
                        Stage.ARCHITECTURE_DESIGN, Stage.IMPLEMENTATION_PLANNING, Stage.VALIDATION));
        assertThat(WorkflowType.ARCHITECTURE_ONLY.stages()).hasValueSatisfying(stages ->
                assertThat(stages).containsExactly(
                        Stage.REPOSITORY_ANALYSIS, Stage.REQUIREMENTS_EXTRACTION, Stage.ARCHITECTURE_DESIGN));
        assertThat(WorkflowType.IMPLEMENTATION_PLAN.stages()).isEmpty();
        assertThat(WorkflowType.VALIDATION_ONLY.stages()).isEmpty();
    }
}
