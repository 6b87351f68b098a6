package com.agentorchestra.orchestrator.service;

import com.agentorchestra.orchestrator.model.AgentOutput;
import com.agentorchestra.orchestrator.model.AgentType;
import com.agentorchestra.orchestrator.model.RequestValidationException;
import com.agentorchestra.orchestrator.model.TaskRequest;
import com.agentorchestra.orchestrator.model.TaskResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for MessageRouter keyword routing.
 */
@ExtendWith(MockitoExtension.class)
class MessageRouterTest {

    @Mock TaskExecutor taskExecutor;

    MessageRouter router;

    @BeforeEach
    void setUp() {
        router = new MessageRouter(taskExecutor);
    }

    @Test
    void classify_followsKeywordPriority() {
        assertThat(MessageRouter.classify("Please ANALYZE this repository"))
                .isEqualTo(AgentType.REPOSITORY_ANALYZER);
        assertThat(MessageRouter.classify("Analyze the design of this repository"))
                .isEqualTo(AgentType.REPOSITORY_ANALYZER);
        assertThat(MessageRouter.classify("Propose an architecture"))
                .isEqualTo(AgentType.ARCHITECTURE_DESIGNER);
        assertThat(MessageRouter.classify("How do we implement login?"))
                .isEqualTo(AgentType.IMPLEMENTATION_PLANNER);
        assertThat(MessageRouter.classify("We need a todo app"))
                .isEqualTo(AgentType.REQUIREMENTS_EXTRACTOR);
    }

    @Test
    void route_architectureMessage_passesMessageAndConstraints() {
        when(taskExecutor.execute(any(TaskRequest.class), eq("acme")))
                .thenReturn(TaskResult.failed("architecture_designer", "x", "Budget limit exceeded", 0));

        router.route("Design a queue-based system", Map.of("constraints", Map.of("cloud", "aws")), "acme");

        ArgumentCaptor<TaskRequest> captor = ArgumentCaptor.forClass(TaskRequest.class);
        verify(taskExecutor).execute(captor.capture(), eq("acme"));
        TaskRequest request = captor.getValue();
        assertThat(request.agentType()).isEqualTo(AgentType.ARCHITECTURE_DESIGNER);
        assertThat(request.parameters())
                .containsEntry("requirements", Map.of("description", "Design a queue-based system"))
                .containsEntry("constraints", Map.of("cloud", "aws"));
    }

    @Test
    void route_longMessage_isTruncatedToDescriptionLimit() {
        when(taskExecutor.execute(any(TaskRequest.class), eq("acme")))
                .thenReturn(TaskResult.failed("requirements_extractor", "x", "Budget limit exceeded", 0));

        router.route("w".repeat(1500), null, "acme");

        ArgumentCaptor<TaskRequest> captor = ArgumentCaptor.forClass(TaskRequest.class);
        verify(taskExecutor).execute(captor.capture(), eq("acme"));
        assertThat(captor.getValue().taskDescription()).hasSize(TaskRequest.MAX_DESCRIPTION_LENGTH);
    }

    @Test
    void route_leadingWhitespacePastLimit_isStrippedBeforeTruncating() {
        when(taskExecutor.execute(any(TaskRequest.class), eq("acme")))
                .thenReturn(TaskResult.failed("implementation_planner", "x", "Budget limit exceeded", 0));

        router.route(" ".repeat(1200) + "Plan the rollout\n", Map.of(), "acme");

        ArgumentCaptor<TaskRequest> captor = ArgumentCaptor.forClass(TaskRequest.class);
        verify(taskExecutor).execute(captor.capture(), eq("acme"));
        assertThat(captor.getValue().taskDescription()).isEqualTo("Plan the rollout");
        assertThat(captor.getValue().agentType()).isEqualTo(AgentType.IMPLEMENTATION_PLANNER);
    }

    @Test
    void route_blankMessage_isRejectedBeforeExecution() {
        assertThatThrownBy(() -> router.route(" \t ", Map.of(), "acme"))
                .isInstanceOf(RequestValidationException.class)
                .hasMessage("Task description cannot be empty");
        verifyNoInteractions(taskExecutor);
    }

    @Test
    void replyText_includesSummaryOrPlaceholder() {
        assertThat(MessageRouter.replyText(AgentType.REPOSITORY_ANALYZER,
                AgentOutput.of(Map.of("summary", "Three modules"))))
                .isEqualTo("Repository analysis complete. Key findings: Three modules");
        assertThat(MessageRouter.replyText(AgentType.IMPLEMENTATION_PLANNER, AgentOutput.of(Map.of())))
                .isEqualTo("Implementation plan created. Key steps: No summary available");
    }
}
