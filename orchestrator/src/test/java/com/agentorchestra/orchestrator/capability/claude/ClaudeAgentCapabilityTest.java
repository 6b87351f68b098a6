package com.agentorchestra.orchestrator.capability.claude;

import com.agentorchestra.orchestrator.capability.CapabilityException;
import com.agentorchestra.orchestrator.capability.input.ArchitectureInput;
import com.agentorchestra.orchestrator.capability.input.RepositoryAnalysisInput;
import com.agentorchestra.orchestrator.claude.ClaudeClient;
import com.agentorchestra.orchestrator.claude.ClaudeClient.Message;
import com.agentorchestra.orchestrator.model.AgentOutput;
import com.agentorchestra.orchestrator.model.AgentType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ClaudeAgentCapability.
 * ClaudeClient is mocked, so no network and no API key are needed.
 */
@ExtendWith(MockitoExtension.class)
class ClaudeAgentCapabilityTest {

    @Mock ClaudeClient claude;

    ClaudeAgentCapability analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new ClaudeAgentCapability(AgentType.REPOSITORY_ANALYZER, claude,
                new AgentPrompts(), new ObjectMapper(), "test-model");
    }

    @Test
    void invoke_replyInResultTag_returnsParsedOutput() {
        when(claude.complete(eq("test-model"), anyList(), anyString())).thenReturn("""
                Looked around.
                <result>{"summary": "A CLI tool", "structure": {"modules": ["core"]}}</result>
                """);

        AgentOutput output = analyzer.invoke(new RepositoryAnalysisInput("src", List.of("testing")));

        assertThat(output.summary()).contains("A CLI tool");
        assertThat(output.section("structure")).containsEntry("modules", List.of("core"));
    }

    @Test
    void invoke_sendsInputAsJsonWithRolePrompt() {
        when(claude.complete(any(), anyList(), anyString())).thenReturn("{\"summary\": \"ok\"}");

        analyzer.invoke(new RepositoryAnalysisInput("src/main", List.of()));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Message>> messages = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<String> system = ArgumentCaptor.forClass(String.class);
        verify(claude).complete(eq("test-model"), messages.capture(), system.capture());

        String userMessage = messages.getValue().get(0).content();
        assertThat(userMessage).contains("\"repository_path\" : \"src/main\"");
        assertThat(userMessage).doesNotContain("agent_type");
        assertThat(system.getValue()).contains("Repository Analyzer").contains("<result>");
    }

    @Test
    void invoke_replyWithoutSummary_throwsCapabilityException() {
        when(claude.complete(any(), anyList(), anyString())).thenReturn("<result>{\"structure\": {}}</result>");

        assertThatThrownBy(() -> analyzer.invoke(new RepositoryAnalysisInput(".", List.of())))
                .isInstanceOf(CapabilityException.class)
                .hasMessageContaining("summary");
    }

    @Test
    void invoke_replyNotJson_throwsCapabilityException() {
        when(claude.complete(any(), anyList(), anyString())).thenReturn("I could not read the repository.");

        assertThatThrownBy(() -> analyzer.invoke(new RepositoryAnalysisInput(".", List.of())))
                .isInstanceOf(CapabilityException.class)
                .hasMessageContaining("did not return a JSON object");
    }

    @Test
    void invoke_inputForAnotherAgent_throwsWithoutCallingClaude() {
        assertThatThrownBy(() -> analyzer.invoke(new ArchitectureInput(Map.of(), Map.of())))
                .isInstanceOf(CapabilityException.class)
                .hasMessageContaining("architecture_designer");
        verifyNoInteractions(claude);
    }

    @Test
    void invoke_claudeApiFailure_propagates() {
        when(claude.complete(any(), anyList(), anyString()))
                .thenThrow(new ClaudeClient.ClaudeApiException(529, "overloaded"));

        assertThatThrownBy(() -> analyzer.invoke(new RepositoryAnalysisInput(".", List.of())))
                .isInstanceOf(ClaudeClient.ClaudeApiException.class)
                .hasMessageContaining("529");
    }

    @Test
    void manifest_namesAgentAndModel() {
        assertThat(analyzer.manifest().agentType()).isEqualTo(AgentType.REPOSITORY_ANALYZER);
        assertThat(analyzer.manifest().description()).contains("test-model");
    }
}
