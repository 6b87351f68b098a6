package com.agentorchestra.orchestrator.config;

import com.agentorchestra.orchestrator.capability.Capability;
import com.agentorchestra.orchestrator.capability.claude.AgentPrompts;
import com.agentorchestra.orchestrator.capability.claude.ClaudeAgentCapability;
import com.agentorchestra.orchestrator.capability.input.AgentInput;
import com.agentorchestra.orchestrator.claude.ClaudeClient;
import com.agentorchestra.orchestrator.model.AgentType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default capability wiring: every agent type is backed by Claude.
 *
 * Each bean is picked up by the CapabilityRegistry. To swap an agent for
 * another implementation, replace its bean here.
 */
@Configuration
public class CapabilityConfig {

    private final ClaudeClient claude;
    private final AgentPrompts prompts;
    private final ObjectMapper objectMapper;
    private final String       model;

    public CapabilityConfig(ClaudeClient claude,
                            AgentPrompts prompts,
                            ObjectMapper objectMapper,
                            @Value("${orchestra.claude.model:claude-sonnet-4-6}") String model) {
        this.claude       = claude;
        this.prompts      = prompts;
        this.objectMapper = objectMapper;
        this.model        = model;
    }

    @Bean
    Capability<AgentInput> repositoryAnalyzerCapability() {
        return claudeBacked(AgentType.REPOSITORY_ANALYZER);
    }

    @Bean
    Capability<AgentInput> requirementsExtractorCapability() {
        return claudeBacked(AgentType.REQUIREMENTS_EXTRACTOR);
    }

    @Bean
    Capability<AgentInput> architectureDesignerCapability() {
        return claudeBacked(AgentType.ARCHITECTURE_DESIGNER);
    }

    @Bean
    Capability<AgentInput> implementationPlannerCapability() {
        return claudeBacked(AgentType.IMPLEMENTATION_PLANNER);
    }

    @Bean
    Capability<AgentInput> validatorCapability() {
        return claudeBacked(AgentType.VALIDATOR);
    }

    private Capability<AgentInput> claudeBacked(AgentType type) {
        return new ClaudeAgentCapability(type, claude, prompts, objectMapper, model);
    }
}
