package com.agentorchestra.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One step of a workflow pipeline. Every stage runs exactly one agent.
 *
 * The stage name is what appears in {@code steps_completed} and as the
 * key of the stage's output in {@code results}.
 */
public enum Stage {
    REPOSITORY_ANALYSIS("repository_analysis", AgentType.REPOSITORY_ANALYZER),
    REQUIREMENTS_EXTRACTION("requirements_extraction", AgentType.REQUIREMENTS_EXTRACTOR),
    ARCHITECTURE_DESIGN("architecture_design", AgentType.ARCHITECTURE_DESIGNER),
    IMPLEMENTATION_PLANNING("implementation_planning", AgentType.IMPLEMENTATION_PLANNER),
    VALIDATION("validation", AgentType.VALIDATOR);

    private final String stageName;
    private final AgentType agentType;

    Stage(String stageName, AgentType agentType) {
        this.stageName = stageName;
        this.agentType = agentType;
    }

    @JsonValue
    public String stageName() { return stageName; }
    public AgentType agentType() { return agentType; }

    @Override
    public String toString() {
        return stageName;
    }
}
