package com.agentorchestra.orchestrator.capability.input;

import com.agentorchestra.orchestrator.model.AgentType;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Map;

/** Input of the architecture_designer agent. */
public record ArchitectureInput(Map<String, Object> requirements,
                                Map<String, Object> constraints) implements AgentInput {

    public ArchitectureInput {
        requirements = InputMaps.frozen(requirements);
        constraints  = InputMaps.frozen(constraints);
    }

    @JsonIgnore
    @Override
    public AgentType agentType() { return AgentType.ARCHITECTURE_DESIGNER; }
}
