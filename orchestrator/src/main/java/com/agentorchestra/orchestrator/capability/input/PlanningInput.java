package com.agentorchestra.orchestrator.capability.input;

import com.agentorchestra.orchestrator.model.AgentType;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Map;

/** Input of the implementation_planner agent. */
public record PlanningInput(Map<String, Object> architecture,
                            Map<String, Object> requirements) implements AgentInput {

    public PlanningInput {
        architecture = InputMaps.frozen(architecture);
        requirements = InputMaps.frozen(requirements);
    }

    @JsonIgnore
    @Override
    public AgentType agentType() { return AgentType.IMPLEMENTATION_PLANNER; }
}
