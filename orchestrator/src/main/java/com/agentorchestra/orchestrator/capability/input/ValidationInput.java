package com.agentorchestra.orchestrator.capability.input;

import com.agentorchestra.orchestrator.model.AgentType;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Map;

/** Input of the validator agent. */
public record ValidationInput(Map<String, Object> implementation,
                              Map<String, Object> requirements) implements AgentInput {

    public ValidationInput {
        implementation = InputMaps.frozen(implementation);
        requirements   = InputMaps.frozen(requirements);
    }

    @JsonIgnore
    @Override
    public AgentType agentType() { return AgentType.VALIDATOR; }
}
