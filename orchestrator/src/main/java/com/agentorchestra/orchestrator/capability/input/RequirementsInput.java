package com.agentorchestra.orchestrator.capability.input;

import com.agentorchestra.orchestrator.model.AgentType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/** Input of the requirements_extractor agent. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RequirementsInput(String projectDescription, Map<String, Object> context) implements AgentInput {

    public RequirementsInput {
        if (projectDescription == null) projectDescription = "";
        context = InputMaps.frozen(context);
    }

    @JsonIgnore
    @Override
    public AgentType agentType() { return AgentType.REQUIREMENTS_EXTRACTOR; }
}
