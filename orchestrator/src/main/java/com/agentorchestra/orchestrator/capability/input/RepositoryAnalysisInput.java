package com.agentorchestra.orchestrator.capability.input;

import com.agentorchestra.orchestrator.model.AgentType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Input of the repository_analyzer agent.
 *
 * @param repositoryPath path relative to the analyzer's workspace root; "." when not given
 * @param focusAreas     optional hints such as "security" or "testing"
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RepositoryAnalysisInput(String repositoryPath, List<String> focusAreas) implements AgentInput {

    public RepositoryAnalysisInput {
        if (repositoryPath == null || repositoryPath.isBlank()) repositoryPath = ".";
        focusAreas = focusAreas == null ? List.of() : List.copyOf(focusAreas);
    }

    @JsonIgnore
    @Override
    public AgentType agentType() { return AgentType.REPOSITORY_ANALYZER; }
}
