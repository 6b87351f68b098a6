package com.agentorchestra.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The five capability agents a task can be dispatched to.
 *
 * Each type is backed by exactly one capability in the
 * {@link com.agentorchestra.orchestrator.capability.CapabilityRegistry}.
 * The wire value is the snake_case name used by the frontend.
 */
public enum AgentType {
    REPOSITORY_ANALYZER("repository_analyzer"),         // Maps a repository: structure, stack, summary
    REQUIREMENTS_EXTRACTOR("requirements_extractor"),   // Turns a project description into requirements
    ARCHITECTURE_DESIGNER("architecture_designer"),     // Designs an architecture under constraints
    IMPLEMENTATION_PLANNER("implementation_planner"),   // Breaks an architecture into a delivery plan
    VALIDATOR("validator");                             // Checks a plan against the requirements

    private final String wireValue;

    AgentType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Parse a wire value such as {@code "repository_analyzer"}.
     *
     * @throws RequestValidationException if the value names no agent type
     */
    @JsonCreator
    public static AgentType fromWire(String value) {
        for (AgentType type : values()) {
            if (type.wireValue.equals(value)) {
                return type;
            }
        }
        throw new RequestValidationException(
                "agent_type '%s' is not one of [%s]".formatted(value, allowedValues()));
    }

    private static String allowedValues() {
        return Arrays.stream(values()).map(AgentType::wireValue).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
