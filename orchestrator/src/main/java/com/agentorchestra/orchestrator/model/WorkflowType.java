package com.agentorchestra.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Optional;

/**
 * The closed set of workflow shapes a caller can request.
 *
 * Only FULL_ANALYSIS and ARCHITECTURE_ONLY have a stage sequence.
 * IMPLEMENTATION_PLAN and VALIDATION_ONLY are declared by the frontend
 * but have no pipeline behind them; {@link #stages()} returns empty for
 * both and the pipeline rejects them before anything runs.
 */
public enum WorkflowType {
    FULL_ANALYSIS("full_analysis"),
    ARCHITECTURE_ONLY("architecture_only"),
    IMPLEMENTATION_PLAN("implementation_plan"),
    VALIDATION_ONLY("validation_only");

    private final String wireValue;

    WorkflowType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Ordered stage sequence for this shape, or empty when the shape is
     * declared but not implemented.
     */
    public Optional<List<Stage>> stages() {
        return switch (this) {
            case FULL_ANALYSIS -> Optional.of(List.of(
                    Stage.REPOSITORY_ANALYSIS,
                    Stage.REQUIREMENTS_EXTRACTION,
                    Stage.ARCHITECTURE_DESIGN,
                    Stage.IMPLEMENTATION_PLANNING,
                    Stage.VALIDATION));
            case ARCHITECTURE_ONLY -> Optional.of(List.of(
                    Stage.REPOSITORY_ANALYSIS,
                    Stage.REQUIREMENTS_EXTRACTION,
                    Stage.ARCHITECTURE_DESIGN));
            case IMPLEMENTATION_PLAN, VALIDATION_ONLY -> Optional.empty();
        };
    }

    /** Project description handed to the requirements stage when the caller gave none. */
    public String defaultRequirements() {
        return switch (this) {
            case ARCHITECTURE_ONLY -> "Design architecture";
            case FULL_ANALYSIS, IMPLEMENTATION_PLAN, VALIDATION_ONLY -> "Analyze repository";
        };
    }

    /**
     * @throws RequestValidationException if the value names no workflow type
     */
    @JsonCreator
    public static WorkflowType fromWire(String value) {
        for (WorkflowType type : values()) {
            if (type.wireValue.equals(value)) {
                return type;
            }
        }
        throw new RequestValidationException("workflow_type '" + value + "' is not a known workflow");
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
