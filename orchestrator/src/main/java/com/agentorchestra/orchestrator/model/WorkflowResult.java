package com.agentorchestra.orchestrator.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one workflow run.
 *
 * results and stepsCompleted only ever describe stages that finished:
 * on failure they hold the prefix completed before the failing stage, so
 * a caller can inspect partial progress. results keeps insertion order.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WorkflowResult(
        boolean                  success,
        String                   workflowType,
        Map<String, AgentOutput> results,
        String                   error,
        List<String>             stepsCompleted,
        long                     executionTimeMs,
        Instant                  timestamp
) implements ActionOutcome {

    public WorkflowResult {
        results        = Collections.unmodifiableMap(
                results == null ? new LinkedHashMap<>() : new LinkedHashMap<>(results));
        stepsCompleted = stepsCompleted == null ? List.of() : List.copyOf(stepsCompleted);
        if (executionTimeMs < 0) executionTimeMs = 0;
    }

    public static WorkflowResult succeeded(WorkflowType type, Map<String, AgentOutput> results,
                                           List<String> stepsCompleted, long executionTimeMs) {
        return new WorkflowResult(true, type.wireValue(), results, null,
                stepsCompleted, executionTimeMs, Instant.now());
    }

    public static WorkflowResult failed(String workflowType, Map<String, AgentOutput> partialResults,
                                        List<String> stepsCompleted, String error, long executionTimeMs) {
        return new WorkflowResult(false, workflowType, partialResults, error,
                stepsCompleted, executionTimeMs, Instant.now());
    }

    @Override
    public WorkflowResult withExecutionTimeMs(long executionTimeMs) {
        return new WorkflowResult(success, workflowType, results, error,
                stepsCompleted, executionTimeMs, timestamp);
    }
}
