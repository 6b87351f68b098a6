package com.agentorchestra.orchestrator.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Outcome of one agent task.
 *
 * Exactly one of {@code result} / {@code error} is set: result when
 * success is true, error when it is false. agentType and taskDescription
 * are echoed as raw strings because a request that failed validation may
 * not carry a valid AgentType.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TaskResult(
        boolean     success,
        String      agentType,
        String      taskDescription,
        AgentOutput result,
        String      error,
        long        executionTimeMs,
        Instant     timestamp
) implements ActionOutcome {

    public TaskResult {
        if (executionTimeMs < 0) executionTimeMs = 0;
    }

    public static TaskResult succeeded(AgentType agentType, String taskDescription,
                                       AgentOutput result, long executionTimeMs) {
        return new TaskResult(true, agentType.wireValue(), taskDescription,
                result, null, executionTimeMs, Instant.now());
    }

    public static TaskResult failed(String agentType, String taskDescription,
                                    String error, long executionTimeMs) {
        return new TaskResult(false, agentType, taskDescription,
                null, error, executionTimeMs, Instant.now());
    }

    @Override
    public TaskResult withExecutionTimeMs(long executionTimeMs) {
        return new TaskResult(success, agentType, taskDescription,
                result, error, executionTimeMs, timestamp);
    }
}
