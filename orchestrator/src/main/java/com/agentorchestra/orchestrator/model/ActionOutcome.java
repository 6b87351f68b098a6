package com.agentorchestra.orchestrator.model;

/**
 * Common shape of everything an action can return to the caller.
 * The router overwrites the execution time with its own end-to-end figure.
 */
public interface ActionOutcome {

    boolean success();

    long executionTimeMs();

    ActionOutcome withExecutionTimeMs(long executionTimeMs);
}
