package com.agentorchestra.orchestrator.model;

/**
 * Thrown when a task or workflow request does not have the required shape.
 *
 * Never escapes the executors: TaskExecutor and PipelineExecutor turn it
 * into a {@code "Validation error: ..."} result.
 */
public class RequestValidationException extends RuntimeException {

    public RequestValidationException(String message) {
        super(message);
    }
}
