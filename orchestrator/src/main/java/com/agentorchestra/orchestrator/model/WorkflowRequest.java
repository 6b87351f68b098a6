package com.agentorchestra.orchestrator.model;

import java.util.Map;

/**
 * One request to run a workflow pipeline.
 *
 * repository_path: must not contain "..", one leading "/" is stripped,
 *                  empty after stripping is invalid. Null means "." later.
 * requirements:    at most 2000 characters, stored stripped.
 */
public record WorkflowRequest(WorkflowType workflowType,
                              String repositoryPath,
                              String requirements) {

    public static final int MAX_REQUIREMENTS_LENGTH = 2000;

    public WorkflowRequest {
        if (workflowType == null) {
            throw new RequestValidationException("workflow_type is required");
        }
        if (repositoryPath != null) {
            if (repositoryPath.contains("..")) {
                throw new RequestValidationException("Repository path cannot contain '..'");
            }
            if (repositoryPath.startsWith("/")) {
                repositoryPath = repositoryPath.substring(1);
            }
            if (repositoryPath.isEmpty()) {
                throw new RequestValidationException("Repository path cannot be empty");
            }
        }
        if (requirements != null) {
            if (requirements.length() > MAX_REQUIREMENTS_LENGTH) {
                throw new RequestValidationException(
                        "requirements must be at most " + MAX_REQUIREMENTS_LENGTH + " characters");
            }
            requirements = requirements.strip();
        }
    }

    /**
     * Build a request from the raw {@code parameters} object of an
     * {@code executeWorkflow} action.
     *
     * @throws RequestValidationException on any shape violation
     */
    public static WorkflowRequest fromParameters(Map<String, Object> raw) {
        if (raw == null) {
            throw new RequestValidationException("parameters are required");
        }
        Object type = raw.get("workflow_type");
        if (!(type instanceof String typeName)) {
            throw new RequestValidationException("workflow_type is required and must be a string");
        }
        return new WorkflowRequest(
                WorkflowType.fromWire(typeName),
                optionalString(raw, "repository_path"),
                optionalString(raw, "requirements"));
    }

    private static String optionalString(Map<String, Object> raw, String field) {
        Object v = raw.get(field);
        if (v == null) {
            return null;
        }
        if (!(v instanceof String s)) {
            throw new RequestValidationException(field + " must be a string");
        }
        return s;
    }
}
