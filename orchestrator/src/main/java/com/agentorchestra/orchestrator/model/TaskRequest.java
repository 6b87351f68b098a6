package com.agentorchestra.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One request to run a single agent.
 *
 * Validation happens in the compact constructor, so a TaskRequest that
 * exists is always well formed:
 *   - task_description: non-blank, at most 1000 characters, stored stripped
 *   - parameters: keys must not contain any {@link #DENIED_KEY_FRAGMENTS}
 *     (a guard against dangerous-looking keys, not a sandbox)
 */
public record TaskRequest(AgentType agentType,
                          String taskDescription,
                          Map<String, Object> parameters) {

    public static final int MAX_DESCRIPTION_LENGTH = 1000;

    static final List<String> DENIED_KEY_FRAGMENTS =
            List.of("__import__", "eval", "exec", "open", "file");

    public TaskRequest {
        if (agentType == null) {
            throw new RequestValidationException("agent_type is required");
        }
        if (taskDescription == null) {
            throw new RequestValidationException("task_description is required");
        }
        if (taskDescription.length() > MAX_DESCRIPTION_LENGTH) {
            throw new RequestValidationException(
                    "task_description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        if (taskDescription.isBlank()) {
            throw new RequestValidationException("Task description cannot be empty");
        }
        taskDescription = taskDescription.strip();

        Map<String, Object> copy = new LinkedHashMap<>();
        if (parameters != null) {
            for (Map.Entry<String, Object> e : parameters.entrySet()) {
                checkKey(e.getKey());
                copy.put(e.getKey(), e.getValue());
            }
        }
        parameters = Collections.unmodifiableMap(copy);
    }

    /**
     * Build a request from the raw {@code parameters} object of an
     * {@code executeAgentTask} action.
     *
     * @throws RequestValidationException on any shape violation
     */
    public static TaskRequest fromParameters(Map<String, Object> raw) {
        if (raw == null) {
            throw new RequestValidationException("parameters are required");
        }
        AgentType type = AgentType.fromWire(requireString(raw, "agent_type"));
        String description = requireString(raw, "task_description");

        Object params = raw.get("parameters");
        if (params != null && !(params instanceof Map<?, ?>)) {
            throw new RequestValidationException("parameters must be an object");
        }
        return new TaskRequest(type, description, AgentOutput.asObject(params));
    }

    /** Parameter value, or {@code fallback} when absent. */
    public Object parameter(String name, Object fallback) {
        Object v = parameters.get(name);
        return v != null ? v : fallback;
    }

    private static void checkKey(String key) {
        if (key == null) {
            throw new RequestValidationException("Parameter keys must not be null");
        }
        String lower = key.toLowerCase(Locale.ROOT);
        for (String fragment : DENIED_KEY_FRAGMENTS) {
            if (lower.contains(fragment)) {
                throw new RequestValidationException(
                        "Parameter key '" + key + "' contains potentially dangerous content");
            }
        }
    }

    private static String requireString(Map<String, Object> raw, String field) {
        Object v = raw.get(field);
        if (v == null) {
            throw new RequestValidationException(field + " is required");
        }
        if (!(v instanceof String s)) {
            throw new RequestValidationException(field + " must be a string");
        }
        return s;
    }
}
