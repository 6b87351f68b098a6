package com.agentorchestra.orchestrator.api.dto;

import java.util.Map;

/**
 * Request body for POST /copilotkit/actions.
 *
 * name:       one of executeAgentTask, executeWorkflow,
 *             requestHumanApproval, requestHumanInput
 * parameters: action-specific object, passed through unparsed
 */
public record ActionRequest(String name, Map<String, Object> parameters) {

    public ActionRequest {
        if (parameters == null) parameters = Map.of();
    }
}
