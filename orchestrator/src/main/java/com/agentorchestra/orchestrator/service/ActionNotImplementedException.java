package com.agentorchestra.orchestrator.service;

/**
 * The action is on the allow-list but has no server-side handler.
 * The HTTP layer answers 501.
 */
public class ActionNotImplementedException extends RuntimeException {

    public ActionNotImplementedException(String actionName) {
        super("Action '" + actionName + "' is not implemented");
    }
}
