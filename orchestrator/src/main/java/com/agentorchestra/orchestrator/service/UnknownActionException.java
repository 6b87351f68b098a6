package com.agentorchestra.orchestrator.service;

/**
 * The action name is not on the allow-list. A malformed request, not an
 * execution failure: the HTTP layer answers 400.
 */
public class UnknownActionException extends RuntimeException {

    public UnknownActionException(String actionName) {
        super("Action '" + actionName + "' is not allowed");
    }
}
