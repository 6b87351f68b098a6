package com.agentorchestra.orchestrator.capability;

/**
 * Thrown by a capability when the agent could not produce a usable output
 * (backend error, unparseable reply, missing summary).
 *
 * The executors report it as {@code "Execution error: <message>"}.
 */
public class CapabilityException extends RuntimeException {

    public CapabilityException(String message) {
        super(message);
    }

    public CapabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
