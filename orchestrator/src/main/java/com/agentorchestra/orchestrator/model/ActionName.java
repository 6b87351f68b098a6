package com.agentorchestra.orchestrator.model;

import java.util.Optional;

/**
 * The closed allow-list of action names a client may send.
 *
 * REQUEST_HUMAN_APPROVAL and REQUEST_HUMAN_INPUT are part of the frontend
 * contract but are handled in the browser; the dispatcher has no handler
 * for them.
 */
public enum ActionName {
    EXECUTE_AGENT_TASK("executeAgentTask"),
    EXECUTE_WORKFLOW("executeWorkflow"),
    REQUEST_HUMAN_APPROVAL("requestHumanApproval"),
    REQUEST_HUMAN_INPUT("requestHumanInput");

    private final String wireValue;

    ActionName(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /** Empty when the name is not on the allow-list. Matching is exact. */
    public static Optional<ActionName> fromWire(String value) {
        for (ActionName name : values()) {
            if (name.wireValue.equals(value)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }
}
