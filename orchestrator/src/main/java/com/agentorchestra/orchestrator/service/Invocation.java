package com.agentorchestra.orchestrator.service;

import com.agentorchestra.orchestrator.model.AgentOutput;
import com.agentorchestra.orchestrator.model.AgentType;

/**
 * Classified outcome of one capability invocation.
 *
 *   OK          output is set
 *   UNAVAILABLE no capability is registered for the agent type
 *   TIMED_OUT   the deadline passed and the invocation was cancelled
 *   FAILED      the capability threw; reason holds its message
 */
public record Invocation(Kind kind, AgentOutput output, String reason) {

    public enum Kind { OK, UNAVAILABLE, TIMED_OUT, FAILED }

    public static Invocation ok(AgentOutput output) {
        return new Invocation(Kind.OK, output, null);
    }

    public static Invocation unavailable(AgentType type) {
        return new Invocation(Kind.UNAVAILABLE, null, "Agent " + type.wireValue() + " not available");
    }

    public static Invocation timedOut() {
        return new Invocation(Kind.TIMED_OUT, null, "Agent execution timed out");
    }

    public static Invocation failed(String reason) {
        return new Invocation(Kind.FAILED, null, reason);
    }

    public boolean isOk() {
        return kind == Kind.OK;
    }

    /** Error text as reported to callers of a single task. */
    public String errorMessage() {
        return switch (kind) {
            case OK          -> null;
            case UNAVAILABLE, TIMED_OUT -> reason;
            case FAILED      -> "Execution error: " + reason;
        };
    }
}
