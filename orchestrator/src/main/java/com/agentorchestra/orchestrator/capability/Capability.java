package com.agentorchestra.orchestrator.capability;

import com.agentorchestra.orchestrator.capability.input.AgentInput;
import com.agentorchestra.orchestrator.model.AgentOutput;

/**
 * One agent implementation that tasks and pipeline stages are dispatched to.
 *
 * <p>Capabilities are registered as Spring beans and collected by the
 * {@link CapabilityRegistry} at start-up. An invocation is blocking from the
 * capability's point of view: the executor runs it on a worker thread and
 * interrupts that thread when the deadline passes, so implementations should
 * use interruptible I/O and let {@link InterruptedException} end the call.
 *
 * @param <I> typed input bundle accepted by this capability
 */
public interface Capability<I extends AgentInput> {

    /** Identity and routing metadata. */
    CapabilityManifest manifest();

    /** Runtime type of the accepted input, checked before every call. */
    Class<I> inputType();

    /**
     * Run the agent.
     *
     * @throws CapabilityException when the agent fails in a way it can explain;
     *         any other runtime exception is treated the same by the executor
     */
    AgentOutput invoke(I input) throws CapabilityException;

    /**
     * Check the input's runtime type and invoke.
     *
     * @throws ClassCastException if the input belongs to another agent type
     */
    default AgentOutput invokeWith(AgentInput input) {
        return invoke(inputType().cast(input));
    }
}
