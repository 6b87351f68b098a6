package com.agentorchestra.orchestrator.capability.input;

import com.agentorchestra.orchestrator.model.AgentType;

/**
 * Typed input bundle for one capability invocation.
 *
 * Each agent type has its own record; {@link #agentType()} says which
 * capability the bundle is meant for.
 */
public interface AgentInput {

    AgentType agentType();
}
