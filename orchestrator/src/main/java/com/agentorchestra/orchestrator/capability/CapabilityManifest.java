package com.agentorchestra.orchestrator.capability;

import com.agentorchestra.orchestrator.model.AgentType;

/**
 * Identity of a capability.
 *
 * @param agentType   the agent type this capability serves; one capability per type
 * @param version     implementation version, logged at registration
 * @param description one line shown in start-up logs
 */
public record CapabilityManifest(
        AgentType agentType,
        String    version,
        String    description) {}
