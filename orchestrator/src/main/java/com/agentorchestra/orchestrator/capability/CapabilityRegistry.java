package com.agentorchestra.orchestrator.capability;

import com.agentorchestra.orchestrator.model.AgentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-process capability registry.
 *
 * All {@link Capability} beans are collected once at start-up via
 * constructor injection. The map is never modified afterwards, so
 * concurrent {@link #resolve} calls need no locking.
 *
 * A type with no registered capability, or one listed in
 * {@code orchestra.capabilities.disabled}, is simply absent: callers report
 * it as unavailable.
 */
@Component
public class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final Map<AgentType, Capability<?>> capabilities;

    public CapabilityRegistry(List<Capability<?>> allCapabilities) {
        this(allCapabilities, List.of());
    }

    /**
     * @param disabledTypes wire values of agent types to leave out, e.g. "validator"
     */
    @Autowired
    public CapabilityRegistry(List<Capability<?>> allCapabilities,
                              @Value("${orchestra.capabilities.disabled:}") List<String> disabledTypes) {
        Set<AgentType> disabled = EnumSet.noneOf(AgentType.class);
        for (String name : disabledTypes) {
            if (name != null && !name.isBlank()) {
                disabled.add(AgentType.fromWire(name.strip()));
            }
        }

        Map<AgentType, Capability<?>> byType = new EnumMap<>(AgentType.class);
        for (Capability<?> capability : allCapabilities) {
            CapabilityManifest m = capability.manifest();
            if (disabled.contains(m.agentType())) {
                log.info("Capability '{}' disabled by configuration", m.agentType());
                continue;
            }
            Capability<?> previous = byType.putIfAbsent(m.agentType(), capability);
            if (previous != null) {
                throw new IllegalStateException(
                        "Two capabilities registered for agent type '" + m.agentType() + "'");
            }
            log.info("Registered capability '{}' v{}: {}", m.agentType(), m.version(), m.description());
        }
        this.capabilities = Collections.unmodifiableMap(byType);
    }

    public Optional<Capability<?>> resolve(AgentType agentType) {
        return Optional.ofNullable(capabilities.get(agentType));
    }

    /** Agent types that currently have a capability behind them. */
    public Set<AgentType> availableTypes() {
        return capabilities.keySet();
    }
}
