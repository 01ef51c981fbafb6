package com.codewatch.core.capability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Explicit registry of capabilities keyed by {@code capability_id}.
 * Registration order is preserved and drives plan generation.
 */
@Component
public class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final Map<String, Capability> capabilities = new LinkedHashMap<>();

    public CapabilityRegistry(List<Capability> capabilities) {
        for (Capability capability : capabilities) {
            Capability previous = this.capabilities.putIfAbsent(capability.id(), capability);
            if (previous != null) {
                throw new IllegalStateException("Duplicate capability id: " + capability.id());
            }
        }
        log.info("Registered {} capabilities: {}", this.capabilities.size(), this.capabilities.keySet());
    }

    public boolean contains(String capabilityId) {
        return capabilities.containsKey(capabilityId);
    }

    public Optional<Capability> find(String capabilityId) {
        return Optional.ofNullable(capabilities.get(capabilityId));
    }

    /**
     * @throws IllegalArgumentException if no capability is registered under the id
     */
    public Capability require(String capabilityId) {
        Capability capability = capabilities.get(capabilityId);
        if (capability == null) {
            throw new IllegalArgumentException("Unknown capability: " + capabilityId);
        }
        return capability;
    }

    public Collection<Capability> all() {
        return List.copyOf(capabilities.values());
    }

    public List<Capability> withRole(CapabilityRole role) {
        var matching = new ArrayList<Capability>();
        for (Capability capability : capabilities.values()) {
            if (capability.role() == role) {
                matching.add(capability);
            }
        }
        return matching;
    }
}
