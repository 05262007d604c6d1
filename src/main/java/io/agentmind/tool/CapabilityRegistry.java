package io.agentmind.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registry of agent capabilities. Dispatches invocations by name and counts usage.
 *
 * <p>Shared by all sessions; registration and invocation are thread-safe.</p>
 */
public class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final Map<String, Capability> capabilities = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> usage = new ConcurrentHashMap<>();

    public CapabilityRegistry() {
    }

    public CapabilityRegistry(List<Capability> initial) {
        initial.forEach(this::register);
    }

    public void register(Capability capability) {
        Capability previous = capabilities.put(capability.name(), capability);
        if (previous != null) {
            log.warn("Capability '{}' was already registered and has been replaced", capability.name());
        } else {
            log.debug("Registered capability: {}", capability.name());
        }
    }

    public void unregister(String name) {
        capabilities.remove(name);
        log.debug("Unregistered capability: {}", name);
    }

    public Optional<Capability> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(capabilities.get(name));
    }

    /** Registered capability names, sorted. */
    public List<String> names() {
        return capabilities.keySet().stream().sorted().toList();
    }

    public List<Capability> all() {
        return names().stream().map(capabilities::get).toList();
    }

    /**
     * Invokes a capability by name. Never throws: a missing capability or a failing
     * invocation is returned as a failed result.
     */
    public CapabilityResult invoke(String name, Map<String, Object> parameters) {
        Capability capability = name == null ? null : capabilities.get(name);
        if (capability == null) {
            log.warn("Capability '{}' not found", name);
            return CapabilityResult.failure("Capability '" + name + "' not found");
        }

        usage.computeIfAbsent(name, k -> new AtomicLong()).incrementAndGet();
        try {
            CapabilityResult result = capability.invoke(parameters == null ? Map.of() : parameters);
            if (result == null) {
                return CapabilityResult.failure("Capability '" + name + "' returned no result");
            }
            return result;
        } catch (Exception e) {
            log.error("Error executing capability '{}': {}", name, e.getMessage(), e);
            return CapabilityResult.failure("Capability '" + name + "' failed: " + e.getMessage());
        }
    }

    /** Invocation counts per capability name, sorted by name. */
    public Map<String, Long> usageCounts() {
        Map<String, Long> counts = new TreeMap<>();
        usage.forEach((name, count) -> counts.put(name, count.get()));
        return counts;
    }
}
