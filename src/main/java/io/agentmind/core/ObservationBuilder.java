package io.agentmind.core;

import io.agentmind.memory.MemoryCoordinator;
import io.agentmind.tool.CapabilityRegistry;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Assembles the observation the decision engine works from.
 */
public class ObservationBuilder {

    private final MemoryCoordinator memory;
    private final CapabilityRegistry capabilities;
    private final int relevantMemoryLimit;

    public ObservationBuilder(MemoryCoordinator memory, CapabilityRegistry capabilities, int relevantMemoryLimit) {
        this.memory = memory;
        this.capabilities = capabilities;
        this.relevantMemoryLimit = relevantMemoryLimit;
    }

    public Observation build(String userInput, Map<String, Object> context, Persona persona) {
        Map<String, Object> callerContext = context == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        return new Observation(
                userInput,
                memory.assembleContext(true),
                capabilities.names(),
                persona,
                memory.searchMemories(userInput, relevantMemoryLimit),
                memory.shortTerm().summary(),
                callerContext,
                Instant.now(),
                0,
                null);
    }
}
