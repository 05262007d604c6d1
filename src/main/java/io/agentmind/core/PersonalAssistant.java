package io.agentmind.core;

import io.agentmind.memory.MemoryCoordinator;
import io.agentmind.memory.ScoredMemory;
import io.agentmind.model.ModelAdapter;
import io.agentmind.security.InputSanitizer;
import io.agentmind.tool.CapabilityRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One assistant session: the entry point the surrounding application talks to.
 *
 * <p>{@link #chat} never throws. Calls on one session are serialized; separate sessions
 * run independently and share only long-term memory and the capability registry.
 * {@link #getStatus()} and {@link #getStatistics()} do not wait for a running turn.</p>
 */
public class PersonalAssistant {

    private static final Logger log = LoggerFactory.getLogger(PersonalAssistant.class);
    private static final Logger chatLog = LoggerFactory.getLogger("agentmind.chat");
    private static final Logger perfLog = LoggerFactory.getLogger("agentmind.performance");

    static final String ERROR_PREFIX = "I apologize, but I encountered an error: ";

    private final String agentId;
    private final String name;
    private final AgentLoop loop;
    private final MemoryCoordinator memory;
    private final CapabilityRegistry capabilities;
    private final ModelAdapter modelAdapter;
    private final InputSanitizer sanitizer;
    private final Instant createdAt = Instant.now();
    private volatile int totalInteractions;

    public PersonalAssistant(String agentId, String name, AgentLoop loop, MemoryCoordinator memory,
                             CapabilityRegistry capabilities, ModelAdapter modelAdapter, InputSanitizer sanitizer) {
        this.agentId = agentId;
        this.name = name;
        this.loop = loop;
        this.memory = memory;
        this.capabilities = capabilities;
        this.modelAdapter = modelAdapter;
        this.sanitizer = sanitizer;
        log.info("Assistant '{}' created (id={}, persona={}, model={})",
                name, agentId, loop.persona().wireName(), modelAdapter.info().model());
    }

    public String chat(String message) {
        return chat(message, Map.of());
    }

    /**
     * Processes one user message.
     *
     * @param context optional caller data recorded with the message
     * @return the response; internal failures are reported as an apology
     */
    public synchronized String chat(String message, Map<String, Object> context) {
        int interactionId = ++totalInteractions;
        long start = System.nanoTime();
        try {
            String input = sanitizer.sanitize(message);
            if (input.isBlank()) {
                return ActionExecutor.DEFAULT_CLARIFICATION;
            }

            Map<String, Object> enhanced = new LinkedHashMap<>();
            if (context != null) {
                enhanced.putAll(context);
            }
            enhanced.put("interaction_id", interactionId);
            enhanced.put("agent_id", agentId);
            enhanced.put("timestamp", Instant.now().toString());

            String response = loop.processUserInput(input, enhanced);
            chatLog.info("[{}#{}] user={} chars, response={} chars, iterations={}, {} ms",
                    agentId, interactionId, input.length(), response.length(), loop.currentIteration(),
                    Duration.ofNanos(System.nanoTime() - start).toMillis());
            return response;
        } catch (Exception e) {
            log.error("Chat failed for interaction {}: {}", interactionId, e.getMessage(), e);
            return ERROR_PREFIX + e.getMessage();
        } finally {
            perfLog.debug("[{}#{}] chat completed in {} ms", agentId, interactionId,
                    Duration.ofNanos(System.nanoTime() - start).toMillis());
        }
    }

    public AgentStatus getStatus() {
        return new AgentStatus(agentId, name, loop.state(), loop.persona().wireName(), loop.currentIteration(),
                loop.maxIterations(), capabilities.names(), memory.summary(), modelAdapter.info(), createdAt,
                totalInteractions, uptime());
    }

    public AgentStatistics getStatistics() {
        return new AgentStatistics(totalInteractions, uptime(), loop.persona().wireName(), memory.summary(),
                capabilities.usageCounts(), modelAdapter.info());
    }

    /**
     * Clears the given memory scope. Long-term records are never deleted here, so
     * {@link MemoryScope#LONG_TERM} changes nothing and returns false.
     */
    public synchronized boolean clearMemory(MemoryScope scope) {
        return switch (scope) {
            case SHORT_TERM, ALL -> {
                memory.clearShortTerm();
                log.info("Cleared short-term memory for {} (scope {})", agentId, scope);
                yield true;
            }
            case LONG_TERM -> {
                log.warn("Long-term memory is not cleared by the assistant; manage it through the store directly");
                yield false;
            }
        };
    }

    public synchronized boolean storePreference(String key, String value) {
        if (key == null || key.isBlank()) {
            return false;
        }
        try {
            memory.storePreference(key, value);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to store preference '{}': {}", key, e.getMessage());
            return false;
        }
    }

    public synchronized Optional<String> getPreference(String key) {
        return memory.getPreference(key);
    }

    public synchronized List<ScoredMemory> searchMemories(String query, int limit) {
        return memory.searchMemories(query, limit);
    }

    /**
     * Switches persona for subsequent messages.
     *
     * @return false if {@code persona} is not a known persona; the current one is kept
     */
    public synchronized boolean setPersona(String persona) {
        try {
            loop.setPersona(Persona.fromString(persona));
            log.info("Assistant {} switched to persona '{}'", agentId, persona);
            return true;
        } catch (AgentConfigurationException e) {
            log.warn(e.getMessage());
            return false;
        }
    }

    public String agentId() {
        return agentId;
    }

    private Duration uptime() {
        return Duration.between(createdAt, Instant.now());
    }
}
