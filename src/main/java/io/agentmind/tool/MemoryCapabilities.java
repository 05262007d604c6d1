package io.agentmind.tool;

import io.agentmind.memory.LongTermMemory;
import io.agentmind.memory.MemoryType;
import io.agentmind.memory.Preference;
import io.agentmind.memory.ScoredMemory;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Capabilities that let the agent read its own long-term memory.
 */
public class MemoryCapabilities {

    private static final Logger log = LoggerFactory.getLogger(MemoryCapabilities.class);

    static final String MEMORY_SEARCH = "memory_search";
    static final String PREFERENCE_LOOKUP = "preference_lookup";

    private final CapabilityRegistry registry;
    private final LongTermMemory memory;

    public MemoryCapabilities(CapabilityRegistry registry, LongTermMemory memory) {
        this.registry = registry;
        this.memory = memory;
    }

    @PostConstruct
    public void registerCapabilities() {
        registry.register(Capability.of(MEMORY_SEARCH,
                "Search long-term memory for records relevant to a query",
                """
                {"type":"object","properties":{
                  "query":{"type":"string"},
                  "limit":{"type":"integer"},
                  "memory_type":{"type":"string","enum":["conversation","fact","preference","interaction"]}
                },"required":["query"]}""",
                this::memorySearch));
        registry.register(Capability.of(PREFERENCE_LOOKUP,
                "Look up a stored user preference by key, or list all preferences when no key is given",
                """
                {"type":"object","properties":{"key":{"type":"string"}}}""",
                this::preferenceLookup));
        log.info("Registered 2 memory capabilities");
    }

    /**
     * Args: query (string, required), limit (int, optional, default 5), memory_type (string, optional)
     */
    CapabilityResult memorySearch(Map<String, Object> args) {
        String query = stringArg(args, "query", "");
        int limit = intArg(args, "limit", 5);
        String type = stringArg(args, "memory_type", "");

        if (query.isBlank()) {
            return CapabilityResult.failure("'query' is required.");
        }

        MemoryType filter = type.isBlank() ? null : MemoryType.fromString(type);
        List<ScoredMemory> results = memory.search(query, limit, filter, 0.0);
        if (results.isEmpty()) {
            return CapabilityResult.ok("No memories found matching: " + query);
        }

        StringJoiner output = new StringJoiner("\n");
        output.add("Found %d memories:".formatted(results.size()));
        for (ScoredMemory result : results) {
            int scorePercent = (int) (result.relevance() * 100);
            output.add("- [%s] %s [%d%%]".formatted(
                    result.record().type().wireName(), truncate(result.content(), 200), scorePercent));
        }
        return CapabilityResult.ok(output.toString());
    }

    /**
     * Args: key (string, optional)
     */
    CapabilityResult preferenceLookup(Map<String, Object> args) {
        String key = stringArg(args, "key", "");
        if (key.isBlank()) {
            List<Preference> all = memory.listPreferences();
            if (all.isEmpty()) {
                return CapabilityResult.ok("No preferences stored.");
            }
            StringJoiner output = new StringJoiner("\n");
            all.forEach(p -> output.add("- %s: %s".formatted(p.key(), p.value())));
            return CapabilityResult.ok(output.toString());
        }

        Optional<Preference> preference = memory.getPreference(key);
        return preference
                .map(p -> CapabilityResult.ok(p.value()))
                .orElseGet(() -> CapabilityResult.failure("Preference not found: " + key));
    }

    private String stringArg(Map<String, Object> args, String key, String defaultValue) {
        Object val = args.get(key);
        return val != null ? val.toString() : defaultValue;
    }

    private int intArg(Map<String, Object> args, String key, int defaultValue) {
        Object val = args.get(key);
        if (val instanceof Number n) return n.intValue();
        if (val instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric '{}' argument: {}", key, s);
            }
        }
        return defaultValue;
    }

    private String truncate(String s, int maxLen) {
        if (s == null) return "";
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
