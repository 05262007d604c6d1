package io.agentmind.core;

import java.util.Locale;

/**
 * Which memory layer a clear request targets.
 */
public enum MemoryScope {
    SHORT_TERM,
    LONG_TERM,
    ALL;

    public static MemoryScope fromString(String s) {
        if (s == null) {
            throw new AgentConfigurationException("Memory scope is required");
        }
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "short_term", "short-term" -> SHORT_TERM;
            case "long_term", "long-term" -> LONG_TERM;
            case "all" -> ALL;
            default -> throw new AgentConfigurationException("Unknown memory scope: " + s);
        };
    }
}
