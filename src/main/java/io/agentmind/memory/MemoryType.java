package io.agentmind.memory;

import java.util.Locale;

/**
 * Kinds of long-term memory records.
 *
 * <ul>
 *   <li>{@code CONVERSATION}: consolidated chunks of short-term history</li>
 *   <li>{@code FACT}: statements the agent was asked to keep</li>
 *   <li>{@code PREFERENCE}: user likes and dislikes stored as free text</li>
 *   <li>{@code INTERACTION}: exchange summaries written during reflection</li>
 * </ul>
 */
public enum MemoryType {
    CONVERSATION,
    FACT,
    PREFERENCE,
    INTERACTION;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient mapping used for model-supplied values; unknown names become {@code FACT}.
     */
    public static MemoryType fromString(String s) {
        if (s == null || s.isBlank()) return FACT;
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "conversation" -> CONVERSATION;
            case "preference", "user_preference" -> PREFERENCE;
            case "interaction" -> INTERACTION;
            default -> FACT;
        };
    }
}
