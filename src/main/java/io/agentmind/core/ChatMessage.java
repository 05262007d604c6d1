package io.agentmind.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A single conversation turn.
 *
 * @param role      who produced the message
 * @param content   the message text
 * @param timestamp when the message was created
 * @param metadata  free-form key/value data attached by the caller
 */
public record ChatMessage(
        Role role,
        String content,
        Instant timestamp,
        Map<String, Object> metadata
) {
    public enum Role {
        SYSTEM, USER, ASSISTANT;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public ChatMessage {
        if (role == null) {
            throw new IllegalArgumentException("role is required");
        }
        content = content == null ? "" : content;
        timestamp = timestamp == null ? Instant.now() : timestamp;
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ChatMessage of(Role role, String content) {
        return new ChatMessage(role, content, Instant.now(), Map.of());
    }

    public static ChatMessage user(String content) {
        return of(Role.USER, content);
    }

    public static ChatMessage system(String content) {
        return of(Role.SYSTEM, content);
    }

    public static ChatMessage assistant(String content) {
        return of(Role.ASSISTANT, content);
    }

    /** Returns the "role: content" line used when serializing conversation chunks. */
    public String toTranscriptLine() {
        return role.wireName() + ": " + content;
    }
}
