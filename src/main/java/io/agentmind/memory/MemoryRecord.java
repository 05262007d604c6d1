package io.agentmind.memory;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * A durable long-term memory record.
 *
 * @param id              autogenerated identifier
 * @param content         the remembered text
 * @param type            record kind
 * @param importanceScore importance in [0,1]
 * @param tags            keyword tags
 * @param createdAt       creation time
 * @param lastAccessed    last time a search or lookup returned this record
 * @param accessCount     number of times the record was returned
 * @param metadata        free-form metadata
 */
public record MemoryRecord(
        long id,
        String content,
        MemoryType type,
        double importanceScore,
        Set<String> tags,
        Instant createdAt,
        Instant lastAccessed,
        int accessCount,
        Map<String, Object> metadata
) {
    public MemoryRecord {
        importanceScore = clamp(importanceScore);
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
