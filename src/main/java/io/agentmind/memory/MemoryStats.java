package io.agentmind.memory;

import java.util.Map;

/**
 * Aggregate counts over the long-term store.
 *
 * @param totalMemories    number of memory records
 * @param countsByType     record count per type
 * @param totalPreferences number of stored preferences
 * @param totalFacts       number of stored facts
 * @param indexName        name of the active similarity index
 * @param indexAvailable   whether the index currently accepts queries
 */
public record MemoryStats(
        long totalMemories,
        Map<MemoryType, Long> countsByType,
        long totalPreferences,
        long totalFacts,
        String indexName,
        boolean indexAvailable
) {}
