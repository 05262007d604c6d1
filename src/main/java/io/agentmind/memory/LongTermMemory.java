package io.agentmind.memory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable, cross-session memory: records with similarity retrieval, preferences and facts.
 *
 * <p>Implementations must be safe for concurrent use by several agent sessions.</p>
 */
public interface LongTermMemory {

    /**
     * Persists a record and indexes it for similarity search on a best-effort basis.
     *
     * @throws LongTermMemoryException if the record could not be persisted
     */
    StoredMemory store(String content, MemoryType type, double importance,
                       Collection<String> tags, Map<String, Object> metadata);

    /**
     * Returns records ordered by relevance. Never throws: an unavailable or failing index
     * yields an empty list.
     *
     * @param typeFilter    restrict to one type, or {@code null} for all types
     * @param minImportance lowest importance score to return
     */
    List<ScoredMemory> search(String query, int limit, MemoryType typeFilter, double minImportance);

    Optional<MemoryRecord> get(long id);

    /** Inserts or overwrites the preference stored under {@code key}. */
    void setPreference(String key, String value);

    Optional<Preference> getPreference(String key);

    List<Preference> listPreferences();

    long storeFact(String content, String category, double confidence, String source);

    List<Fact> factsByCategory(String category);

    MemoryStats stats();

    boolean healthCheck();
}
