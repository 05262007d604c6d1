package io.agentmind.memory;

import java.util.List;

/**
 * Similarity lookup over long-term records, keyed by record id.
 *
 * <p>The index only stores what it needs to rank; the record store remains the source
 * of truth for content and bookkeeping.</p>
 */
public interface SimilarityIndex {

    String name();

    /** Whether the index can currently accept writes and queries. */
    boolean isAvailable();

    /**
     * Adds a record to the index.
     *
     * @throws IllegalStateException if the index is unavailable or rejects the entry
     */
    void index(long recordId, String content, MemoryType type, double importance);

    /**
     * Ranks indexed records against {@code query}, best first.
     *
     * @throws IllegalStateException if the index is unavailable or the query fails
     */
    List<Hit> search(String query, int limit, MemoryType typeFilter, double minImportance);

    record Hit(long recordId, double score) {}
}
