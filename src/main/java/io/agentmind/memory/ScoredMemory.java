package io.agentmind.memory;

/**
 * A memory record paired with its relevance to a search query.
 */
public record ScoredMemory(MemoryRecord record, double relevance) {

    public String content() {
        return record.content();
    }
}
