package io.agentmind.memory;

/**
 * Outcome of a long-term store call.
 *
 * @param id      the new record id
 * @param indexed false when the record was persisted but the similarity index rejected it,
 *                so it will not show up in searches
 */
public record StoredMemory(long id, boolean indexed) {}
