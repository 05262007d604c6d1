package io.agentmind.memory;

import java.time.Instant;

/**
 * A categorized fact with a confidence score.
 */
public record Fact(long id, String content, String category, double confidence,
                   String source, Instant createdAt, boolean verified) {}
