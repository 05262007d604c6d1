package io.agentmind.memory;

import java.time.Instant;

public record Preference(String key, String value, Instant createdAt, Instant updatedAt) {}
