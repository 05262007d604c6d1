package io.agentmind.core;

import io.agentmind.memory.MemoryCoordinator;
import io.agentmind.model.ModelInfo;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of an assistant session.
 */
public record AgentStatus(
        String agentId,
        String name,
        AgentState state,
        String persona,
        int iteration,
        int maxIterations,
        List<String> availableCapabilities,
        MemoryCoordinator.MemorySummary memorySummary,
        ModelInfo modelInfo,
        Instant createdAt,
        int totalInteractions,
        Duration uptime
) {}
