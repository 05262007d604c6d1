package io.agentmind.core;

import io.agentmind.memory.MemoryCoordinator;
import io.agentmind.model.ModelInfo;

import java.time.Duration;
import java.util.Map;

/**
 * Usage figures for an assistant session.
 *
 * @param capabilityUsage invocation count per capability, shared across sessions
 */
public record AgentStatistics(
        int totalInteractions,
        Duration uptime,
        String persona,
        MemoryCoordinator.MemorySummary memorySummary,
        Map<String, Long> capabilityUsage,
        ModelInfo modelInfo
) {}
