package io.agentmind.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AgentPropertiesTest {

    @Test
    void shouldApplyDefaults() {
        AgentProperties properties = AgentProperties.defaults();

        assertEquals("PersonalAssistant", properties.name());
        assertEquals("openai:gpt-4o", properties.model());
        assertEquals("personal", properties.persona());
        assertEquals(10, properties.loop().maxIterations());
        assertEquals(10, properties.loop().minResponseLength());
        assertEquals(20, properties.memory().shortTermCapacity());
        assertEquals(10, properties.memory().consolidationThreshold());
        assertEquals("fts", properties.memory().index());
        assertEquals(0.5, properties.memory().consolidation().persistThreshold());
        assertEquals(5, properties.memory().consolidation().maxChunkSize());
    }

    @Test
    void shouldKeepExplicitValues() {
        var loop = new AgentProperties.Loop(3, 1, 5);
        var properties = new AgentProperties("Jarvis", "ollama:llama3", "technical", 100, 0.1, 500, loop, null);

        assertEquals("Jarvis", properties.name());
        assertEquals(3, properties.loop().maxIterations());
        assertEquals(5, properties.loop().relevantMemoryLimit());
        assertEquals(500, properties.maxInputLength());
        assertEquals("./data/memory", properties.memory().path());
    }

    @Test
    void shouldRejectNonPositiveIterationLimit() {
        assertThrows(IllegalArgumentException.class, () -> new AgentProperties.Loop(0, null, null));
    }
}
