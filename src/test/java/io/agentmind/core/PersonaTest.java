package io.agentmind.core;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class PersonaTest {

    @Test
    void shouldResolveNamesCaseInsensitively() {
        assertEquals(Persona.PERSONAL, Persona.fromString("personal"));
        assertEquals(Persona.RESEARCH, Persona.fromString(" Research "));
        assertEquals(Persona.TECHNICAL, Persona.fromString("TECHNICAL"));
    }

    @Test
    void shouldListAvailablePersonasForUnknownName() {
        var e = assertThrows(AgentConfigurationException.class, () -> Persona.fromString("pirate"));

        assertTrue(e.getMessage().contains("personal, research, technical"));
        assertThrows(AgentConfigurationException.class, () -> Persona.fromString(null));
    }

    @Test
    void shouldEmbedCurrentTimeInPrompt() {
        String prompt = Persona.TECHNICAL.systemPrompt(LocalDateTime.of(2024, 3, 5, 14, 30, 0));

        assertTrue(prompt.contains("technical assistant"));
        assertTrue(prompt.endsWith("Current time: 2024-03-05 14:30:00"));
    }
}
