package io.agentmind.core;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ActionTypeTest {

    @Test
    void shouldMarkRespondAndClarificationTerminal() {
        assertTrue(ActionType.RESPOND.isTerminal());
        assertTrue(ActionType.ASK_CLARIFICATION.isTerminal());
        assertFalse(ActionType.USE_CAPABILITY.isTerminal());
        assertFalse(ActionType.STORE_MEMORY.isTerminal());
    }

    @Test
    void shouldResolveWireNames() {
        assertEquals(Optional.of(ActionType.STORE_MEMORY), ActionType.fromWireName(" store_memory "));
        assertEquals(Optional.of(ActionType.USE_CAPABILITY), ActionType.fromWireName("USE_CAPABILITY"));
        assertTrue(ActionType.fromWireName("dance").isEmpty());
        assertTrue(ActionType.fromWireName(null).isEmpty());
    }

    @Test
    void shouldParseMemoryScopes() {
        assertEquals(MemoryScope.SHORT_TERM, MemoryScope.fromString("short_term"));
        assertEquals(MemoryScope.LONG_TERM, MemoryScope.fromString("long-term"));
        assertEquals(MemoryScope.ALL, MemoryScope.fromString("ALL"));
        assertThrows(AgentConfigurationException.class, () -> MemoryScope.fromString("everything"));
        assertThrows(AgentConfigurationException.class, () -> MemoryScope.fromString(null));
    }
}
