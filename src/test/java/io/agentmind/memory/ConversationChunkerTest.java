package io.agentmind.memory;

import io.agentmind.core.ChatMessage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConversationChunkerTest {

    private final ConversationChunker chunker = new ConversationChunker();

    @Test
    void shouldSplitAfterAssistantTurns() {
        List<ChatMessage> messages = List.of(
                ChatMessage.user("u1"), ChatMessage.assistant("a1"),
                ChatMessage.user("u2"), ChatMessage.assistant("a2"));

        List<List<ChatMessage>> chunks = chunker.chunk(messages);

        assertEquals(2, chunks.size());
        assertEquals("u1", chunks.get(0).get(0).content());
        assertEquals("a2", chunks.get(1).get(1).content());
    }

    @Test
    void shouldNotCloseChunkOnLeadingAssistantMessage() {
        List<ChatMessage> messages = List.of(
                ChatMessage.assistant("a0"), ChatMessage.user("u1"), ChatMessage.assistant("a1"));

        List<List<ChatMessage>> chunks = chunker.chunk(messages);

        assertEquals(1, chunks.size());
        assertEquals(3, chunks.get(0).size());
    }

    @Test
    void shouldCapChunksAtFiveMessages() {
        List<ChatMessage> messages = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            messages.add(ChatMessage.user("u" + i));
        }

        List<List<ChatMessage>> chunks = chunker.chunk(messages);

        assertEquals(3, chunks.size());
        assertEquals(5, chunks.get(0).size());
        assertEquals(5, chunks.get(1).size());
        assertEquals(2, chunks.get(2).size());
    }

    @Test
    void shouldReturnNoChunksForEmptyInput() {
        assertTrue(chunker.chunk(List.of()).isEmpty());
    }
}
