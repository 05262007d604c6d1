package io.agentmind.memory;

import io.agentmind.config.AgentProperties;
import io.agentmind.core.ChatMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a message sequence into chunks for consolidation.
 *
 * <p>Scanning in order, a chunk closes after an assistant turn once it holds at least
 * {@code minAssistantChunkSize} messages, or as soon as it reaches {@code maxChunkSize}.
 * A trailing partial chunk is kept.</p>
 */
public class ConversationChunker {

    private final int maxChunkSize;
    private final int minAssistantChunkSize;

    public ConversationChunker() {
        this(AgentProperties.Consolidation.defaults());
    }

    public ConversationChunker(AgentProperties.Consolidation settings) {
        this.maxChunkSize = settings.maxChunkSize();
        this.minAssistantChunkSize = settings.minAssistantChunkSize();
    }

    public List<List<ChatMessage>> chunk(List<ChatMessage> messages) {
        List<List<ChatMessage>> chunks = new ArrayList<>();
        List<ChatMessage> current = new ArrayList<>();

        for (ChatMessage message : messages) {
            current.add(message);
            boolean closesTurn = message.role() == ChatMessage.Role.ASSISTANT && current.size() >= minAssistantChunkSize;
            if (closesTurn || current.size() >= maxChunkSize) {
                chunks.add(List.copyOf(current));
                current = new ArrayList<>();
            }
        }

        if (!current.isEmpty()) {
            chunks.add(List.copyOf(current));
        }
        return chunks;
    }
}
