package io.agentmind.model;

import io.agentmind.core.ChatMessage;

import java.util.List;

/**
 * Text generation over an ordered list of role/content messages.
 */
public interface ModelAdapter {

    /**
     * @throws ModelAdapterException on transport, timeout, credential or empty-output failures
     */
    String generate(List<ChatMessage> messages);

    ModelInfo info();
}
