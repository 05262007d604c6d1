package io.agentmind.model;

import io.agentmind.config.ModelRouter;
import io.agentmind.core.ChatMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.model.tool.ToolCallingChatOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@link ModelAdapter} over a Spring AI {@code ChatModel} resolved by the {@link ModelRouter}.
 */
public class SpringAiModelAdapter implements ModelAdapter {

    private static final Logger log = LoggerFactory.getLogger(SpringAiModelAdapter.class);
    private static final List<String> CREDENTIAL_HINTS =
            List.of("401", "403", "unauthorized", "forbidden", "api key", "api-key", "authentication");

    private final ModelRouter.ResolvedModel resolved;
    private final int maxTokens;
    private final double temperature;

    public SpringAiModelAdapter(ModelRouter.ResolvedModel resolved, int maxTokens, double temperature) {
        this.resolved = resolved;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
    }

    @Override
    public String generate(List<ChatMessage> messages) {
        ChatOptions chatOptions = ToolCallingChatOptions.builder()
                .model(resolved.modelName())
                .maxTokens(maxTokens)
                .temperature(temperature)
                .build();

        String content;
        try {
            content = ChatClient.builder(resolved.chatModel())
                    .build()
                    .prompt()
                    .messages(toSpringMessages(messages))
                    .options(chatOptions)
                    .call()
                    .content();
        } catch (RuntimeException e) {
            boolean recoverable = !looksLikeCredentialFailure(e);
            log.warn("Model call to {}:{} failed (recoverable={}): {}",
                    resolved.provider(), resolved.modelName(), recoverable, e.getMessage());
            throw new ModelAdapterException("Model call failed: " + e.getMessage(), recoverable, e);
        }

        if (content == null || content.isBlank()) {
            throw new ModelAdapterException("Model returned no content", true);
        }
        return content;
    }

    @Override
    public ModelInfo info() {
        return new ModelInfo(resolved.provider(), resolved.modelName(), maxTokens, temperature);
    }

    static List<Message> toSpringMessages(List<ChatMessage> messages) {
        List<Message> result = new ArrayList<>(messages.size());
        for (ChatMessage msg : messages) {
            switch (msg.role()) {
                case SYSTEM -> result.add(new SystemMessage(msg.content()));
                case USER -> result.add(new UserMessage(msg.content()));
                case ASSISTANT -> result.add(new AssistantMessage(msg.content()));
            }
        }
        return result;
    }

    private static boolean looksLikeCredentialFailure(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            String message = t.getMessage();
            if (message == null) continue;
            String lower = message.toLowerCase(Locale.ROOT);
            if (CREDENTIAL_HINTS.stream().anyMatch(lower::contains)) {
                return true;
            }
        }
        return false;
    }
}
