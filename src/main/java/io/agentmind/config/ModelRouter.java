package io.agentmind.config;

import io.agentmind.core.AgentConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Resolves a model string to one of the configured Spring AI chat models.
 *
 * <p>Accepted forms:</p>
 * <ul>
 *   <li>{@code "gpt-4o"}: provider detected from the model name</li>
 *   <li>{@code "openai:gpt-4o-mini"}: explicit OpenAI</li>
 *   <li>{@code "ollama:llama3"}: local Ollama</li>
 *   <li>{@code "anthropic:claude-sonnet-4-20250514"}: Anthropic</li>
 * </ul>
 *
 * <p>An unsupported or unconfigured provider is a configuration error.</p>
 */
@Component
public class ModelRouter {

    private static final Logger log = LoggerFactory.getLogger(ModelRouter.class);

    public static final Set<String> SUPPORTED_PROVIDERS = Set.of("openai", "anthropic", "ollama");

    private final Map<String, ChatModel> providers = new LinkedHashMap<>();

    @Autowired
    public ModelRouter(
            @Autowired(required = false) @Qualifier("openAiChatModel") ChatModel openAiChatModel,
            @Autowired(required = false) @Qualifier("anthropicChatModel") ChatModel anthropicChatModel,
            @Autowired(required = false) @Qualifier("ollamaChatModel") ChatModel ollamaChatModel
    ) {
        if (openAiChatModel != null) providers.put("openai", openAiChatModel);
        if (anthropicChatModel != null) providers.put("anthropic", anthropicChatModel);
        if (ollamaChatModel != null) providers.put("ollama", ollamaChatModel);

        if (providers.isEmpty()) {
            throw new AgentConfigurationException(
                    "At least one model provider must be configured (OpenAI, Anthropic, or Ollama)");
        }
        log.info("ModelRouter initialized with providers: {}", providers.keySet());
    }

    /**
     * Resolves a model string.
     *
     * @param modelSpec e.g. {@code "ollama:llama3"} or {@code "gpt-4o"}
     * @throws AgentConfigurationException if the provider is unsupported or not configured
     */
    public ResolvedModel resolve(String modelSpec) {
        if (modelSpec == null || modelSpec.isBlank()) {
            throw new AgentConfigurationException("No model specified");
        }

        String provider;
        String modelName;
        int colonIdx = modelSpec.indexOf(':');
        if (colonIdx > 0) {
            provider = modelSpec.substring(0, colonIdx).toLowerCase();
            modelName = modelSpec.substring(colonIdx + 1);
        } else {
            provider = detectProvider(modelSpec);
            modelName = modelSpec;
        }

        if (!SUPPORTED_PROVIDERS.contains(provider)) {
            throw new AgentConfigurationException(
                    "Unsupported model provider '%s'. Supported: %s".formatted(provider, SUPPORTED_PROVIDERS));
        }
        if (modelName.isBlank()) {
            throw new AgentConfigurationException("No model name given in '" + modelSpec + "'");
        }
        ChatModel chatModel = providers.get(provider);
        if (chatModel == null) {
            throw new AgentConfigurationException(
                    "Model provider '%s' is not configured. Available: %s".formatted(provider, providers.keySet()));
        }
        return new ResolvedModel(chatModel, modelName, provider);
    }

    public Set<String> availableProviders() {
        return providers.keySet();
    }

    private String detectProvider(String modelSpec) {
        String lower = modelSpec.toLowerCase();
        if (lower.startsWith("gpt-") || lower.startsWith("o1") || lower.startsWith("o3") || lower.startsWith("o4")) {
            return "openai";
        }
        if (lower.startsWith("claude")) {
            return "anthropic";
        }
        if (lower.startsWith("llama") || lower.startsWith("mistral") || lower.startsWith("gemma")
                || lower.startsWith("qwen") || lower.startsWith("deepseek") || lower.startsWith("phi")) {
            return "ollama";
        }
        throw new AgentConfigurationException(
                "Cannot infer provider for model '%s'; use the provider:model form".formatted(modelSpec));
    }

    /**
     * Result of model resolution.
     *
     * @param chatModel the Spring AI ChatModel to use
     * @param modelName the model name to pass in options
     * @param provider  the provider name
     */
    public record ResolvedModel(ChatModel chatModel, String modelName, String provider) {}
}
