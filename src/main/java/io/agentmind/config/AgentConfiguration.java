package io.agentmind.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentmind.core.AssistantFactory;
import io.agentmind.core.PersonalAssistant;
import io.agentmind.memory.Fts5SimilarityIndex;
import io.agentmind.memory.LongTermMemory;
import io.agentmind.memory.LongTermMemoryException;
import io.agentmind.memory.SimilarityIndex;
import io.agentmind.memory.SqliteLongTermMemory;
import io.agentmind.memory.VectorStoreSimilarityIndex;
import io.agentmind.model.ModelAdapter;
import io.agentmind.model.SpringAiModelAdapter;
import io.agentmind.security.InputSanitizer;
import io.agentmind.tool.Capability;
import io.agentmind.tool.CapabilityRegistry;
import io.agentmind.tool.MemoryCapabilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Wires the shared agent infrastructure: long-term memory, capabilities and the model adapter.
 */
@Configuration
@EnableConfigurationProperties(AgentProperties.class)
public class AgentConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AgentConfiguration.class);
    static final String DATABASE_FILE = "agent.db";

    @Bean
    public SimilarityIndex similarityIndex(AgentProperties properties, ObjectProvider<VectorStore> vectorStore) {
        if ("vector".equalsIgnoreCase(properties.memory().index())) {
            VectorStore store = vectorStore.getIfAvailable();
            if (store != null) {
                log.info("Using vector store similarity index");
                return new VectorStoreSimilarityIndex(store);
            }
            log.warn("agent.memory.index=vector but no VectorStore bean is configured, using FTS5");
        }
        return new Fts5SimilarityIndex(databasePath(properties).toString());
    }

    @Bean
    public LongTermMemory longTermMemory(AgentProperties properties, SimilarityIndex similarityIndex,
                                         ObjectMapper objectMapper) {
        return new SqliteLongTermMemory(databasePath(properties).toString(), similarityIndex, objectMapper);
    }

    @Bean
    public CapabilityRegistry capabilityRegistry(ObjectProvider<Capability> capabilities) {
        return new CapabilityRegistry(capabilities.orderedStream().toList());
    }

    @Bean
    public MemoryCapabilities memoryCapabilities(CapabilityRegistry registry, LongTermMemory longTermMemory) {
        return new MemoryCapabilities(registry, longTermMemory);
    }

    @Bean
    public ModelAdapter modelAdapter(ModelRouter modelRouter, AgentProperties properties) {
        ModelRouter.ResolvedModel resolved = modelRouter.resolve(properties.model());
        log.info("Agent '{}' using provider '{}' with model '{}'", properties.name(), resolved.provider(), resolved.modelName());
        return new SpringAiModelAdapter(resolved, properties.maxTokens(), properties.temperature());
    }

    @Bean
    public InputSanitizer inputSanitizer(AgentProperties properties) {
        return new InputSanitizer(properties.maxInputLength());
    }

    @Bean
    public PersonalAssistant personalAssistant(AssistantFactory assistantFactory) {
        return assistantFactory.create();
    }

    private static Path databasePath(AgentProperties properties) {
        Path dir = Path.of(properties.memory().path());
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new LongTermMemoryException("Failed to create memory directory: " + dir, e);
        }
        return dir.resolve(DATABASE_FILE);
    }
}
