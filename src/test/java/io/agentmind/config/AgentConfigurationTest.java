package io.agentmind.config;

import io.agentmind.memory.Fts5SimilarityIndex;
import io.agentmind.memory.SimilarityIndex;
import io.agentmind.memory.VectorStoreSimilarityIndex;
import io.agentmind.security.InputSanitizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.ObjectProvider;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AgentConfigurationTest {

    @TempDir
    Path tempDir;

    @Mock
    private ObjectProvider<VectorStore> vectorStores;

    @Mock
    private VectorStore vectorStore;

    private final AgentConfiguration configuration = new AgentConfiguration();

    private AgentProperties properties(String index) {
        Path memoryDir = tempDir.resolve("nested").resolve("memory");
        var memory = new AgentProperties.Memory(memoryDir.toString(), index, null, null, null, null, null, null, null);
        return new AgentProperties(null, null, null, null, null, 100, null, memory);
    }

    @Test
    void shouldUseFts5IndexByDefault() {
        SimilarityIndex index = configuration.similarityIndex(properties("fts"), vectorStores);

        assertInstanceOf(Fts5SimilarityIndex.class, index);
        assertEquals("fts5", index.name());
        assertTrue(Files.isDirectory(tempDir.resolve("nested").resolve("memory")));
    }

    @Test
    void shouldUseVectorStoreWhenConfigured() {
        when(vectorStores.getIfAvailable()).thenReturn(vectorStore);

        SimilarityIndex index = configuration.similarityIndex(properties("vector"), vectorStores);

        assertInstanceOf(VectorStoreSimilarityIndex.class, index);
    }

    @Test
    void shouldFallBackToFts5WithoutVectorStore() {
        when(vectorStores.getIfAvailable()).thenReturn(null);

        SimilarityIndex index = configuration.similarityIndex(properties("vector"), vectorStores);

        assertInstanceOf(Fts5SimilarityIndex.class, index);
    }

    @Test
    void shouldSizeSanitizerFromProperties() {
        InputSanitizer sanitizer = configuration.inputSanitizer(properties("fts"));

        assertEquals(100 + "... [truncated]".length(), sanitizer.sanitize("a".repeat(150)).length());
    }
}
