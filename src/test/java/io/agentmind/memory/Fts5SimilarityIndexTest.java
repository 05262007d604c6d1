package io.agentmind.memory;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class Fts5SimilarityIndexTest {

    @TempDir
    Path tempDir;

    private Fts5SimilarityIndex index;

    @BeforeEach
    void setUp() {
        index = new Fts5SimilarityIndex(tempDir.resolve("index.db").toString());
        index.init();
    }

    @AfterEach
    void tearDown() {
        index.close();
    }

    @Test
    void shouldRankMatchingRecords() {
        index.index(1, "The user likes hiking in the mountains", MemoryType.FACT, 0.8);
        index.index(2, "Shopping list: milk and bread", MemoryType.FACT, 0.8);

        List<SimilarityIndex.Hit> hits = index.search("mountains hiking", 5, null, 0.0);

        assertEquals(1, hits.size());
        assertEquals(1, hits.get(0).recordId());
        assertTrue(hits.get(0).score() > 0 && hits.get(0).score() <= 1.0);
    }

    @Test
    void shouldApplyPrefixMatching() {
        index.index(7, "Booked flights to Lisbon", MemoryType.INTERACTION, 0.7);

        assertEquals(1, index.search("flight", 5, null, 0.0).size());
    }

    @Test
    void shouldFilterByTypeAndImportance() {
        index.index(1, "tea notes", MemoryType.FACT, 0.9);
        index.index(2, "tea chat", MemoryType.CONVERSATION, 0.9);
        index.index(3, "tea trivia", MemoryType.FACT, 0.2);

        assertEquals(3, index.search("tea", 10, null, 0.0).size());
        assertEquals(2, index.search("tea", 10, MemoryType.FACT, 0.0).size());
        List<SimilarityIndex.Hit> hits = index.search("tea", 10, MemoryType.FACT, 0.5);
        assertEquals(1, hits.size());
        assertEquals(1, hits.get(0).recordId());
    }

    @Test
    void shouldBecomeUnavailableAfterClose() {
        assertTrue(index.isAvailable());
        index.close();

        assertFalse(index.isAvailable());
        assertThrows(IllegalStateException.class, () -> index.index(1, "late", MemoryType.FACT, 0.5));
    }

    @Test
    void shouldBuildOrJoinedPrefixQuery() {
        assertEquals("\"hello\"* OR \"world\"*", Fts5SimilarityIndex.buildFtsQuery("hello, world!"));
        assertEquals("\"tea\"*", Fts5SimilarityIndex.buildFtsQuery("  \"tea\"  "));
    }
}
