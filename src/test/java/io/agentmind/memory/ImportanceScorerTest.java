package io.agentmind.memory;

import io.agentmind.config.AgentProperties;
import io.agentmind.core.ChatMessage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ImportanceScorerTest {

    private final ImportanceScorer scorer = new ImportanceScorer();

    @Test
    void shouldScorePlainShortChunkAtBaseAndNotPersist() {
        List<ChatMessage> chunk = List.of(
                ChatMessage.user("Hello there"),
                ChatMessage.assistant("Hi, nice to see you"));

        double score = scorer.score(chunk);

        assertEquals(0.5, score, 1e-9);
        assertFalse(scorer.shouldPersist(score));
    }

    @Test
    void shouldPersistChunkWithNameDisclosure() {
        List<ChatMessage> chunk = List.of(
                ChatMessage.user("Hi, my name is Ana"),
                ChatMessage.assistant("Nice to meet you, Ana"));

        double score = scorer.score(chunk);

        assertTrue(score >= 0.7 - 1e-9);
        assertTrue(scorer.shouldPersist(score));
    }

    @Test
    void shouldAddQuestionBonus() {
        assertEquals(0.6, scorer.score(List.of(ChatMessage.user("Can you book a table"))), 1e-9);
    }

    @Test
    void shouldAddLengthBonusAboveThreeMessages() {
        List<ChatMessage> chunk = List.of(
                ChatMessage.user("ok"), ChatMessage.assistant("fine"),
                ChatMessage.user("sure"), ChatMessage.assistant("good"));
        assertEquals(0.6, scorer.score(chunk), 1e-9);
    }

    @Test
    void shouldAddVerbosityBonusForLongMessages() {
        String longText = "x".repeat(150);
        assertEquals(0.6, scorer.score(List.of(ChatMessage.user(longText))), 1e-9);
    }

    @Test
    void shouldCapScoreAtOne() {
        String longText = "Why do I prefer tea? My name is Bo and I like it. " + "y".repeat(120);
        List<ChatMessage> chunk = List.of(
                ChatMessage.user(longText), ChatMessage.assistant(longText),
                ChatMessage.user(longText), ChatMessage.assistant(longText));

        assertEquals(1.0, scorer.score(chunk), 1e-9);
    }

    @Test
    void shouldUseConfiguredWeights() {
        AgentProperties.Consolidation weights = new AgentProperties.Consolidation(
                0.2, null, null, null, 0.5, null, null, 0.6, null, null);
        ImportanceScorer custom = new ImportanceScorer(weights);

        double score = custom.score(List.of(ChatMessage.user("remember my birthday")));

        assertEquals(0.7, score, 1e-9);
        assertTrue(custom.shouldPersist(score));
        assertFalse(custom.shouldPersist(0.6));
    }

    @Test
    void shouldScoreEmptyChunkAsZero() {
        assertEquals(0.0, scorer.score(List.of()), 1e-9);
    }
}
