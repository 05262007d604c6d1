package io.agentmind.memory;

import io.agentmind.config.AgentProperties;
import io.agentmind.core.ChatMessage;

import java.util.List;
import java.util.Locale;

/**
 * Heuristic importance of a conversation chunk, in [0,1].
 */
public class ImportanceScorer {

    static final List<String> QUESTION_CUES = List.of("how", "what", "when", "where", "why", "can you", "help me");
    static final List<String> PERSONAL_CUES = List.of("my name", "i am", "i like", "i prefer", "remember");

    private final AgentProperties.Consolidation weights;

    public ImportanceScorer() {
        this(AgentProperties.Consolidation.defaults());
    }

    public ImportanceScorer(AgentProperties.Consolidation weights) {
        this.weights = weights;
    }

    public double score(List<ChatMessage> chunk) {
        if (chunk == null || chunk.isEmpty()) {
            return 0.0;
        }

        double score = weights.baseScore();

        if (chunk.size() > weights.lengthBonusMinMessages()) {
            score += weights.lengthBonus();
        }
        if (anyContains(chunk, QUESTION_CUES)) {
            score += weights.questionBonus();
        }
        if (anyContains(chunk, PERSONAL_CUES)) {
            score += weights.personalBonus();
        }

        double averageLength = chunk.stream().mapToInt(m -> m.content().length()).average().orElse(0);
        if (averageLength > weights.verbosityMinAverageChars()) {
            score += weights.verbosityBonus();
        }

        return MemoryRecord.clamp(score);
    }

    /** Chunks must score strictly above the threshold to be persisted. */
    public boolean shouldPersist(double score) {
        return score > weights.persistThreshold();
    }

    private static boolean anyContains(List<ChatMessage> chunk, List<String> cues) {
        for (ChatMessage message : chunk) {
            String lower = message.content().toLowerCase(Locale.ROOT);
            for (String cue : cues) {
                if (lower.contains(cue)) {
                    return true;
                }
            }
        }
        return false;
    }
}
