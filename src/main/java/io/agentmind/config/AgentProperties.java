package io.agentmind.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Agent configuration, bound from {@code agent.*}.
 *
 * <p>Example:</p>
 * <pre>
 * agent:
 *   name: PersonalAssistant
 *   model: openai:gpt-4o
 *   persona: personal
 *   loop:
 *     max-iterations: 10
 *   memory:
 *     path: ./data/memory
 *     short-term-capacity: 20
 *     consolidation:
 *       persist-threshold: 0.5
 * </pre>
 */
@ConfigurationProperties(prefix = "agent")
public record AgentProperties(
        String name,
        String model,
        String persona,
        Integer maxTokens,
        Double temperature,
        Integer maxInputLength,
        Loop loop,
        Memory memory
) {
    public AgentProperties {
        if (name == null || name.isBlank()) name = "PersonalAssistant";
        if (model == null || model.isBlank()) model = "openai:gpt-4o";
        if (persona == null || persona.isBlank()) persona = "personal";
        if (maxTokens == null) maxTokens = 2000;
        if (temperature == null) temperature = 0.7;
        if (maxInputLength == null) maxInputLength = 32_000;
        if (loop == null) loop = new Loop(null, null, null);
        if (memory == null) memory = new Memory(null, null, null, null, null, null, null, null, null);
    }

    public static AgentProperties defaults() {
        return new AgentProperties(null, null, null, null, null, null, null, null);
    }

    /**
     * Control loop settings.
     *
     * @param maxIterations        decision/action pairs allowed per user input
     * @param minResponseLength    shorter respond messages are re-synthesized by the model
     * @param relevantMemoryLimit  memories retrieved for each observation
     */
    public record Loop(Integer maxIterations, Integer minResponseLength, Integer relevantMemoryLimit) {
        public Loop {
            if (maxIterations == null) maxIterations = 10;
            if (minResponseLength == null) minResponseLength = 10;
            if (relevantMemoryLimit == null) relevantMemoryLimit = 3;
            if (maxIterations < 1) {
                throw new IllegalArgumentException("agent.loop.max-iterations must be at least 1");
            }
        }
    }

    /**
     * Memory settings.
     *
     * @param path                     directory holding the SQLite database
     * @param index                    similarity index: {@code fts} or {@code vector}
     * @param shortTermCapacity        messages kept in short-term memory
     * @param consolidationThreshold   buffered messages that trigger consolidation
     * @param contextWindow            recent messages used as the retrieval query
     * @param contextMinImportance     lowest importance injected into the context
     * @param relevanceFloor           lowest relevance injected into the context or prompt
     * @param interactionImportance    importance of interaction summaries written on reflection
     * @param consolidation            chunk scoring weights
     */
    public record Memory(
            String path,
            String index,
            Integer shortTermCapacity,
            Integer consolidationThreshold,
            Integer contextWindow,
            Double contextMinImportance,
            Double relevanceFloor,
            Double interactionImportance,
            Consolidation consolidation
    ) {
        public Memory {
            if (path == null || path.isBlank()) path = "./data/memory";
            if (index == null || index.isBlank()) index = "fts";
            if (shortTermCapacity == null) shortTermCapacity = 20;
            if (consolidationThreshold == null) consolidationThreshold = 10;
            if (contextWindow == null) contextWindow = 3;
            if (contextMinImportance == null) contextMinImportance = 0.6;
            if (relevanceFloor == null) relevanceFloor = 0.1;
            if (interactionImportance == null) interactionImportance = 0.7;
            if (consolidation == null) consolidation = new Consolidation(null, null, null, null, null, null, null, null, null, null);
        }
    }

    /**
     * Importance heuristic applied to conversation chunks during consolidation.
     *
     * @param baseScore              starting score of every chunk
     * @param lengthBonus            added when the chunk has more than {@code lengthBonusMinMessages} messages
     * @param lengthBonusMinMessages message count that must be exceeded for the length bonus
     * @param questionBonus          added when any message contains a question cue
     * @param personalBonus          added when any message contains a personal-disclosure cue
     * @param verbosityBonus         added when the average message exceeds {@code verbosityMinAverageChars}
     * @param verbosityMinAverageChars average length that must be exceeded for the verbosity bonus
     * @param persistThreshold       chunks must score strictly above this to be stored
     * @param maxChunkSize           hard chunk length limit
     * @param minAssistantChunkSize  a chunk ending in an assistant turn closes once it has this many messages
     */
    public record Consolidation(
            Double baseScore,
            Double lengthBonus,
            Integer lengthBonusMinMessages,
            Double questionBonus,
            Double personalBonus,
            Double verbosityBonus,
            Integer verbosityMinAverageChars,
            Double persistThreshold,
            Integer maxChunkSize,
            Integer minAssistantChunkSize
    ) {
        public Consolidation {
            if (baseScore == null) baseScore = 0.5;
            if (lengthBonus == null) lengthBonus = 0.1;
            if (lengthBonusMinMessages == null) lengthBonusMinMessages = 3;
            if (questionBonus == null) questionBonus = 0.1;
            if (personalBonus == null) personalBonus = 0.2;
            if (verbosityBonus == null) verbosityBonus = 0.1;
            if (verbosityMinAverageChars == null) verbosityMinAverageChars = 100;
            if (persistThreshold == null) persistThreshold = 0.5;
            if (maxChunkSize == null) maxChunkSize = 5;
            if (minAssistantChunkSize == null) minAssistantChunkSize = 2;
        }

        public static Consolidation defaults() {
            return new Consolidation(null, null, null, null, null, null, null, null, null, null);
        }
    }
}
