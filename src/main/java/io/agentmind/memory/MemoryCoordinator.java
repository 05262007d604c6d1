package io.agentmind.memory;

import io.agentmind.config.AgentProperties;
import io.agentmind.core.ChatMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.stream.Collectors;

/**
 * Composes one session's short-term memory with the shared long-term store.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Recording turns and triggering consolidation once enough new turns have accumulated</li>
 *   <li>Assembling decision-time context with relevant long-term memories injected up front</li>
 *   <li>Promoting important conversation chunks into long-term memory</li>
 * </ul>
 *
 * <p>Consolidation only covers messages recorded since the previous consolidation, so the
 * same turns are never promoted twice while they remain in the buffer.</p>
 */
public class MemoryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MemoryCoordinator.class);
    static final int CONTEXT_MEMORY_LIMIT = 3;
    static final String CONTEXT_HEADER = "Relevant context from previous conversations:";
    static final String PREFERENCE_CONTEXT_PREFIX = "user_pref_";

    private final ShortTermMemory shortTerm;
    private final LongTermMemory longTerm;
    private final AgentProperties.Memory settings;
    private final ImportanceScorer scorer;
    private final ConversationChunker chunker;
    private final TagExtractor tagExtractor;

    private volatile int pendingMessages;

    public MemoryCoordinator(ShortTermMemory shortTerm, LongTermMemory longTerm, AgentProperties.Memory settings) {
        this(shortTerm, longTerm, settings,
                new ImportanceScorer(settings.consolidation()),
                new ConversationChunker(settings.consolidation()),
                new TagExtractor());
    }

    public MemoryCoordinator(ShortTermMemory shortTerm, LongTermMemory longTerm, AgentProperties.Memory settings,
                             ImportanceScorer scorer, ConversationChunker chunker, TagExtractor tagExtractor) {
        this.shortTerm = shortTerm;
        this.longTerm = longTerm;
        this.settings = settings;
        this.scorer = scorer;
        this.chunker = chunker;
        this.tagExtractor = tagExtractor;
    }

    /**
     * Appends a turn to short-term memory. User and assistant turns count towards the
     * consolidation trigger; system turns do not.
     */
    public ChatMessage recordTurn(ChatMessage.Role role, String content, Map<String, Object> metadata) {
        ChatMessage message = new ChatMessage(role, content, Instant.now(), metadata);
        shortTerm.append(message);

        if (role != ChatMessage.Role.SYSTEM) {
            pendingMessages++;
            if (shouldConsolidate()) {
                consolidate();
            }
        }
        return message;
    }

    boolean shouldConsolidate() {
        int threshold = settings.consolidationThreshold();
        return shortTerm.size() >= threshold && pendingMessages >= threshold;
    }

    /**
     * Builds the message list handed to the model: an optional synthetic system message with
     * relevant long-term memories, followed by the full short-term history.
     */
    public List<ChatMessage> assembleContext(boolean includeRelevant) {
        List<ChatMessage> context = new ArrayList<>();

        if (includeRelevant) {
            List<ChatMessage> recent = shortTerm.recent(settings.contextWindow());
            if (!recent.isEmpty()) {
                String query = recent.stream().map(ChatMessage::content).collect(Collectors.joining(" "));
                List<ScoredMemory> relevant = longTerm.search(query, CONTEXT_MEMORY_LIMIT, null, settings.contextMinImportance())
                        .stream()
                        .filter(m -> m.relevance() >= settings.relevanceFloor())
                        .toList();
                if (!relevant.isEmpty()) {
                    StringJoiner text = new StringJoiner("\n- ", CONTEXT_HEADER + "\n- ", "");
                    relevant.forEach(m -> text.add(m.content()));
                    context.add(ChatMessage.system(text.toString()));
                }
            }
        }

        context.addAll(shortTerm.asContext());
        return context;
    }

    /**
     * Promotes messages recorded since the last consolidation into long-term memory.
     * Failures on individual chunks are logged and skipped.
     *
     * @return the number of chunks stored
     */
    public int consolidate() {
        int window = Math.min(pendingMessages, shortTerm.size());
        pendingMessages = 0;
        if (window == 0) {
            return 0;
        }

        List<List<ChatMessage>> chunks = chunker.chunk(shortTerm.recent(window));
        int stored = 0;
        for (List<ChatMessage> chunk : chunks) {
            try {
                double importance = scorer.score(chunk);
                if (!scorer.shouldPersist(importance)) {
                    log.trace("Discarding chunk of {} messages (importance {})", chunk.size(), importance);
                    continue;
                }
                String content = chunk.stream()
                        .map(ChatMessage::toTranscriptLine)
                        .collect(Collectors.joining("\n"));
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("message_count", chunk.size());
                metadata.put("consolidated_at", Instant.now().toString());
                longTerm.store(content, MemoryType.CONVERSATION, importance, tagExtractor.extract(content), metadata);
                stored++;
            } catch (RuntimeException e) {
                log.warn("Skipping conversation chunk during consolidation: {}", e.getMessage());
            }
        }

        log.debug("Consolidated {} of {} chunks from {} messages", stored, chunks.size(), window);
        return stored;
    }

    public StoredMemory storeLongTerm(String content, MemoryType type, double importance,
                                      Collection<String> tags, Map<String, Object> metadata) {
        return longTerm.store(content, type, importance, tags, metadata);
    }

    public List<ScoredMemory> searchMemories(String query, int limit) {
        return longTerm.search(query, limit, null, 0.0);
    }

    public List<ScoredMemory> searchMemories(String query, int limit, MemoryType type, double minImportance) {
        return longTerm.search(query, limit, type, minImportance);
    }

    /** Stores a preference durably and mirrors it into the session context. */
    public void storePreference(String key, String value) {
        longTerm.setPreference(key, value);
        shortTerm.putContext(PREFERENCE_CONTEXT_PREFIX + key, value);
    }

    public Optional<String> getPreference(String key) {
        return longTerm.getPreference(key).map(Preference::value);
    }

    public long storeFact(String content, String category, double confidence, String source) {
        return longTerm.storeFact(content, category, confidence, source);
    }

    public void clearShortTerm() {
        shortTerm.clear();
        pendingMessages = 0;
    }

    public ShortTermMemory shortTerm() {
        return shortTerm;
    }

    public LongTermMemory longTerm() {
        return longTerm;
    }

    public MemorySummary summary() {
        return new MemorySummary(shortTerm.summary(), longTerm.stats(),
                settings.consolidationThreshold(), pendingMessages);
    }

    /**
     * Combined view of both memory layers.
     */
    public record MemorySummary(ShortTermMemory.Summary shortTerm, MemoryStats longTerm,
                                int consolidationThreshold, int pendingMessages) {}
}
