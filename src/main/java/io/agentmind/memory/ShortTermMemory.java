package io.agentmind.memory;

import io.agentmind.core.ChatMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Session-scoped buffer of recent conversation turns plus a small keyed context map.
 *
 * <p>Key behaviors:</p>
 * <ul>
 *   <li>Holds at most {@code capacity} messages; the oldest is evicted on overflow</li>
 *   <li>Preserves arrival order</li>
 *   <li>Not thread-safe: a session drives it from a single pipeline. Only
 *       {@link #summary()} may be read from other threads; it returns the state as of
 *       the last mutation</li>
 * </ul>
 */
public class ShortTermMemory {

    private static final Logger log = LoggerFactory.getLogger(ShortTermMemory.class);
    public static final int DEFAULT_CAPACITY = 20;

    private final Deque<ChatMessage> messages = new ArrayDeque<>();
    private final Map<String, Object> context = new LinkedHashMap<>();
    private final int capacity;
    private final Clock clock;
    private volatile Instant sessionStart;
    private volatile Summary snapshot;

    public ShortTermMemory() {
        this(DEFAULT_CAPACITY);
    }

    public ShortTermMemory(int capacity) {
        this(capacity, Clock.systemUTC());
    }

    public ShortTermMemory(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.clock = clock;
        this.sessionStart = clock.instant();
        refreshSnapshot();
    }

    public void append(ChatMessage message) {
        messages.addLast(message);
        while (messages.size() > capacity) {
            ChatMessage evicted = messages.removeFirst();
            log.trace("Evicted {} message from short-term memory", evicted.role());
        }
        refreshSnapshot();
    }

    /** Returns the last {@code n} messages in arrival order. */
    public List<ChatMessage> recent(int n) {
        if (n <= 0 || messages.isEmpty()) {
            return List.of();
        }
        List<ChatMessage> all = new ArrayList<>(messages);
        return List.copyOf(all.subList(Math.max(0, all.size() - n), all.size()));
    }

    public List<ChatMessage> messages() {
        return List.copyOf(messages);
    }

    /** The whole buffer as role/content pairs, without caller metadata. */
    public List<ChatMessage> asContext() {
        List<ChatMessage> result = new ArrayList<>(messages.size());
        for (ChatMessage message : messages) {
            result.add(new ChatMessage(message.role(), message.content(), message.timestamp(), Map.of()));
        }
        return result;
    }

    public int size() {
        return messages.size();
    }

    public int capacity() {
        return capacity;
    }

    public void putContext(String key, Object value) {
        context.put(key, value);
        refreshSnapshot();
    }

    public Optional<Object> getContext(String key) {
        return Optional.ofNullable(context.get(key));
    }

    public Map<String, Object> context() {
        return Collections.unmodifiableMap(context);
    }

    /** Empties the buffer and the context map and restarts the session clock. */
    public void clear() {
        messages.clear();
        context.clear();
        sessionStart = clock.instant();
        refreshSnapshot();
        log.debug("Short-term memory cleared");
    }

    public Duration sessionDuration() {
        return Duration.between(sessionStart, clock.instant());
    }

    public Summary summary() {
        Summary current = snapshot;
        return new Summary(current.messageCount(), capacity, current.contextKeys(),
                Duration.between(current.sessionStart(), clock.instant()), current.sessionStart());
    }

    private void refreshSnapshot() {
        snapshot = new Summary(messages.size(), capacity, Set.copyOf(context.keySet()), Duration.ZERO, sessionStart);
    }

    /**
     * Snapshot of the buffer state.
     */
    public record Summary(int messageCount, int capacity, Set<String> contextKeys,
                          Duration sessionDuration, Instant sessionStart) {}
}
