package io.agentmind.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Saves exchanges in which the user disclosed something about themselves.
 *
 * <p>Runs after each response, independently of chunk consolidation: when the user's
 * message carries a personal-disclosure cue, a {@code "User: ...\nAssistant: ..."} summary
 * is written to long-term memory as an {@link MemoryType#INTERACTION} record.</p>
 */
public class MemoryAutoSaver {

    private static final Logger log = LoggerFactory.getLogger(MemoryAutoSaver.class);

    static final List<String> DISCLOSURE_CUES =
            List.of("my name", "i am", "i like", "i prefer", "remember", "important");
    static final String INTERACTION_TAG = "user_interaction";

    private final MemoryCoordinator memory;
    private final double importance;

    public MemoryAutoSaver(MemoryCoordinator memory, double importance) {
        this.memory = memory;
        this.importance = importance;
    }

    public boolean containsDisclosure(String userInput) {
        if (userInput == null || userInput.isBlank()) return false;
        String lower = userInput.toLowerCase(Locale.ROOT);
        return DISCLOSURE_CUES.stream().anyMatch(lower::contains);
    }

    /**
     * Stores the exchange if the user input carries a disclosure cue.
     *
     * @param persona persona name, added as a tag
     * @return the stored record, or empty when nothing qualified
     */
    public Optional<StoredMemory> saveIfDisclosed(String userInput, String response, String persona) {
        if (!containsDisclosure(userInput)) {
            return Optional.empty();
        }
        String summary = "User: " + userInput + "\nAssistant: " + response;
        StoredMemory stored = memory.storeLongTerm(summary, MemoryType.INTERACTION, importance,
                List.of(INTERACTION_TAG, persona), Map.of());
        log.debug("Auto-saved interaction as memory {}", stored.id());
        return Optional.of(stored);
    }
}
