package io.agentmind.memory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Tags text by matching fixed keyword buckets.
 */
public class TagExtractor {

    private static final Map<String, List<String>> BUCKETS = new LinkedHashMap<>();

    static {
        BUCKETS.put("personal", List.of("my name", "i am", "about me", "personal"));
        BUCKETS.put("preference", List.of("i like", "i prefer", "favorite", "don't like"));
        BUCKETS.put("question", List.of("how", "what", "when", "where", "why"));
        BUCKETS.put("help", List.of("help", "assist", "support", "problem"));
        BUCKETS.put("information", List.of("tell me", "explain", "describe", "information"));
        BUCKETS.put("task", List.of("do", "create", "make", "generate", "write"));
    }

    /** Returns the matching bucket names in bucket order. */
    public Set<String> extract(String text) {
        Set<String> tags = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return tags;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        BUCKETS.forEach((tag, keywords) -> {
            if (keywords.stream().anyMatch(lower::contains)) {
                tags.add(tag);
            }
        });
        return tags;
    }
}
