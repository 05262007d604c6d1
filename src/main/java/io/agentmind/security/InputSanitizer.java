package io.agentmind.security;

/**
 * Cleans user messages before they reach the agent loop.
 * Removes control characters and truncates overly long input.
 */
public class InputSanitizer {

    public static final int DEFAULT_MAX_LENGTH = 32_000;
    static final String TRUNCATION_MARKER = "... [truncated]";

    private final int maxLength;

    public InputSanitizer() {
        this(DEFAULT_MAX_LENGTH);
    }

    public InputSanitizer(int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
        }
        this.maxLength = maxLength;
    }

    /**
     * @param content the raw message content
     * @return sanitized content, never null
     */
    public String sanitize(String content) {
        if (content == null) return "";

        // Keep newlines and tabs
        String cleaned = content.replaceAll("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]", "").strip();

        if (cleaned.length() > maxLength) {
            cleaned = cleaned.substring(0, maxLength) + TRUNCATION_MARKER;
        }
        return cleaned;
    }
}
