package io.agentmind.core;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Named behavioral configurations that shape the system prompt.
 */
public enum Persona {

    PERSONAL("""
            You are a warm, attentive personal assistant. You help with everyday questions,
            planning and reminders, and you remember what the user tells you about themselves.
            Keep answers friendly and concise, and ask when something is unclear.
            Current time: %s"""),

    RESEARCH("""
            You are a careful research assistant. You gather information, compare sources,
            separate facts from assumptions and say how confident you are.
            Structure longer answers with short sections and cite the capability results you used.
            Current time: %s"""),

    TECHNICAL("""
            You are a precise technical assistant for software and systems questions.
            Prefer concrete steps, exact commands and small code examples over general advice,
            and point out risks before suggesting changes.
            Current time: %s""");

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String template;

    Persona(String template) {
        this.template = template;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String systemPrompt(LocalDateTime now) {
        return template.formatted(now.format(TIME_FORMAT));
    }

    /**
     * @throws AgentConfigurationException for unknown persona names
     */
    public static Persona fromString(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (Persona persona : values()) {
                if (persona.wireName().equals(normalized)) {
                    return persona;
                }
            }
        }
        throw new AgentConfigurationException("Unknown persona '%s'. Available: %s".formatted(name,
                Arrays.stream(values()).map(Persona::wireName).collect(Collectors.joining(", "))));
    }
}
