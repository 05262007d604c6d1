package io.agentmind.core;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The four things a decision can ask for.
 */
public enum ActionType {
    USE_CAPABILITY(false),
    RESPOND(true),
    STORE_MEMORY(false),
    ASK_CLARIFICATION(true);

    private final boolean terminal;

    ActionType(boolean terminal) {
        this.terminal = terminal;
    }

    /** Terminal actions end the loop and produce the user-facing response. */
    public boolean isTerminal() {
        return terminal;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ActionType> fromWireName(String value) {
        if (value == null) return Optional.empty();
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.wireName().equals(normalized))
                .findFirst();
    }
}
