package io.agentmind.core;

/**
 * Control loop states. One {@code processUserInput} call moves through them in order and
 * returns to {@code IDLE}.
 */
public enum AgentState {
    IDLE,
    OBSERVING,
    DECIDING,
    ACTING,
    REFLECTING
}
