package io.agentmind.memory;

/**
 * Raised when the durable record store itself fails.
 */
public class LongTermMemoryException extends RuntimeException {

    public LongTermMemoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
