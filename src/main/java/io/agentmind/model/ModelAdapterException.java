package io.agentmind.model;

/**
 * Raised when the model could not produce text.
 * {@link #isRecoverable()} is false for failures that retrying will not fix, such as bad credentials.
 */
public class ModelAdapterException extends RuntimeException {

    private final boolean recoverable;

    public ModelAdapterException(String message, boolean recoverable) {
        super(message);
        this.recoverable = recoverable;
    }

    public ModelAdapterException(String message, boolean recoverable, Throwable cause) {
        super(message, cause);
        this.recoverable = recoverable;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
