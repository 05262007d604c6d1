package io.agentmind.core;

/**
 * Invalid agent configuration, such as an unknown persona or model provider.
 * Raised at construction time; the agent is not created.
 */
public class AgentConfigurationException extends RuntimeException {

    public AgentConfigurationException(String message) {
        super(message);
    }
}
