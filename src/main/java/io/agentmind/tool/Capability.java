package io.agentmind.tool;

import java.util.Map;

/**
 * A named operation the agent may invoke through a {@code use_capability} decision.
 */
public interface Capability {

    String name();

    String description();

    /** JSON Schema describing the accepted parameters. */
    String parameterSchema();

    CapabilityResult invoke(Map<String, Object> parameters);

    /**
     * Creates a capability from a function.
     */
    static Capability of(String name, String description, String parameterSchema, Handler handler) {
        return new Capability() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public String description() {
                return description;
            }

            @Override
            public String parameterSchema() {
                return parameterSchema;
            }

            @Override
            public CapabilityResult invoke(Map<String, Object> parameters) {
                return handler.invoke(parameters);
            }
        };
    }

    @FunctionalInterface
    interface Handler {
        CapabilityResult invoke(Map<String, Object> parameters);
    }
}
