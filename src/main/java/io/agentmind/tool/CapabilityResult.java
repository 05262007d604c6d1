package io.agentmind.tool;

import java.util.Map;

/**
 * Outcome of a capability invocation.
 *
 * @param success  whether the capability completed
 * @param result   the produced value, if any
 * @param error    failure description when {@code success} is false
 * @param metadata extra details for logging
 */
public record CapabilityResult(boolean success, Object result, String error, Map<String, Object> metadata) {

    public CapabilityResult {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static CapabilityResult ok(Object result) {
        return new CapabilityResult(true, result, null, Map.of());
    }

    public static CapabilityResult failure(String error) {
        return new CapabilityResult(false, null, error, Map.of());
    }
}
