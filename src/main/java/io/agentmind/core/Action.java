package io.agentmind.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * The executed effect of a decision.
 *
 * @param actionType    what was done
 * @param parameters    the decision details the action ran with
 * @param result        response text, capability output or failure description
 * @param success       whether the action completed
 * @param timestamp     when execution started
 * @param executionTime how long execution took
 */
public record Action(
        ActionType actionType,
        Map<String, Object> parameters,
        String result,
        boolean success,
        Instant timestamp,
        Duration executionTime
) {
    public Action {
        parameters = parameters == null ? Map.of() : parameters;
    }

    static Action completed(ActionType type, Map<String, Object> parameters, String result, Instant started) {
        return new Action(type, parameters, result, true, started, Duration.between(started, Instant.now()));
    }

    static Action failed(ActionType type, Map<String, Object> parameters, String result, Instant started) {
        return new Action(type, parameters, result, false, started, Duration.between(started, Instant.now()));
    }
}
