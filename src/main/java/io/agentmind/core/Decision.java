package io.agentmind.core;

import io.agentmind.memory.MemoryRecord;
import io.agentmind.memory.MemoryType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the model decided to do in one iteration.
 *
 * <p>{@link Fallback} covers model output that named no valid action and model failures;
 * it behaves like {@link Respond}.</p>
 */
public sealed interface Decision permits Decision.Respond, Decision.UseCapability, Decision.StoreMemory,
        Decision.AskClarification, Decision.Fallback {

    ActionType actionType();

    /** The decoded details payload as the model sent it. */
    Map<String, Object> details();

    String reasoning();

    /** Model confidence, always within [0,1]. */
    double confidence();

    Instant timestamp();

    record Respond(String message, Map<String, Object> details, String reasoning, double confidence,
                   Instant timestamp) implements Decision {
        public Respond {
            details = copy(details);
            confidence = MemoryRecord.clamp(confidence);
        }

        @Override
        public ActionType actionType() {
            return ActionType.RESPOND;
        }
    }

    record UseCapability(String capabilityName, Map<String, Object> parameters, Map<String, Object> details,
                         String reasoning, double confidence, Instant timestamp) implements Decision {
        public UseCapability {
            parameters = copy(parameters);
            details = copy(details);
            confidence = MemoryRecord.clamp(confidence);
        }

        @Override
        public ActionType actionType() {
            return ActionType.USE_CAPABILITY;
        }
    }

    record StoreMemory(String content, MemoryType memoryType, double importance, Map<String, Object> details,
                       String reasoning, double confidence, Instant timestamp) implements Decision {
        public StoreMemory {
            importance = MemoryRecord.clamp(importance);
            details = copy(details);
            confidence = MemoryRecord.clamp(confidence);
        }

        @Override
        public ActionType actionType() {
            return ActionType.STORE_MEMORY;
        }
    }

    record AskClarification(String question, Map<String, Object> details, String reasoning, double confidence,
                            Instant timestamp) implements Decision {
        public AskClarification {
            details = copy(details);
            confidence = MemoryRecord.clamp(confidence);
        }

        @Override
        public ActionType actionType() {
            return ActionType.ASK_CLARIFICATION;
        }
    }

    /**
     * Stand-in decision: responds with {@code message}.
     */
    record Fallback(Cause cause, String message, Map<String, Object> details, String reasoning, double confidence,
                    Instant timestamp) implements Decision {
        public Fallback {
            details = copy(details);
            confidence = MemoryRecord.clamp(confidence);
        }

        @Override
        public ActionType actionType() {
            return ActionType.RESPOND;
        }
    }

    enum Cause {
        /** The model named an action outside the four known types. */
        UNRECOGNIZED_ACTION,
        /** The model adapter failed; nothing should be executed. */
        MODEL_FAILURE
    }

    private static Map<String, Object> copy(Map<String, Object> map) {
        return map == null || map.isEmpty() ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
