package io.agentmind.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentmind.memory.MemoryCoordinator;
import io.agentmind.memory.StoredMemory;
import io.agentmind.model.ModelAdapter;
import io.agentmind.model.ModelAdapterException;
import io.agentmind.tool.CapabilityRegistry;
import io.agentmind.tool.CapabilityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Carries out a decision. Never throws: every failure becomes an unsuccessful {@link Action}.
 */
public class ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(ActionExecutor.class);

    static final String DEFAULT_CLARIFICATION = "Could you please provide more details?";
    static final String SYNTHESIS_APOLOGY =
            "I apologize, but I'm unable to generate a response right now. Please try again in a moment.";
    static final String STORED_TAG = "agent_stored";

    private final CapabilityRegistry capabilities;
    private final MemoryCoordinator memory;
    private final ModelAdapter modelAdapter;
    private final ObjectMapper objectMapper;
    private final int minResponseLength;

    public ActionExecutor(CapabilityRegistry capabilities, MemoryCoordinator memory, ModelAdapter modelAdapter,
                          ObjectMapper objectMapper, int minResponseLength) {
        this.capabilities = capabilities;
        this.memory = memory;
        this.modelAdapter = modelAdapter;
        this.objectMapper = objectMapper;
        this.minResponseLength = minResponseLength;
    }

    public Action execute(Decision decision) {
        Instant started = Instant.now();
        ActionType type = decision.actionType();
        Map<String, Object> parameters = decision.details();
        try {
            if (decision instanceof Decision.UseCapability use) {
                return useCapability(use, started);
            } else if (decision instanceof Decision.Respond respond) {
                return respond(respond.message(), parameters, started);
            } else if (decision instanceof Decision.Fallback fallback) {
                return respond(fallback.message(), parameters, started);
            } else if (decision instanceof Decision.StoreMemory store) {
                return storeMemory(store, started);
            } else if (decision instanceof Decision.AskClarification ask) {
                String question = ask.question() == null || ask.question().isBlank() ? DEFAULT_CLARIFICATION : ask.question();
                return Action.completed(type, parameters, question, started);
            }
            return Action.failed(type, parameters, "Unknown action type", started);
        } catch (Exception e) {
            log.error("Action {} failed: {}", type.wireName(), e.getMessage(), e);
            return Action.failed(type, parameters, "Action failed: " + e.getMessage(), started);
        }
    }

    private Action useCapability(Decision.UseCapability use, Instant started) {
        log.debug("Invoking capability '{}'", use.capabilityName());
        CapabilityResult result = capabilities.invoke(use.capabilityName(), use.parameters());
        if (!result.success()) {
            return Action.failed(ActionType.USE_CAPABILITY, use.details(), result.error(), started);
        }
        return Action.completed(ActionType.USE_CAPABILITY, use.details(), render(result.result()), started);
    }

    private Action respond(String message, Map<String, Object> parameters, Instant started) {
        if (message != null && message.strip().length() >= minResponseLength) {
            return Action.completed(ActionType.RESPOND, parameters, message, started);
        }

        log.debug("Response too short, synthesizing from conversation context");
        try {
            String synthesized = modelAdapter.generate(memory.assembleContext(true));
            return Action.completed(ActionType.RESPOND, parameters, synthesized, started);
        } catch (ModelAdapterException e) {
            log.warn("Response synthesis failed: {}", e.getMessage());
            return Action.failed(ActionType.RESPOND, parameters, SYNTHESIS_APOLOGY, started);
        }
    }

    private Action storeMemory(Decision.StoreMemory store, Instant started) {
        if (store.content().isBlank()) {
            return Action.failed(ActionType.STORE_MEMORY, store.details(), "Nothing to store: 'content' is empty", started);
        }
        StoredMemory stored = memory.storeLongTerm(store.content(), store.memoryType(), store.importance(),
                List.of(STORED_TAG, store.memoryType().wireName()), Map.of("reasoning", String.valueOf(store.reasoning())));
        String result = "Stored important information with ID: " + stored.id();
        if (!stored.indexed()) {
            result += " (not yet searchable)";
        }
        return Action.completed(ActionType.STORE_MEMORY, store.details(), result, started);
    }

    private String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return value.toString();
            }
        }
        return value.toString();
    }
}
