package io.agentmind.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentmind.memory.MemoryType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Decodes model output in the labeled-line decision format.
 *
 * <pre>
 * ACTION_TYPE: use_capability
 * REASONING: the user asked for a calculation
 * DETAILS: {"tool_name": "calculator", "parameters": {"expression": "2+2"}}
 * CONFIDENCE: 0.9
 * </pre>
 *
 * <p>Parsing never fails. Missing lines keep their defaults, a DETAILS value that is not a
 * JSON object becomes {@code {"message": <value>}}, non-numeric confidence is ignored, and an
 * unknown action type yields a {@link Decision.Fallback} carrying the whole output.</p>
 */
public class DecisionParser {

    private static final Logger log = LoggerFactory.getLogger(DecisionParser.class);
    private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<>() {};

    public static final int SCHEMA_VERSION = 1;

    static final String ACTION_TYPE = "ACTION_TYPE:";
    static final String REASONING = "REASONING:";
    static final String DETAILS = "DETAILS:";
    static final String CONFIDENCE = "CONFIDENCE:";

    static final String DEFAULT_MESSAGE = "I need more information to help you.";
    static final String DEFAULT_REASONING = "Default fallback decision";
    static final double DEFAULT_CONFIDENCE = 0.5;
    static final double DEFAULT_IMPORTANCE = 0.7;

    private final ObjectMapper objectMapper;

    public DecisionParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Decision parse(String output) {
        String raw = output == null ? "" : output;
        String actionType = ActionType.RESPOND.wireName();
        Map<String, Object> details = Map.of("message", DEFAULT_MESSAGE);
        String reasoning = DEFAULT_REASONING;
        double confidence = DEFAULT_CONFIDENCE;

        String[] lines = raw.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.startsWith(ACTION_TYPE)) {
                actionType = valueOf(line, ACTION_TYPE);
            } else if (line.startsWith(REASONING)) {
                reasoning = valueOf(line, REASONING);
            } else if (line.startsWith(DETAILS)) {
                String value = valueOf(line, DETAILS);
                // JSON may continue over the following lines until the next label
                int end = i;
                StringBuilder json = new StringBuilder(value);
                Optional<Map<String, Object>> parsed = parseDetails(value);
                while (parsed.isEmpty() && value.startsWith("{") && end + 1 < lines.length && !isLabel(lines[end + 1])) {
                    end++;
                    json.append('\n').append(lines[end]);
                    parsed = parseDetails(json.toString());
                }
                if (parsed.isPresent()) {
                    details = parsed.get();
                    i = end;
                } else {
                    details = Map.of("message", value);
                }
            } else if (line.startsWith(CONFIDENCE)) {
                confidence = parseConfidence(valueOf(line, CONFIDENCE), confidence);
            }
        }

        Instant now = Instant.now();
        Optional<ActionType> type = ActionType.fromWireName(actionType);
        if (type.isEmpty()) {
            log.debug("Unrecognized action type '{}', treating output as a response", actionType);
            return new Decision.Fallback(Decision.Cause.UNRECOGNIZED_ACTION, raw,
                    Map.of("message", raw), reasoning, confidence, now);
        }

        return switch (type.get()) {
            case RESPOND -> new Decision.Respond(stringValue(details, "message"), details, reasoning, confidence, now);
            case USE_CAPABILITY -> new Decision.UseCapability(capabilityName(details), parameters(details),
                    details, reasoning, confidence, now);
            case STORE_MEMORY -> new Decision.StoreMemory(
                    Optional.ofNullable(stringValue(details, "content")).orElse(""),
                    MemoryType.fromString(stringValue(details, "memory_type")),
                    numberValue(details.get("importance"), DEFAULT_IMPORTANCE),
                    details, reasoning, confidence, now);
            case ASK_CLARIFICATION -> new Decision.AskClarification(
                    Optional.ofNullable(stringValue(details, "question")).orElse(stringValue(details, "message")),
                    details, reasoning, confidence, now);
        };
    }

    private Optional<Map<String, Object>> parseDetails(String value) {
        if (value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(value, DETAILS_TYPE));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private static boolean isLabel(String line) {
        String trimmed = line.trim();
        return trimmed.startsWith(ACTION_TYPE) || trimmed.startsWith(REASONING)
                || trimmed.startsWith(DETAILS) || trimmed.startsWith(CONFIDENCE);
    }

    private static String valueOf(String line, String label) {
        return line.substring(label.length()).trim();
    }

    private static double parseConfidence(String value, double current) {
        try {
            double parsed = Double.parseDouble(value);
            if (Double.isNaN(parsed)) {
                return current;
            }
            return Math.max(0.0, Math.min(1.0, parsed));
        } catch (NumberFormatException e) {
            return current;
        }
    }

    private static String capabilityName(Map<String, Object> details) {
        String name = stringValue(details, "tool_name");
        return name != null ? name : stringValue(details, "capability_name");
    }

    private static Map<String, Object> parameters(Map<String, Object> details) {
        Object parameters = details.get("parameters");
        if (parameters instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((k, v) -> result.put(String.valueOf(k), v));
            return result;
        }
        return Map.of();
    }

    private static String stringValue(Map<String, Object> details, String key) {
        Object value = details.get(key);
        return value != null ? value.toString() : null;
    }

    private static double numberValue(Object value, double defaultValue) {
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }
}
