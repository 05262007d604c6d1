package io.agentmind.core;

import io.agentmind.model.ModelAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Asks the model what to do next and decodes the answer.
 *
 * <p>Never throws. A failing model call yields a {@link Decision.Fallback} with cause
 * {@link Decision.Cause#MODEL_FAILURE}.</p>
 */
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    static final String MODEL_FAILURE_MESSAGE = "I'm having trouble processing your request. Could you please rephrase it?";
    static final String MODEL_FAILURE_REASONING = "Error in decision making process";
    static final double MODEL_FAILURE_CONFIDENCE = 0.3;

    private final ModelAdapter modelAdapter;
    private final SystemPromptBuilder promptBuilder;
    private final DecisionParser parser;

    public DecisionEngine(ModelAdapter modelAdapter, SystemPromptBuilder promptBuilder, DecisionParser parser) {
        this.modelAdapter = modelAdapter;
        this.promptBuilder = promptBuilder;
        this.parser = parser;
    }

    public Decision decide(Observation observation) {
        List<ChatMessage> messages = List.of(
                ChatMessage.system(promptBuilder.buildDecisionPrompt(observation)),
                ChatMessage.user(observation.userInput()));

        String output;
        try {
            output = modelAdapter.generate(messages);
        } catch (Exception e) {
            log.error("Decision request failed: {}", e.getMessage());
            return new Decision.Fallback(Decision.Cause.MODEL_FAILURE, MODEL_FAILURE_MESSAGE,
                    Map.of("message", MODEL_FAILURE_MESSAGE), MODEL_FAILURE_REASONING, MODEL_FAILURE_CONFIDENCE,
                    Instant.now());
        }

        Decision decision = parser.parse(output);
        log.debug("Decision: {} (confidence {}) - {}", decision.actionType().wireName(),
                decision.confidence(), decision.reasoning());
        return decision;
    }
}
