package io.agentmind.core;

import io.agentmind.memory.MemoryAutoSaver;
import io.agentmind.memory.MemoryCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * The observe, decide, act, reflect loop for one session.
 *
 * <p>Each call to {@link #processUserInput} builds one observation, then runs up to
 * {@code maxIterations} decision/action pairs. The first respond or ask_clarification action
 * ends the loop with its result; other actions are carried into the next decision. If the
 * limit is reached without a terminal action, a fixed apology is returned instead.</p>
 *
 * <p>A decision produced because the model failed is returned to the user directly and is
 * not executed.</p>
 */
public class AgentLoop {

    private static final Logger log = LoggerFactory.getLogger(AgentLoop.class);

    static final String INCOMPLETE_RESPONSE = "I apologize, but I couldn't process your request completely.";

    private final MemoryCoordinator memory;
    private final ObservationBuilder observationBuilder;
    private final DecisionEngine decisionEngine;
    private final ActionExecutor actionExecutor;
    private final MemoryAutoSaver autoSaver;
    private final int maxIterations;

    private volatile AgentState state = AgentState.IDLE;
    private volatile int currentIteration;
    private volatile Persona persona;

    public AgentLoop(MemoryCoordinator memory, ObservationBuilder observationBuilder, DecisionEngine decisionEngine,
                     ActionExecutor actionExecutor, MemoryAutoSaver autoSaver, Persona persona, int maxIterations) {
        if (maxIterations < 1) {
            throw new AgentConfigurationException("maxIterations must be at least 1");
        }
        this.memory = memory;
        this.observationBuilder = observationBuilder;
        this.decisionEngine = decisionEngine;
        this.actionExecutor = actionExecutor;
        this.autoSaver = autoSaver;
        this.persona = persona;
        this.maxIterations = maxIterations;
    }

    public String processUserInput(String userInput, Map<String, Object> context) {
        currentIteration = 0;
        try {
            state = AgentState.OBSERVING;
            memory.recordTurn(ChatMessage.Role.USER, userInput, context);
            Observation observation = observationBuilder.build(userInput, context, persona);

            String response = null;
            while (currentIteration < maxIterations) {
                currentIteration++;
                log.debug("Iteration {}/{}", currentIteration, maxIterations);

                state = AgentState.DECIDING;
                Decision decision = decisionEngine.decide(observation);
                if (decision instanceof Decision.Fallback fallback && fallback.cause() == Decision.Cause.MODEL_FAILURE) {
                    response = fallback.message();
                    break;
                }

                state = AgentState.ACTING;
                Action action = actionExecutor.execute(decision);
                log.debug("Action {} finished (success={}) in {} ms", action.actionType().wireName(),
                        action.success(), action.executionTime().toMillis());
                if (action.actionType().isTerminal()) {
                    response = action.result();
                    break;
                }
                observation = observation.withLastAction(action, currentIteration);
            }

            if (response == null) {
                log.warn("Max iterations ({}) reached without a response", maxIterations);
                response = INCOMPLETE_RESPONSE;
            }

            state = AgentState.REFLECTING;
            reflect(userInput, response);
            return response;
        } finally {
            state = AgentState.IDLE;
        }
    }

    private void reflect(String userInput, String response) {
        try {
            memory.recordTurn(ChatMessage.Role.ASSISTANT, response, Map.of());
            autoSaver.saveIfDisclosed(userInput, response, persona.wireName());
        } catch (RuntimeException e) {
            log.warn("Reflection failed: {}", e.getMessage());
        }
    }

    public AgentState state() {
        return state;
    }

    public int currentIteration() {
        return currentIteration;
    }

    public int maxIterations() {
        return maxIterations;
    }

    public Persona persona() {
        return persona;
    }

    public void setPersona(Persona persona) {
        this.persona = persona;
    }
}
