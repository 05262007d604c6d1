package io.agentmind.core;

import io.agentmind.memory.ScoredMemory;
import io.agentmind.memory.ShortTermMemory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decision-time view of the conversation.
 *
 * @param userInput          the message being processed
 * @param history            assembled conversation context, oldest first
 * @param capabilityNames    capabilities the model may invoke
 * @param persona            active persona
 * @param relevantMemories   long-term memories related to the user input
 * @param session            short-term memory snapshot
 * @param callerContext      key/value context supplied with the message
 * @param timestamp          creation time
 * @param iteration          decision/action pairs already executed for this input
 * @param lastAction         the previous iteration's action, or {@code null} on the first iteration
 */
public record Observation(
        String userInput,
        List<ChatMessage> history,
        List<String> capabilityNames,
        Persona persona,
        List<ScoredMemory> relevantMemories,
        ShortTermMemory.Summary session,
        Map<String, Object> callerContext,
        Instant timestamp,
        int iteration,
        Action lastAction
) {
    public Observation {
        history = List.copyOf(history);
        capabilityNames = List.copyOf(capabilityNames);
        relevantMemories = List.copyOf(relevantMemories);
        callerContext = callerContext == null ? Map.of() : callerContext;
    }

    public Optional<Action> previousAction() {
        return Optional.ofNullable(lastAction);
    }

    /** Carries an executed action into the next iteration. */
    public Observation withLastAction(Action action, int iteration) {
        return new Observation(userInput, history, capabilityNames, persona, relevantMemories, session,
                callerContext, timestamp, iteration, action);
    }
}
