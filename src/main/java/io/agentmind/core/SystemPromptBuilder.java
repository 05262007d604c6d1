package io.agentmind.core;

import io.agentmind.memory.ScoredMemory;
import io.agentmind.tool.Capability;
import io.agentmind.tool.CapabilityRegistry;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Builds the decision prompt: persona, conversation so far, capabilities, relevant memories,
 * the previous action and the decision format instructions.
 */
public class SystemPromptBuilder {

    private static final int MAX_HISTORY_LINES = 10;
    private static final int MAX_LINE_LENGTH = 300;

    private final CapabilityRegistry capabilities;
    private final double relevanceFloor;

    public SystemPromptBuilder(CapabilityRegistry capabilities, double relevanceFloor) {
        this.capabilities = capabilities;
        this.relevanceFloor = relevanceFloor;
    }

    public String buildDecisionPrompt(Observation observation) {
        var sb = new StringBuilder();

        sb.append(observation.persona().systemPrompt(LocalDateTime.now())).append("\n\n");

        List<ChatMessage> history = observation.history();
        if (!history.isEmpty()) {
            sb.append("## Conversation So Far\n");
            for (ChatMessage message : history.subList(Math.max(0, history.size() - MAX_HISTORY_LINES), history.size())) {
                sb.append("- ").append(truncate(message.toTranscriptLine())).append("\n");
            }
            sb.append("\n");
        }

        sb.append("## Available Capabilities\n");
        if (observation.capabilityNames().isEmpty()) {
            sb.append("No capabilities are available.\n\n");
        } else {
            for (String name : observation.capabilityNames()) {
                Optional<Capability> capability = capabilities.get(name);
                sb.append("- ").append(name);
                capability.ifPresent(c -> sb.append(": ").append(c.description())
                        .append("\n  Parameters: ").append(c.parameterSchema().strip()));
                sb.append("\n");
            }
            sb.append("\n");
        }

        String memories = memoryContext(observation.relevantMemories());
        if (!memories.isBlank()) {
            sb.append("## Relevant Memories\n");
            sb.append("The following are memories from previous conversations that may be relevant:\n");
            sb.append(memories).append("\n");
        }

        observation.previousAction().ifPresent(action -> {
            sb.append("## Previous Action\n");
            sb.append("- Type: ").append(action.actionType().wireName()).append("\n");
            sb.append("- Succeeded: ").append(action.success()).append("\n");
            sb.append("- Result: ").append(action.result()).append("\n");
            sb.append("Use this result to decide the next step. Respond once you have what you need.\n\n");
        });

        sb.append(decisionInstructions());
        return sb.toString();
    }

    String memoryContext(List<ScoredMemory> memories) {
        var sb = new StringBuilder();
        for (ScoredMemory memory : memories) {
            if (memory.relevance() >= relevanceFloor) {
                sb.append("- [%s] %s\n".formatted(memory.record().type().wireName(), truncate(memory.content())));
            }
        }
        return sb.toString();
    }

    static String decisionInstructions() {
        return """
                ## Decision Format (v%d)
                Decide on exactly one action and answer with these four lines:
                ACTION_TYPE: one of use_capability, respond, store_memory, ask_clarification
                REASONING: one sentence explaining the choice
                DETAILS: a single-line JSON object
                CONFIDENCE: a number between 0 and 1

                DETAILS by action type:
                - use_capability: {"tool_name": "<capability>", "parameters": {...}}
                - respond: {"message": "<your answer to the user>"}
                - store_memory: {"content": "<what to remember>", "memory_type": "fact|preference|conversation|interaction", "importance": 0.0-1.0}
                - ask_clarification: {"question": "<what you need to know>"}
                """.formatted(DecisionParser.SCHEMA_VERSION);
    }

    private static String truncate(String s) {
        return s.length() <= MAX_LINE_LENGTH ? s : s.substring(0, MAX_LINE_LENGTH) + "...";
    }
}
