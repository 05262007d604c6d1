package io.agentmind.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentmind.config.AgentProperties;
import io.agentmind.memory.LongTermMemory;
import io.agentmind.memory.MemoryAutoSaver;
import io.agentmind.memory.MemoryCoordinator;
import io.agentmind.memory.ShortTermMemory;
import io.agentmind.model.ModelAdapter;
import io.agentmind.security.InputSanitizer;
import io.agentmind.tool.CapabilityRegistry;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates assistant sessions. Each session gets its own short-term memory, coordinator and
 * loop; long-term memory, capabilities and the model adapter are shared.
 */
@Component
public class AssistantFactory {

    private static final DateTimeFormatter ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final AgentProperties properties;
    private final LongTermMemory longTermMemory;
    private final CapabilityRegistry capabilities;
    private final ModelAdapter modelAdapter;
    private final ObjectMapper objectMapper;
    private final InputSanitizer sanitizer;
    private final AtomicInteger sequence = new AtomicInteger();

    public AssistantFactory(AgentProperties properties, LongTermMemory longTermMemory, CapabilityRegistry capabilities,
                            ModelAdapter modelAdapter, ObjectMapper objectMapper, InputSanitizer sanitizer) {
        this.properties = properties;
        this.longTermMemory = longTermMemory;
        this.capabilities = capabilities;
        this.modelAdapter = modelAdapter;
        this.objectMapper = objectMapper;
        this.sanitizer = sanitizer;
    }

    public PersonalAssistant create() {
        return create(properties.persona());
    }

    /**
     * @throws AgentConfigurationException if the persona is unknown
     */
    public PersonalAssistant create(String personaName) {
        Persona persona = Persona.fromString(personaName);
        AgentProperties.Memory memorySettings = properties.memory();
        AgentProperties.Loop loopSettings = properties.loop();

        MemoryCoordinator memory = new MemoryCoordinator(
                new ShortTermMemory(memorySettings.shortTermCapacity()), longTermMemory, memorySettings);

        AgentLoop loop = new AgentLoop(
                memory,
                new ObservationBuilder(memory, capabilities, loopSettings.relevantMemoryLimit()),
                new DecisionEngine(modelAdapter,
                        new SystemPromptBuilder(capabilities, memorySettings.relevanceFloor()),
                        new DecisionParser(objectMapper)),
                new ActionExecutor(capabilities, memory, modelAdapter, objectMapper, loopSettings.minResponseLength()),
                new MemoryAutoSaver(memory, memorySettings.interactionImportance()),
                persona,
                loopSettings.maxIterations());

        String agentId = "agent_%s_%d".formatted(LocalDateTime.now().format(ID_FORMAT), sequence.incrementAndGet());
        return new PersonalAssistant(agentId, properties.name(), loop, memory, capabilities, modelAdapter, sanitizer);
    }
}
