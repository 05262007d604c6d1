package io.agentmind.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentmind.config.AgentProperties;
import io.agentmind.memory.LongTermMemory;
import io.agentmind.model.ModelAdapter;
import io.agentmind.model.ModelAdapterException;
import io.agentmind.model.ModelInfo;
import io.agentmind.security.InputSanitizer;
import io.agentmind.tool.CapabilityRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class AssistantFactoryTest {

    private ModelAdapter modelAdapter;
    private AssistantFactory factory;

    @BeforeEach
    void setUp() {
        modelAdapter = mock(ModelAdapter.class);
        when(modelAdapter.info()).thenReturn(new ModelInfo("ollama", "llama3", 2000, 0.7));
        factory = new AssistantFactory(AgentProperties.defaults(), mock(LongTermMemory.class),
                new CapabilityRegistry(), modelAdapter, new ObjectMapper(), new InputSanitizer());
    }

    @Test
    void shouldCreateAssistantWithConfiguredPersona() {
        PersonalAssistant assistant = factory.create();

        AgentStatus status = assistant.getStatus();
        assertEquals("personal", status.persona());
        assertEquals("PersonalAssistant", status.name());
        assertEquals(10, status.maxIterations());
        assertTrue(assistant.agentId().matches("agent_\\d{8}_\\d{6}_1"));
    }

    @Test
    void shouldGiveEachSessionItsOwnShortTermMemory() {
        when(modelAdapter.generate(anyList()))
                .thenReturn("ACTION_TYPE: respond\nDETAILS: {\"message\": \"Hello there, friend!\"}");
        PersonalAssistant first = factory.create("research");
        PersonalAssistant second = factory.create("technical");

        first.chat("Hi", Map.of());

        assertEquals(2, first.getStatus().memorySummary().shortTerm().messageCount());
        assertEquals(0, second.getStatus().memorySummary().shortTerm().messageCount());
        assertNotEquals(first.agentId(), second.agentId());
    }

    @Test
    void shouldAnswerWithTextWhenModelAlwaysFails() {
        when(modelAdapter.generate(anyList())).thenThrow(new ModelAdapterException("connection refused", true));
        PersonalAssistant assistant = factory.create();

        String response = assertDoesNotThrow(() -> assistant.chat("Hello"));

        assertEquals(DecisionEngine.MODEL_FAILURE_MESSAGE, response);
        assertEquals(AgentState.IDLE, assistant.getStatus().state());
    }

    @Test
    void shouldReportStatusWhileModelCallIsInFlight() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(modelAdapter.generate(anyList())).thenAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return "ACTION_TYPE: respond\nDETAILS: {\"message\": \"Hello there, friend!\"}";
        });
        PersonalAssistant assistant = factory.create();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<String> reply = executor.submit(() -> assistant.chat("Hi"));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            AgentStatus status = assertTimeoutPreemptively(Duration.ofSeconds(1), assistant::getStatus);
            AgentStatistics statistics = assertTimeoutPreemptively(Duration.ofSeconds(1), assistant::getStatistics);

            assertEquals(AgentState.DECIDING, status.state());
            assertEquals(1, status.iteration());
            assertEquals(1, status.totalInteractions());
            assertEquals(1, status.memorySummary().shortTerm().messageCount());
            assertEquals(1, statistics.totalInteractions());

            release.countDown();
            assertEquals("Hello there, friend!", reply.get(5, TimeUnit.SECONDS));
            assertEquals(AgentState.IDLE, assistant.getStatus().state());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void shouldRejectUnknownPersona() {
        assertThrows(AgentConfigurationException.class, () -> factory.create("pirate"));
    }
}
