package io.agentmind.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentmind.memory.MemoryType;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DecisionParserTest {

    private final DecisionParser parser = new DecisionParser(new ObjectMapper());

    @Test
    void shouldParseCapabilityDecision() {
        Decision decision = parser.parse("""
                ACTION_TYPE: use_capability
                REASONING: The user wants arithmetic
                DETAILS: {"tool_name": "calculator", "parameters": {"expression": "2+2"}}
                CONFIDENCE: 0.9
                """);

        var use = assertInstanceOf(Decision.UseCapability.class, decision);
        assertEquals("calculator", use.capabilityName());
        assertEquals(Map.of("expression", "2+2"), use.parameters());
        assertEquals("The user wants arithmetic", use.reasoning());
        assertEquals(0.9, use.confidence(), 1e-9);
    }

    @Test
    void shouldAcceptCapabilityNameKey() {
        Decision decision = parser.parse("""
                ACTION_TYPE: use_capability
                DETAILS: {"capability_name": "weather"}
                """);

        var use = assertInstanceOf(Decision.UseCapability.class, decision);
        assertEquals("weather", use.capabilityName());
        assertTrue(use.parameters().isEmpty());
    }

    @Test
    void shouldParseRespondDecision() {
        Decision decision = parser.parse("""
                ACTION_TYPE: respond
                REASONING: Simple greeting
                DETAILS: {"message": "Hello! How can I help you today?"}
                CONFIDENCE: 0.95
                """);

        var respond = assertInstanceOf(Decision.Respond.class, decision);
        assertEquals("Hello! How can I help you today?", respond.message());
        assertEquals(ActionType.RESPOND, respond.actionType());
    }

    @Test
    void shouldTolerateIndentedLinesAndCaseInActionType() {
        Decision decision = parser.parse("   ACTION_TYPE:   RESPOND  \n   DETAILS: {\"message\": \"hi there friend\"}");

        assertEquals("hi there friend", assertInstanceOf(Decision.Respond.class, decision).message());
    }

    @Test
    void shouldWrapNonJsonDetailsAsMessage() {
        Decision decision = parser.parse("""
                ACTION_TYPE: respond
                DETAILS: Just a plain sentence for the user.
                """);

        var respond = assertInstanceOf(Decision.Respond.class, decision);
        assertEquals("Just a plain sentence for the user.", respond.message());
        assertEquals(Map.of("message", "Just a plain sentence for the user."), respond.details());
    }

    @Test
    void shouldReadJsonSpanningSeveralLines() {
        Decision decision = parser.parse("""
                ACTION_TYPE: use_capability
                DETAILS: {
                  "tool_name": "calculator",
                  "parameters": {"expression": "6*7"}
                }
                CONFIDENCE: 0.8
                """);

        var use = assertInstanceOf(Decision.UseCapability.class, decision);
        assertEquals("calculator", use.capabilityName());
        assertEquals(0.8, use.confidence(), 1e-9);
    }

    @Test
    void shouldClampAndIgnoreBadConfidence() {
        assertEquals(1.0, parser.parse("ACTION_TYPE: respond\nCONFIDENCE: 7").confidence(), 1e-9);
        assertEquals(0.0, parser.parse("ACTION_TYPE: respond\nCONFIDENCE: -2").confidence(), 1e-9);
        assertEquals(0.5, parser.parse("ACTION_TYPE: respond\nCONFIDENCE: high").confidence(), 1e-9);
        assertEquals(0.5, parser.parse("ACTION_TYPE: respond\nCONFIDENCE: NaN").confidence(), 1e-9);
    }

    @Test
    void shouldUseDefaultsForEmptyOutput() {
        Decision decision = parser.parse("");

        var respond = assertInstanceOf(Decision.Respond.class, decision);
        assertEquals("I need more information to help you.", respond.message());
        assertEquals("Default fallback decision", respond.reasoning());
        assertEquals(0.5, respond.confidence(), 1e-9);
    }

    @Test
    void shouldHandleNullOutput() {
        assertInstanceOf(Decision.Respond.class, parser.parse(null));
    }

    @Test
    void shouldFallBackOnUnknownActionType() {
        String raw = "ACTION_TYPE: dance\nDETAILS: {\"style\": \"tango\"}";

        Decision decision = parser.parse(raw);

        var fallback = assertInstanceOf(Decision.Fallback.class, decision);
        assertEquals(Decision.Cause.UNRECOGNIZED_ACTION, fallback.cause());
        assertEquals(raw, fallback.message());
        assertEquals(ActionType.RESPOND, fallback.actionType());
    }

    @Test
    void shouldParseStoreMemoryDecision() {
        Decision decision = parser.parse("""
                ACTION_TYPE: store_memory
                DETAILS: {"content": "User prefers tea", "memory_type": "preference", "importance": 0.9}
                """);

        var store = assertInstanceOf(Decision.StoreMemory.class, decision);
        assertEquals("User prefers tea", store.content());
        assertEquals(MemoryType.PREFERENCE, store.memoryType());
        assertEquals(0.9, store.importance(), 1e-9);
    }

    @Test
    void shouldDefaultStoreMemoryFields() {
        var store = assertInstanceOf(Decision.StoreMemory.class,
                parser.parse("ACTION_TYPE: store_memory\nDETAILS: {\"importance\": 3}"));

        assertEquals("", store.content());
        assertEquals(MemoryType.FACT, store.memoryType());
        assertEquals(1.0, store.importance(), 1e-9);
    }

    @Test
    void shouldParseClarificationFromQuestionOrMessage() {
        var withQuestion = assertInstanceOf(Decision.AskClarification.class,
                parser.parse("ACTION_TYPE: ask_clarification\nDETAILS: {\"question\": \"Which city?\"}"));
        var withMessage = assertInstanceOf(Decision.AskClarification.class,
                parser.parse("ACTION_TYPE: ask_clarification\nDETAILS: {\"message\": \"Which day?\"}"));

        assertEquals("Which city?", withQuestion.question());
        assertEquals("Which day?", withMessage.question());
    }
}
