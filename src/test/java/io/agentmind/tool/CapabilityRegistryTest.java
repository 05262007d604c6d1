package io.agentmind.tool;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityRegistryTest {

    private CapabilityRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CapabilityRegistry();
    }

    @Test
    void shouldRegisterAndInvokeCapability() {
        registry.register(Capability.of("echo", "Echoes input", "{}",
                args -> CapabilityResult.ok("echo: " + args.get("text"))));

        CapabilityResult result = registry.invoke("echo", Map.of("text", "hi"));

        assertTrue(result.success());
        assertEquals("echo: hi", result.result());
        assertNull(result.error());
    }

    @Test
    void shouldReturnFailureForMissingCapability() {
        CapabilityResult result = registry.invoke("nonexistent", Map.of());

        assertFalse(result.success());
        assertEquals("Capability 'nonexistent' not found", result.error());
    }

    @Test
    void shouldConvertExceptionsToFailures() {
        registry.register(Capability.of("boom", "Always fails", "{}", args -> {
            throw new IllegalArgumentException("bad input");
        }));

        CapabilityResult result = assertDoesNotThrow(() -> registry.invoke("boom", Map.of()));

        assertFalse(result.success());
        assertTrue(result.error().contains("bad input"));
    }

    @Test
    void shouldTreatNullResultAsFailure() {
        registry.register(Capability.of("silent", "Returns nothing", "{}", args -> null));

        assertFalse(registry.invoke("silent", Map.of()).success());
    }

    @Test
    void shouldPassEmptyParametersWhenNull() {
        registry.register(Capability.of("count", "Counts parameters", "{}",
                args -> CapabilityResult.ok(args.size())));

        assertEquals(0, registry.invoke("count", null).result());
    }

    @Test
    void shouldListNamesSorted() {
        registry.register(Capability.of("zeta", "", "{}", args -> CapabilityResult.ok(null)));
        registry.register(Capability.of("alpha", "", "{}", args -> CapabilityResult.ok(null)));

        assertEquals(List.of("alpha", "zeta"), registry.names());
        assertEquals("alpha", registry.all().get(0).name());
    }

    @Test
    void shouldUnregisterCapability() {
        registry.register(Capability.of("temp", "", "{}", args -> CapabilityResult.ok(null)));
        registry.unregister("temp");

        assertTrue(registry.get("temp").isEmpty());
        assertTrue(registry.names().isEmpty());
    }

    @Test
    void shouldCountUsagePerCapability() {
        registry.register(Capability.of("calculator", "", "{}", args -> CapabilityResult.ok(4)));
        registry.register(Capability.of("weather", "", "{}", args -> CapabilityResult.ok("sunny")));

        registry.invoke("calculator", Map.of());
        registry.invoke("calculator", Map.of());
        registry.invoke("weather", Map.of());
        registry.invoke("missing", Map.of());

        assertEquals(Map.of("calculator", 2L, "weather", 1L), registry.usageCounts());
    }

    @Test
    void shouldRegisterInitialCapabilities() {
        CapabilityRegistry seeded = new CapabilityRegistry(List.of(
                Capability.of("a", "", "{}", args -> CapabilityResult.ok(null))));

        assertTrue(seeded.get("a").isPresent());
    }
}
