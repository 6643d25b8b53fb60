package me.golemcore.pilot.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.pilot.domain.model.AbortSignal;
import me.golemcore.pilot.domain.model.ActionCall;
import me.golemcore.pilot.domain.model.StructuredRequest;
import me.golemcore.pilot.domain.model.ToolDefinition;
import me.golemcore.pilot.domain.system.StructuredOutputReader;
import me.golemcore.pilot.testsupport.ScriptedLlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolCallRepairerTest {

    private static final ToolDefinition NAVIGATE = ToolDefinition.object("navigate", "Open a URL",
            Map.of("url", Map.of("type", "string")), List.of("url"));

    private ScriptedLlmPort llm;
    private ToolCallRepairer repairer;
    private ActionCall call;

    @BeforeEach
    void setUp() {
        llm = new ScriptedLlmPort();
        repairer = new ToolCallRepairer(llm, new StructuredOutputReader(new ObjectMapper()), "openai/gpt-4o-mini",
                Duration.ofSeconds(5));
        call = new ActionCall("c1", "navigate", Map.of("link", "https://example.com"), Instant.EPOCH);
    }

    @Test
    void shouldReturnRepairedArguments() {
        llm.onStructured("navigate_arguments", request -> "{\"url\": \"https://example.com\"}");

        Optional<Map<String, Object>> repaired = repairer.repair(call, NAVIGATE,
                List.of("arguments.url is required"), AbortSignal.create());

        assertEquals(Optional.of(Map.of("url", "https://example.com")), repaired);
        StructuredRequest request = llm.structuredRequests().get(0);
        assertEquals(0.0, request.getTemperature(), 1e-9);
        assertEquals("openai/gpt-4o-mini", request.getModel());
        assertEquals(NAVIGATE.getInputSchema(), request.getSchema());
        assertTrue(request.getPrompt().contains("\"link\":\"https://example.com\""));
        assertTrue(request.getPrompt().contains("- arguments.url is required"));
    }

    @Test
    void shouldGiveUpWhenModelUnavailable() {
        llm.available(false);

        assertTrue(repairer.repair(call, NAVIGATE, List.of("x"), AbortSignal.create()).isEmpty());
        assertTrue(llm.structuredRequests().isEmpty());
    }

    @Test
    void shouldGiveUpWhenRepairCallFails() {
        assertTrue(repairer.repair(call, NAVIGATE, List.of("x"), AbortSignal.create()).isEmpty());
    }

    @Test
    void shouldGiveUpOnUnusableJson() {
        llm.onStructured("navigate_arguments", request -> "I would use the url parameter.");

        assertTrue(repairer.repair(call, NAVIGATE, List.of("x"), AbortSignal.create()).isEmpty());
    }

    @Test
    void shouldGiveUpWhenAborted() {
        llm.onStructured("navigate_arguments", request -> "{\"url\": \"https://example.com\"}");
        AbortSignal signal = AbortSignal.create();
        signal.abort("stop");

        assertTrue(repairer.repair(call, NAVIGATE, List.of("x"), signal).isEmpty());
    }
}
