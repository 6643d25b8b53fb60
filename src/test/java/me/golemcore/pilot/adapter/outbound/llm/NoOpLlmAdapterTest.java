package me.golemcore.pilot.adapter.outbound.llm;

import me.golemcore.pilot.domain.model.LlmEvent;
import me.golemcore.pilot.domain.model.LlmEventType;
import me.golemcore.pilot.domain.model.LlmRequest;
import me.golemcore.pilot.domain.model.StructuredRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NoOpLlmAdapterTest {

    private NoOpLlmAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new NoOpLlmAdapter();
    }

    @Test
    void shouldEndTurnWithPlaceholder() {
        StepVerifier.create(adapter.issue(LlmRequest.builder().build()))
                .expectNextMatches(event -> event.type() == LlmEventType.TEXT_DELTA
                        && "[No LLM configured]".equals(event.text()))
                .expectNextMatches(event -> event.type() == LlmEventType.FINISH
                        && LlmEvent.FINISH_STOP.equals(event.finishReason())
                        && event.usage().getTotalTokens() == 0)
                .verifyComplete();
    }

    @Test
    void shouldFailStructuredCalls() {
        CompletableFuture<String> future = adapter.generateStructured(StructuredRequest.builder().build());

        assertTrue(future.isCompletedExceptionally());
    }

    @Test
    void shouldReportUnavailable() {
        assertFalse(adapter.isAvailable());
        assertEquals("none", adapter.getProviderId());
        assertEquals("none", adapter.getCurrentModel());
    }
}
