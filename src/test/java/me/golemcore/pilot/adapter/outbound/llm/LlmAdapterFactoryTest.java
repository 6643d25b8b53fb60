package me.golemcore.pilot.adapter.outbound.llm;

import me.golemcore.pilot.domain.model.LlmEvent;
import me.golemcore.pilot.domain.model.LlmRequest;
import me.golemcore.pilot.domain.model.StructuredRequest;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LlmAdapterFactoryTest {

    private PilotProperties properties;

    @BeforeEach
    void setUp() {
        properties = new PilotProperties();
    }

    private LlmProviderAdapter createMockAdapter(String providerId, boolean available) {
        LlmProviderAdapter adapter = mock(LlmProviderAdapter.class);
        when(adapter.getProviderId()).thenReturn(providerId);
        when(adapter.isAvailable()).thenReturn(available);
        when(adapter.getCurrentModel()).thenReturn(providerId + "/model");
        return adapter;
    }

    // ===== init() =====

    @Test
    void shouldSelectConfiguredProvider() {
        properties.getLlm().setProvider("langchain4j");
        LlmProviderAdapter langchain4j = createMockAdapter("langchain4j", true);
        LlmProviderAdapter noop = createMockAdapter("none", false);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(langchain4j, noop));
        factory.init();

        assertEquals("langchain4j", factory.getProviderId());
        assertSame(langchain4j, factory.getActiveAdapter());
        verify(langchain4j).initialize();
        verify(noop, never()).initialize();
    }

    @Test
    void shouldFallbackToNoopWhenProviderNotFound() {
        properties.getLlm().setProvider("nonexistent");
        LlmProviderAdapter noop = createMockAdapter("none", false);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(noop));
        factory.init();

        assertEquals("none", factory.getProviderId());
        assertFalse(factory.isAvailable());
    }

    @Test
    void shouldFallbackToFirstAdapterWhenNoopNotFound() {
        properties.getLlm().setProvider("nonexistent");
        LlmProviderAdapter custom = createMockAdapter("custom", true);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(custom));
        factory.init();

        assertEquals("custom", factory.getProviderId());
    }

    @Test
    void shouldReturnNoneWhenNoAdapters() {
        properties.getLlm().setProvider("nonexistent");

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of());
        factory.init();

        assertEquals("none", factory.getProviderId());
        assertEquals("none", factory.getCurrentModel());
        assertFalse(factory.isAvailable());
    }

    // ===== delegation =====

    @Test
    void shouldDelegateToActiveAdapter() {
        properties.getLlm().setProvider("langchain4j");
        LlmProviderAdapter langchain4j = createMockAdapter("langchain4j", true);
        Flux<LlmEvent> events = Flux.just(LlmEvent.textDelta("hi"));
        CompletableFuture<String> structured = CompletableFuture.completedFuture("{}");
        LlmRequest request = LlmRequest.builder().build();
        StructuredRequest structuredRequest = StructuredRequest.builder().name("ExecutionPlan").build();
        when(langchain4j.issue(request)).thenReturn(events);
        when(langchain4j.generateStructured(structuredRequest)).thenReturn(structured);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(langchain4j));
        factory.init();

        assertSame(events, factory.issue(request));
        assertSame(structured, factory.generateStructured(structuredRequest));
        assertEquals("langchain4j/model", factory.getCurrentModel());
        assertTrue(factory.isAvailable());
    }

    @Test
    void shouldDelegateModelAvailabilityToActiveAdapter() {
        properties.getLlm().setProvider("langchain4j");
        LlmProviderAdapter langchain4j = createMockAdapter("langchain4j", true);
        when(langchain4j.isAvailable("anthropic/claude-sonnet-4")).thenReturn(false);
        when(langchain4j.isAvailable("openai/gpt-4o")).thenReturn(true);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(langchain4j));
        factory.init();

        assertFalse(factory.isAvailable("anthropic/claude-sonnet-4"));
        assertTrue(factory.isAvailable("openai/gpt-4o"));
    }

    @Test
    void shouldReturnAdapterByProviderId() {
        LlmProviderAdapter langchain4j = createMockAdapter("langchain4j", true);
        LlmProviderAdapter noop = createMockAdapter("none", false);

        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(langchain4j, noop));
        factory.init();

        assertSame(noop, factory.getAdapter("none"));
        assertNull(factory.getAdapter("missing"));
    }
}
