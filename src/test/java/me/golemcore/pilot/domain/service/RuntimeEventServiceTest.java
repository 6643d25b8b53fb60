package me.golemcore.pilot.domain.service;

import me.golemcore.pilot.domain.model.RuntimeEvent;
import me.golemcore.pilot.domain.model.RuntimeEventType;
import me.golemcore.pilot.port.outbound.TelemetryPort;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class RuntimeEventServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void shouldBuildEventWithRunIdInPayload() {
        RuntimeEventService service = new RuntimeEventService(CLOCK, List.of(), Runnable::run);

        RuntimeEvent event = service.emit("run-1", RuntimeEventType.RUN_STARTED, Map.of("attempt", 0));

        assertEquals(RuntimeEventType.RUN_STARTED, event.type());
        assertEquals(NOW, event.timestamp());
        assertEquals("run-1", event.runId());
        assertEquals(0, event.payload().get("attempt"));
        assertEquals("run-1", event.payload().get("runId"));
    }

    @Test
    void shouldAcceptNullPayload() {
        RuntimeEventService service = new RuntimeEventService(CLOCK, null, Runnable::run);

        RuntimeEvent event = service.emit("run-1", RuntimeEventType.RUN_FINISHED, null);

        assertNotNull(event.payload());
        assertEquals(1, event.payload().size());
    }

    @Test
    void shouldDeliverToEverySinkByWireName() {
        TelemetryPort first = mock(TelemetryPort.class);
        TelemetryPort second = mock(TelemetryPort.class);
        RuntimeEventService service = new RuntimeEventService(CLOCK, List.of(first, second), Runnable::run);

        service.emit("run-1", RuntimeEventType.TOOL_CALL_FINISHED, Map.of("tool", "navigate"));

        verify(first).emit(eq("tool_call_finished"), anyMap());
        verify(second).emit(eq("tool_call_finished"), anyMap());
    }

    @Test
    void shouldIsolateFailingSink() {
        TelemetryPort broken = mock(TelemetryPort.class);
        TelemetryPort healthy = mock(TelemetryPort.class);
        doThrow(new IllegalStateException("sink down")).when(broken).emit(any(), any());
        RuntimeEventService service = new RuntimeEventService(CLOCK, List.of(broken, healthy), Runnable::run);

        service.emit("run-1", RuntimeEventType.SUMMARY_READY, Map.of());

        verify(healthy).emit(eq("summary_ready"), anyMap());
    }

    @Test
    void shouldDropEventsWhenDispatcherRejects() {
        TelemetryPort sink = mock(TelemetryPort.class);
        RuntimeEventService service = new RuntimeEventService(CLOCK, List.of(sink), runnable -> {
            throw new RejectedExecutionException("shut down");
        });

        RuntimeEvent event = service.emit("run-1", RuntimeEventType.LOOP_STOPPED, Map.of());

        assertEquals(RuntimeEventType.LOOP_STOPPED, event.type());
        verify(sink, never()).emit(any(), any());
    }

    @Test
    void shouldShutDownDispatcherOnDestroy() {
        TelemetryPort sink = mock(TelemetryPort.class);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        RuntimeEventService service = new RuntimeEventService(CLOCK, List.of(sink), executor);

        service.destroy();
        service.emit("run-1", RuntimeEventType.RUN_FINISHED, Map.of());

        assertTrue(executor.isShutdown());
        verify(sink, never()).emit(any(), anyMap());
    }
}
