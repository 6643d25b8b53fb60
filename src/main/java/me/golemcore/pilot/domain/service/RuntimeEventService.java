package me.golemcore.pilot.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pilot.domain.model.RuntimeEvent;
import me.golemcore.pilot.domain.model.RuntimeEventType;
import me.golemcore.pilot.port.outbound.TelemetryPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Builds runtime events and hands them to every {@link TelemetryPort}. Delivery
 * happens off the run thread; a failing or slow sink never affects the run.
 */
@Service
@Slf4j
public class RuntimeEventService {

    private final Clock clock;
    private final List<TelemetryPort> telemetryPorts;
    private final Executor dispatcher;

    @Autowired
    public RuntimeEventService(Clock clock, List<TelemetryPort> telemetryPorts) {
        this(clock, telemetryPorts, Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "pilot-telemetry");
            thread.setDaemon(true);
            return thread;
        }));
    }

    // Visible for testing
    public RuntimeEventService(Clock clock, List<TelemetryPort> telemetryPorts, Executor dispatcher) {
        this.clock = clock;
        this.telemetryPorts = telemetryPorts != null ? List.copyOf(telemetryPorts) : List.of();
        this.dispatcher = dispatcher;
    }

    public RuntimeEvent emit(String runId, RuntimeEventType type, Map<String, Object> payload) {
        Map<String, Object> safePayload = new LinkedHashMap<>();
        if (payload != null) {
            safePayload.putAll(payload);
        }
        safePayload.put("runId", runId);
        RuntimeEvent event = RuntimeEvent.builder()
                .type(type)
                .timestamp(Instant.now(clock))
                .runId(runId)
                .payload(safePayload)
                .build();

        for (TelemetryPort port : telemetryPorts) {
            dispatch(port, event);
        }
        return event;
    }

    @PreDestroy
    public void destroy() {
        if (dispatcher instanceof ExecutorService executorService) {
            executorService.shutdownNow();
        }
    }

    private void dispatch(TelemetryPort port, RuntimeEvent event) {
        try {
            dispatcher.execute(() -> deliver(port, event));
        } catch (RejectedExecutionException e) {
            log.debug("[Telemetry] Dropped {}: dispatcher rejected", event.type().getWireName());
        }
    }

    private void deliver(TelemetryPort port, RuntimeEvent event) {
        try {
            port.emit(event.type().getWireName(), event.payload());
        } catch (Exception e) { // NOSONAR - telemetry must be best effort
            log.debug("[Telemetry] Sink failed for {}: {}", event.type().getWireName(), e.getMessage());
        }
    }
}
