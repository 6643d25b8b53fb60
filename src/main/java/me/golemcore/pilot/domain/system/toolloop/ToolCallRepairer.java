package me.golemcore.pilot.domain.system.toolloop;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.pilot.domain.model.AbortSignal;
import me.golemcore.pilot.domain.model.ActionCall;
import me.golemcore.pilot.domain.model.StructuredRequest;
import me.golemcore.pilot.domain.model.ToolDefinition;
import me.golemcore.pilot.domain.system.StructuredOutputReader;
import me.golemcore.pilot.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Single structured repair attempt for a call whose arguments failed schema
 * validation. The model is shown the original arguments, the schema and the
 * violations, and asked for corrected arguments.
 */
public class ToolCallRepairer {

    private static final Logger log = LoggerFactory.getLogger(ToolCallRepairer.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final LlmPort llmPort;
    private final StructuredOutputReader reader;
    private final String model;
    private final Duration timeout;

    public ToolCallRepairer(LlmPort llmPort, StructuredOutputReader reader, String model, Duration timeout) {
        this.llmPort = llmPort;
        this.reader = reader;
        this.model = model;
        this.timeout = timeout;
    }

    /**
     * Returns repaired arguments, or empty when the model is unavailable or the
     * repair call fails. The caller re-validates whatever comes back.
     */
    public Optional<Map<String, Object>> repair(ActionCall call, ToolDefinition definition, List<String> violations,
            AbortSignal abortSignal) {
        if (!llmPort.isAvailable(model)) {
            return Optional.empty();
        }
        StructuredRequest request = StructuredRequest.builder()
                .name(definition.getName() + "_arguments")
                .model(model)
                .temperature(0.0)
                .schema(definition.getInputSchema())
                .prompt(buildPrompt(call, definition, violations))
                .build();
        try {
            String raw = abortSignal.await(llmPort.generateStructured(request), timeout);
            ObjectNode repaired = reader.readObject(raw);
            Map<String, Object> args = reader.getObjectMapper().convertValue(repaired, MAP_TYPE);
            log.debug("[ToolLoop] Repaired arguments for {} ({})", call.name(), call.id());
            return Optional.of(args);
        } catch (CancellationException e) {
            log.debug("[ToolLoop] Repair of {} cancelled", call.id());
            return Optional.empty();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("[ToolLoop] Repair of {} returned unusable JSON: {}", call.name(), e.getMessage());
            return Optional.empty();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[ToolLoop] Repair of {} failed: {}", call.name(), e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    private String buildPrompt(ActionCall call, ToolDefinition definition, List<String> violations) {
        String args;
        try {
            args = reader.getObjectMapper().writeValueAsString(call.args());
        } catch (JsonProcessingException e) {
            args = String.valueOf(call.args());
        }
        String schema;
        try {
            schema = reader.getObjectMapper().writeValueAsString(definition.getInputSchema());
        } catch (JsonProcessingException e) {
            schema = String.valueOf(definition.getInputSchema());
        }
        return "The model tried to call the tool \"" + call.name() + "\" with the following arguments:\n"
                + args + "\n\nThe tool accepts the following JSON schema:\n" + schema
                + "\n\nValidation errors:\n- " + String.join("\n- ", violations)
                + "\n\nReturn only the corrected arguments as a JSON object.";
    }
}
