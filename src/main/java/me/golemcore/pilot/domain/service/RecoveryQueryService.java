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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pilot.domain.model.AbortSignal;
import me.golemcore.pilot.domain.model.ExecutionStep;
import me.golemcore.pilot.domain.model.RecoveryQuery;
import me.golemcore.pilot.domain.model.StructuredRequest;
import me.golemcore.pilot.domain.system.StructuredOutputReader;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Produces the adjusted objective for the automatic retry. The adjusted
 * objective always starts with the retry marker.
 */
@Service
@Slf4j
public class RecoveryQueryService {

    static final int MAX_OBJECTIVE_LENGTH = 5000;
    static final int MAX_RATIONALE_LENGTH = 4000;

    private static final String SYSTEM_PROMPT = "You are a recovery planner for a browser automation agent. "
            + "A previous run did not complete its objective. Study the recent steps and the summary, "
            + "then rewrite the objective so the next attempt avoids the same failure. "
            + "Return JSON with adjustedQuery and rationale.";

    private final LlmPort llmPort;
    private final StructuredOutputReader reader;
    private final PilotProperties properties;

    public RecoveryQueryService(LlmPort llmPort, ObjectMapper objectMapper, PilotProperties properties) {
        this.llmPort = llmPort;
        this.reader = new StructuredOutputReader(objectMapper);
        this.properties = properties;
    }

    /**
     * Builds a recovery query for a run that ended without completing. Never
     * throws: any failure, an abort included, degrades to a deterministic query.
     */
    public RecoveryQuery recover(String objective, List<ExecutionStep> trajectory, String summary, String finalUrl,
            AbortSignal abortSignal) {
        List<ExecutionStep> steps = trajectory != null ? trajectory : List.of();
        if (!llmPort.isAvailable(properties.getLlm().resolvePlannerModel())) {
            log.warn("[Retry] No model credential configured, using deterministic recovery query");
            return fallback(objective, steps);
        }
        if (abortSignal.isAborted()) {
            return fallback(objective, steps);
        }
        try {
            StructuredRequest request = buildRequest(objective, steps, summary, finalUrl);
            String raw = abortSignal.await(llmPort.generateStructured(request), properties.getLlm().getTimeout());
            ObjectNode node = reader.readObject(raw);
            String adjusted = node.path("adjustedQuery").asText("").strip();
            if (adjusted.isEmpty()) {
                log.warn("[Retry] Recovery reasoning returned an empty query");
                return fallback(objective, steps);
            }
            String rationale = truncate(node.path("rationale").asText(""), MAX_RATIONALE_LENGTH);
            return new RecoveryQuery(truncate(withMarker(adjusted), MAX_OBJECTIVE_LENGTH), rationale, false);
        } catch (CancellationException e) {
            log.info("[Retry] Recovery reasoning cancelled by abort");
            return fallback(objective, steps);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fallback(objective, steps);
        } catch (ExecutionException | TimeoutException | JsonProcessingException | RuntimeException e) {
            log.warn("[Retry] Recovery reasoning failed: {}", e.getMessage());
            return fallback(objective, steps);
        }
    }

    RecoveryQuery fallback(String objective, List<ExecutionStep> steps) {
        ExecutionStep lastFailure = null;
        for (ExecutionStep step : steps) {
            if (!step.success()) {
                lastFailure = step;
            }
        }
        StringBuilder sb = new StringBuilder(withMarker(objective));
        String rationale;
        if (lastFailure != null) {
            sb.append("\n\nThe previous attempt failed at step ").append(lastFailure.step())
                    .append(" (").append(lastFailure.action());
            if (lastFailure.target() != null) {
                sb.append(' ').append(lastFailure.target());
            }
            sb.append("). Verify the page state before retrying that action.");
            rationale = "Retrying with the original objective; last failure at step " + lastFailure.step() + ".";
        } else {
            rationale = "Retrying with the original objective.";
        }
        return new RecoveryQuery(truncate(sb.toString(), MAX_OBJECTIVE_LENGTH), rationale, true);
    }

    private StructuredRequest buildRequest(String objective, List<ExecutionStep> steps, String summary,
            String finalUrl) {
        int from = Math.max(0, steps.size() - properties.getRetry().getMaxRecentSteps());
        StringBuilder prompt = new StringBuilder();
        prompt.append("Original objective:\n").append(objective).append("\n\nRecent steps:\n");
        for (ExecutionStep step : steps.subList(from, steps.size())) {
            prompt.append(step.success() ? "[ok] " : "[failed] ")
                    .append(step.step()).append(". ").append(step.action());
            if (step.target() != null) {
                prompt.append(" -> ").append(step.target());
            }
            prompt.append('\n');
        }
        prompt.append("\nFinal URL: ").append(finalUrl != null ? finalUrl : "N/A");
        if (summary != null && !summary.isBlank()) {
            prompt.append("\n\nSummary:\n").append(summary);
        }
        return StructuredRequest.builder()
                .name("RecoveryQuery")
                .systemPrompt(SYSTEM_PROMPT)
                .prompt(prompt.toString())
                .model(properties.getLlm().resolvePlannerModel())
                .temperature(0.3)
                .schema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "adjustedQuery", Map.of("type", "string"),
                                "rationale", Map.of("type", "string")),
                        "required", List.of("adjustedQuery", "rationale")))
                .build();
    }

    private String withMarker(String objective) {
        String marker = properties.getRetry().getMarker();
        String text = objective != null ? objective : "";
        return text.startsWith(marker) ? text : marker + " " + text;
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }
}
