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
import me.golemcore.pilot.domain.model.OutcomeStatus;
import me.golemcore.pilot.domain.model.StateSnapshot;
import me.golemcore.pilot.domain.model.StructuredRequest;
import me.golemcore.pilot.domain.model.SummaryReport;
import me.golemcore.pilot.domain.system.StructuredOutputReader;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies a finished run and renders the final report.
 *
 * <p>
 * Classification depends only on the trajectory and the final-state marker:
 * <ul>
 * <li>success - a confirmed final location and no failed step</li>
 * <li>partial - a navigation succeeded, or a final location is known</li>
 * <li>failed - otherwise</li>
 * </ul>
 * An aborted run is never reported as success: its status is capped at
 * partial. The report always ends with a {@code TASK_COMPLETED: YES|NO} line, YES
 * exactly when the status is success.
 */
@Service
@Slf4j
public class SummarizerService {

    public static final String COMPLETION_MARKER = "TASK_COMPLETED: ";

    private static final String NOT_AVAILABLE = "N/A";
    private static final int MAX_NARRATIVE_STEPS = 20;

    private final LlmPort llmPort;
    private final StructuredOutputReader reader;
    private final PilotProperties properties;

    public SummarizerService(LlmPort llmPort, ObjectMapper objectMapper, PilotProperties properties) {
        this.llmPort = llmPort;
        this.reader = new StructuredOutputReader(objectMapper);
        this.properties = properties;
    }

    public SummaryReport summarize(List<ExecutionStep> trajectory, StateSnapshot finalState, String narrative) {
        return summarize(trajectory, finalState, narrative, null, false);
    }

    public SummaryReport summarize(List<ExecutionStep> trajectory, StateSnapshot finalState, String narrative,
            Duration duration, boolean aborted) {
        List<ExecutionStep> steps = trajectory != null ? trajectory : List.of();
        int successCount = 0;
        boolean navigationSucceeded = false;
        Set<String> navigationTools = Set.copyOf(properties.getToolLoop().getNavigationTools());
        for (ExecutionStep step : steps) {
            if (step.success()) {
                successCount++;
                if (navigationTools.contains(step.action())) {
                    navigationSucceeded = true;
                }
            }
        }
        int failureCount = steps.size() - successCount;
        boolean hasFinalState = finalState != null && finalState.url() != null && !finalState.url().isBlank();

        OutcomeStatus status;
        if (hasFinalState && failureCount == 0) {
            status = OutcomeStatus.SUCCESS;
        } else if (navigationSucceeded || hasFinalState) {
            status = OutcomeStatus.PARTIAL;
        } else {
            status = OutcomeStatus.FAILED;
        }
        if (aborted && status == OutcomeStatus.SUCCESS) {
            status = OutcomeStatus.PARTIAL;
        }
        boolean taskCompleted = status == OutcomeStatus.SUCCESS;
        String finalUrl = hasFinalState ? finalState.url() : NOT_AVAILABLE;

        String summary = String.join("\n",
                "---",
                "## Summary & Next Steps",
                "",
                statusLine(status),
                "Steps: " + steps.size() + " total — " + successCount + " success, " + failureCount + " failed",
                "Final URL: " + finalUrl,
                "Duration: " + (duration != null ? duration.toMillis() + "ms" : NOT_AVAILABLE),
                "",
                narrative != null && !narrative.isBlank() ? narrative.strip() : topline(status, aborted),
                "",
                nextSteps(status),
                "",
                COMPLETION_MARKER + (taskCompleted ? "YES" : "NO"));

        log.info("[Summarizer] Outcome {}{}: {} step(s), {} success, {} failed", status.getWireName(),
                aborted ? " (aborted)" : "", steps.size(), successCount, failureCount);
        return SummaryReport.builder()
                .summary(summary)
                .status(status)
                .taskCompleted(taskCompleted)
                .totalSteps(steps.size())
                .successCount(successCount)
                .failureCount(failureCount)
                .finalUrl(hasFinalState ? finalState.url() : null)
                .build();
    }

    /**
     * Asks the model for a short narrative of the run. Empty when narratives are
     * disabled, the model is unavailable, the run is aborted or the call fails.
     */
    public Optional<String> generateNarrative(String objective, List<ExecutionStep> trajectory, String finalText,
            AbortSignal abortSignal) {
        if (!properties.getSummarizer().isLlmNarrativeEnabled() || abortSignal.isAborted()
                || !llmPort.isAvailable(properties.getLlm().resolvePlannerModel())) {
            return Optional.empty();
        }
        StructuredRequest request = StructuredRequest.builder()
                .name("RunNarrative")
                .model(properties.getLlm().resolvePlannerModel())
                .temperature(properties.getLlm().getTemperature())
                .schema(Map.of(
                        "type", "object",
                        "properties", Map.of("summary", Map.of("type", "string")),
                        "required", List.of("summary")))
                .prompt(buildNarrativePrompt(objective, trajectory, finalText))
                .build();
        try {
            String raw = abortSignal.await(llmPort.generateStructured(request), properties.getLlm().getTimeout());
            ObjectNode node = reader.readObject(raw);
            String summary = node.path("summary").asText("");
            return summary.isBlank() ? Optional.empty() : Optional.of(summary);
        } catch (CancellationException e) {
            log.debug("[Summarizer] Narrative cancelled");
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException | TimeoutException | JsonProcessingException | RuntimeException e) {
            log.warn("[Summarizer] Narrative generation failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private String buildNarrativePrompt(String objective, List<ExecutionStep> trajectory, String finalText) {
        StringBuilder sb = new StringBuilder();
        sb.append("Summarize in two or three sentences what this browser automation run achieved.\n\n");
        sb.append("Objective: ").append(objective).append("\n\nSteps:\n");
        List<ExecutionStep> steps = trajectory != null ? trajectory : List.of();
        int from = Math.max(0, steps.size() - MAX_NARRATIVE_STEPS);
        for (ExecutionStep step : steps.subList(from, steps.size())) {
            sb.append("- ").append(step.step()).append(". ").append(step.action());
            if (step.target() != null) {
                sb.append(' ').append(step.target());
            }
            sb.append(step.success() ? " (ok)" : " (failed)").append('\n');
        }
        if (finalText != null && !finalText.isBlank()) {
            sb.append("\nAgent's final message:\n").append(finalText).append('\n');
        }
        return sb.toString();
    }

    private static String statusLine(OutcomeStatus status) {
        return switch (status) {
        case SUCCESS -> "✅ Status: Success";
        case PARTIAL -> "⚠️ Status: Partial";
        case FAILED -> "❌ Status: Failed";
        };
    }

    private static String topline(OutcomeStatus status, boolean aborted) {
        if (aborted) {
            return "Execution was aborted before the objective could be confirmed.";
        }
        return switch (status) {
        case SUCCESS -> "Execution completed successfully and page context is available.";
        case PARTIAL -> "Execution partially completed. Some required steps were omitted or failed.";
        case FAILED -> "Execution did not complete as requested. Review the steps and retry.";
        };
    }

    private static String nextSteps(OutcomeStatus status) {
        return switch (status) {
        case SUCCESS -> "Next Steps:\n"
                + "- Proceed with analysis/report consumption.\n"
                + "- Optionally capture a screenshot for audit.";
        case PARTIAL -> "Next Steps:\n"
                + "- Confirm the page context is gathered after navigation.\n"
                + "- Add an explicit verification step for the natural language report.\n"
                + "- Re-run with improved checks for required elements.";
        case FAILED -> "Next Steps:\n"
                + "- Verify target URL and connectivity.\n"
                + "- Add error handling + retry on navigation.\n"
                + "- Skip dependent steps when the page is not ready.\n"
                + "- Re-run the full flow after adjustments.";
        };
    }
}
