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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.pilot.domain.component.ToolRegistry;
import me.golemcore.pilot.domain.model.AbortSignal;
import me.golemcore.pilot.domain.model.ExecutionStep;
import me.golemcore.pilot.domain.model.Message;
import me.golemcore.pilot.domain.model.PlanningResult;
import me.golemcore.pilot.domain.model.RecoveryQuery;
import me.golemcore.pilot.domain.model.RunContext;
import me.golemcore.pilot.domain.model.RunOutcome;
import me.golemcore.pilot.domain.model.RuntimeEventType;
import me.golemcore.pilot.domain.model.StateSnapshot;
import me.golemcore.pilot.domain.model.SummaryReport;
import me.golemcore.pilot.domain.system.toolloop.ToolLoopRequest;
import me.golemcore.pilot.domain.system.toolloop.ToolLoopRunResult;
import me.golemcore.pilot.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.port.outbound.ConversationStorePort;
import me.golemcore.pilot.tools.TaskBoardTool;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point of the orchestrator: runs planner, tool loop and summarizer for
 * an objective and retries once when the run ends gracefully without
 * completing the task.
 *
 * <p>
 * A retry happens only when all of these hold:
 * <ul>
 * <li>the first run was not aborted and {@code taskCompleted} is false</li>
 * <li>the objective does not carry the retry marker</li>
 * <li>the context is a first attempt ({@code attempt == 0})</li>
 * </ul>
 * The retry runs with a marker-prefixed objective, a fresh task board, the
 * first run's final state as initial context and its trajectory as prior
 * steps for the first-turn state check. Exceptions from any stage
 * propagate to the caller and never trigger a retry.
 */
@Service
@Slf4j
public class RetryCoordinator {

    private final PlannerService plannerService;
    private final PlanInstructionFormatter instructionFormatter;
    private final ToolLoopSystem toolLoopSystem;
    private final SummarizerService summarizerService;
    private final RecoveryQueryService recoveryQueryService;
    private final ConversationStorePort conversationStore;
    private final RuntimeEventService runtimeEventService;
    private final ToolRegistry defaultRegistry;
    private final PilotProperties properties;
    private final Clock clock;

    public RetryCoordinator(PlannerService plannerService, PlanInstructionFormatter instructionFormatter,
            ToolLoopSystem toolLoopSystem, SummarizerService summarizerService,
            RecoveryQueryService recoveryQueryService, ConversationStorePort conversationStore,
            RuntimeEventService runtimeEventService, ToolRegistry defaultRegistry, PilotProperties properties,
            Clock clock) {
        this.plannerService = plannerService;
        this.instructionFormatter = instructionFormatter;
        this.toolLoopSystem = toolLoopSystem;
        this.summarizerService = summarizerService;
        this.recoveryQueryService = recoveryQueryService;
        this.conversationStore = conversationStore;
        this.runtimeEventService = runtimeEventService;
        this.defaultRegistry = defaultRegistry;
        this.properties = properties;
        this.clock = clock;
    }

    public RunOutcome execute(String objective) {
        return execute(objective, null);
    }

    public RunOutcome execute(String objective, RunContext context) {
        if (objective == null || objective.isBlank()) {
            throw new IllegalArgumentException("Objective must not be blank");
        }
        RunContext ctx = context != null ? context : RunContext.builder().build();
        if (ctx.getConversationId() == null) {
            ctx = ctx.toBuilder().conversationId(UUID.randomUUID().toString()).build();
        }
        if (ctx.getAbortSignal() == null) {
            ctx = ctx.toBuilder().abortSignal(AbortSignal.create()).build();
        }
        AbortSignal abortSignal = ctx.getAbortSignal();

        RunOutcome first = runOnce(objective, ctx, List.of());
        if (!shouldRetry(objective, ctx, first)) {
            return first;
        }

        RecoveryQuery recovery = recoveryQueryService.recover(objective, first.getTrajectory(),
                first.getSummary(), finalUrl(first), abortSignal);
        if (abortSignal.isAborted()) {
            log.info("[Retry] Run {} aborted during recovery, not retrying", first.getRunId());
            first.setSuccess(false);
            first.setError(abortError(abortSignal));
            return first;
        }
        log.info("[Retry] Run {} incomplete ({}), retrying with adjusted objective{}", first.getRunId(),
                first.getStatus().getWireName(), recovery.fallback() ? " (deterministic)" : "");
        emit(first.getRunId(), RuntimeEventType.RETRY_STARTED, Map.of(
                "status", first.getStatus().getWireName(),
                "deterministic", recovery.fallback()));

        StateSnapshot carried = first.getFinalTargetState() != null
                ? first.getFinalTargetState()
                : ctx.getInitialState();
        RunContext retryContext = ctx.toBuilder()
                .attempt(ctx.getAttempt() + 1)
                .initialState(carried)
                .build();
        RunOutcome second = runOnce(recovery.adjustedObjective(), retryContext, first.getTrajectory());
        second.setRetried(true);
        second.setRecoveryQuery(recovery);
        return second;
    }

    private boolean shouldRetry(String objective, RunContext ctx, RunOutcome outcome) {
        if (!properties.getRetry().isEnabled() || outcome.isTaskCompleted()) {
            return false;
        }
        if (!outcome.isSuccess()) {
            log.info("[Retry] Run {} was aborted, not retrying", outcome.getRunId());
            return false;
        }
        if (objective.contains(properties.getRetry().getMarker()) || ctx.getAttempt() > 0) {
            log.info("[Retry] Run {} is already a retry, returning its outcome", outcome.getRunId());
            return false;
        }
        return true;
    }

    private RunOutcome runOnce(String objective, RunContext ctx, List<ExecutionStep> priorSteps) {
        String runId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        AbortSignal abortSignal = ctx.getAbortSignal();
        emit(runId, RuntimeEventType.RUN_STARTED, Map.of("attempt", ctx.getAttempt()));

        PlanningResult planning = plannerService.plan(objective, ctx.getInitialState(), abortSignal);
        emit(runId, RuntimeEventType.PLANNING_COMPLETE, Map.of(
                "steps", planning.getPlan().getSteps().size(),
                "fallback", planning.isFallback(),
                "confidence", planning.getConfidence()));

        TaskBoard taskBoard = new TaskBoard();
        ToolRegistry registry = (ctx.getRegistry() != null ? ctx.getRegistry() : defaultRegistry)
                .withTool(new TaskBoardTool(taskBoard));

        ToolLoopRunResult loop = toolLoopSystem.run(ToolLoopRequest.builder()
                .runId(runId)
                .conversationId(ctx.getConversationId())
                .objective(objective)
                .systemPrompt(instructionFormatter.format(planning.getPlan()))
                .registry(registry)
                .taskBoard(taskBoard)
                .initialState(ctx.getInitialState())
                .priorSteps(priorSteps)
                .abortSignal(abortSignal)
                .build());

        Duration duration = Duration.between(startedAt, clock.instant());
        boolean aborted = loop.aborted();
        String narrative = aborted
                ? loop.finalText()
                : summarizerService.generateNarrative(objective, loop.trajectory(), loop.finalText(), abortSignal)
                        .orElse(loop.finalText());
        SummaryReport report = summarizerService.summarize(loop.trajectory(), loop.finalState(), narrative,
                duration, aborted);
        pushSummary(ctx.getConversationId(), runId, report);
        emit(runId, RuntimeEventType.SUMMARY_READY, Map.of(
                "status", report.getStatus().getWireName(),
                "taskCompleted", report.isTaskCompleted()));

        RunOutcome outcome = RunOutcome.builder()
                .runId(runId)
                .objective(objective)
                .success(!aborted)
                .plan(planning.getPlan())
                .planFallback(planning.isFallback())
                .trajectory(loop.trajectory())
                .toolExecutions(loop.toolExecutions())
                .tasks(loop.tasks())
                .usage(loop.usage())
                .finishReason(loop.finishReason())
                .stopReason(loop.stopReason().getWireName())
                .duration(duration)
                .summary(report.getSummary())
                .status(report.getStatus())
                .taskCompleted(report.isTaskCompleted())
                .finalTargetState(loop.finalState())
                .error(aborted ? abortError(abortSignal) : null)
                .attempt(ctx.getAttempt())
                .build();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", report.getStatus().getWireName());
        payload.put("taskCompleted", report.isTaskCompleted());
        payload.put("steps", loop.trajectory().size());
        payload.put("durationMs", duration.toMillis());
        emit(runId, RuntimeEventType.RUN_FINISHED, payload);
        log.info("[Retry] Run {} (attempt {}) finished: {}, taskCompleted={}", runId, ctx.getAttempt(),
                report.getStatus().getWireName(), report.isTaskCompleted());
        return outcome;
    }

    private void pushSummary(String conversationId, String runId, SummaryReport report) {
        try {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("runId", runId);
            metadata.put("status", report.getStatus().getWireName());
            metadata.put("taskCompleted", report.isTaskCompleted());
            conversationStore.push(conversationId, Message.builder()
                    .role(Message.ROLE_ASSISTANT)
                    .content(report.getSummary())
                    .metadata(metadata)
                    .timestamp(clock.instant())
                    .build());
        } catch (Exception e) { // NOSONAR - conversation updates are best effort
            log.warn("[Retry] Failed to push summary message: {}", e.getMessage());
        }
    }

    private static String abortError(AbortSignal abortSignal) {
        return "Run aborted: " + abortSignal.getReason();
    }

    private static String finalUrl(RunOutcome outcome) {
        return outcome.getFinalTargetState() != null ? outcome.getFinalTargetState().url() : null;
    }

    private void emit(String runId, RuntimeEventType type, Map<String, Object> payload) {
        runtimeEventService.emit(runId, type, payload);
    }
}
