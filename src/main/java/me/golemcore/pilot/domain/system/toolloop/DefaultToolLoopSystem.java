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

import me.golemcore.pilot.domain.component.ToolComponent;
import me.golemcore.pilot.domain.component.ToolRegistry;
import me.golemcore.pilot.domain.model.AbortSignal;
import me.golemcore.pilot.domain.model.ActionCall;
import me.golemcore.pilot.domain.model.ActionCallRecord;
import me.golemcore.pilot.domain.model.CallOutcome;
import me.golemcore.pilot.domain.model.ExecutionStep;
import me.golemcore.pilot.domain.model.LlmEvent;
import me.golemcore.pilot.domain.model.LlmRequest;
import me.golemcore.pilot.domain.model.LlmUsage;
import me.golemcore.pilot.domain.model.Message;
import me.golemcore.pilot.domain.model.RunFailureException;
import me.golemcore.pilot.domain.model.RuntimeEventType;
import me.golemcore.pilot.domain.model.StateSnapshot;
import me.golemcore.pilot.domain.model.Task;
import me.golemcore.pilot.domain.model.ToolChoice;
import me.golemcore.pilot.domain.model.ToolFailureKind;
import me.golemcore.pilot.domain.model.ToolResult;
import me.golemcore.pilot.domain.service.RuntimeEventService;
import me.golemcore.pilot.domain.system.LlmErrorClassifier;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.port.outbound.ConversationStorePort;
import me.golemcore.pilot.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Multi-turn tool loop.
 *
 * <p>
 * Each turn: 1) the model stream is consumed until it finishes, collecting
 * text and emitted calls, 2) every emitted call is recorded as input-available
 * with a trajectory placeholder, 3) calls run one at a time in emission order
 * and their results are written back, 4) the live conversation message is
 * updated once, 5) stop conditions are checked. The loop ends when the model
 * answers without calls, a guard trips, or the run is aborted.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    private static final String CONTINUE_PROMPT = "Continue from where you stopped.";
    private static final int MAX_TARGET_LOG_LENGTH = 200;

    private final LlmPort llmPort;
    private final HistoryWriter historyWriter;
    private final ToolArgumentValidator argumentValidator;
    private final ToolCallRepairer callRepairer;
    private final ConversationStorePort conversationStore;
    private final RuntimeEventService runtimeEventService;
    private final PilotProperties.ToolLoopProperties settings;
    private final PilotProperties.LlmProperties llmSettings;
    private final Clock clock;

    public DefaultToolLoopSystem(LlmPort llmPort, HistoryWriter historyWriter,
            ToolArgumentValidator argumentValidator, ToolCallRepairer callRepairer,
            ConversationStorePort conversationStore, RuntimeEventService runtimeEventService,
            PilotProperties.ToolLoopProperties settings, PilotProperties.LlmProperties llmSettings) {
        this(llmPort, historyWriter, argumentValidator, callRepairer, conversationStore, runtimeEventService,
                settings, llmSettings, Clock.systemUTC());
    }

    // Visible for testing
    public DefaultToolLoopSystem(LlmPort llmPort, HistoryWriter historyWriter,
            ToolArgumentValidator argumentValidator, ToolCallRepairer callRepairer,
            ConversationStorePort conversationStore, RuntimeEventService runtimeEventService,
            PilotProperties.ToolLoopProperties settings, PilotProperties.LlmProperties llmSettings, Clock clock) {
        this.llmPort = llmPort;
        this.historyWriter = historyWriter;
        this.argumentValidator = argumentValidator;
        this.callRepairer = callRepairer;
        this.conversationStore = conversationStore;
        this.runtimeEventService = runtimeEventService;
        this.settings = settings != null ? settings : new PilotProperties.ToolLoopProperties();
        this.llmSettings = llmSettings != null ? llmSettings : new PilotProperties.LlmProperties();
        this.clock = clock;
    }

    @Override
    public ToolLoopRunResult run(ToolLoopRequest request) {
        String runId = request.runId();
        AbortSignal abortSignal = request.abortSignal();
        ToolRegistry registry = request.registry();

        ActionCallTracker tracker = new ActionCallTracker(clock, settings.getStateCheckTool());
        StopConditionGuard guard = new StopConditionGuard(settings.getMaxConsecutiveFailures(),
                settings.getLoopGuardRepeats(), settings.getTokenBudget(), navigationTools());
        List<Message> transcript = new ArrayList<>();
        historyWriter.appendUserMessage(transcript, buildObjectiveMessage(request));

        StringBuilder visibleText = new StringBuilder();
        pushLiveMessage(request, runId);

        LlmUsage usage = LlmUsage.empty();
        String finishReason = null;
        String finalText = null;
        StopReason stopReason = null;
        int turn = 0;

        while (stopReason == null) {
            if (abortSignal.isAborted()) {
                stopReason = StopReason.ABORTED;
                break;
            }
            if (turn >= settings.getMaxTurns()) {
                stopReason = StopReason.STEP_CEILING;
                break;
            }

            LlmRequest llmRequest = buildRequest(request, transcript, turn);
            emit(runId, RuntimeEventType.TURN_STARTED, Map.of("turn", turn,
                    "toolChoice", llmRequest.getToolChoice().name()));

            TurnCapture capture = consumeTurn(llmRequest, tracker, abortSignal, turn);
            usage = usage.plus(capture.usage);
            finishReason = capture.finishReason;
            if (!capture.text.isEmpty()) {
                visibleText.append(capture.text);
            }

            if (abortSignal.isAborted()) {
                if (!capture.calls.isEmpty()) {
                    for (ActionCall call : capture.calls) {
                        tracker.inputAvailable(call);
                    }
                    historyWriter.appendAssistantToolCalls(transcript, capture.text.toString(), capture.calls);
                }
                abortPending(tracker, transcript, capture.calls);
                stopReason = StopReason.ABORTED;
                flush(request, visibleText, tracker);
                break;
            }

            if (capture.calls.isEmpty()) {
                String text = capture.text.toString();
                historyWriter.appendFinalAssistantAnswer(transcript, text);
                finalText = text.isBlank() ? finalText : text;
                flush(request, visibleText, tracker);
                emitTurnFinished(runId, turn, 0, usage);
                turn++;
                if (LlmEvent.FINISH_LENGTH.equals(capture.finishReason)) {
                    historyWriter.appendUserMessage(transcript, CONTINUE_PROMPT);
                    continue;
                }
                stopReason = StopReason.NO_MORE_CALLS;
                break;
            }

            List<ActionCallRecord> turnRecords = new ArrayList<>(capture.calls.size());
            for (ActionCall call : capture.calls) {
                turnRecords.add(tracker.inputAvailable(call));
            }
            historyWriter.appendAssistantToolCalls(transcript, capture.text.toString(), capture.calls);

            for (ActionCall call : capture.calls) {
                if (abortSignal.isAborted()) {
                    break;
                }
                ToolExecutionOutcome outcome = executeCall(runId, call, registry, tracker, abortSignal);
                ExecutionStep step = tracker.complete(call.id(), outcome.outcome());
                historyWriter.appendToolResult(transcript, outcome);
                guard.recordCall(outcome.success());
                emit(runId, RuntimeEventType.TOOL_CALL_FINISHED, toolFinishedPayload(call, outcome, step));
            }

            if (abortSignal.isAborted()) {
                abortPending(tracker, transcript, capture.calls);
                flush(request, visibleText, tracker);
                stopReason = StopReason.ABORTED;
                break;
            }

            flush(request, visibleText, tracker);
            emitTurnFinished(runId, turn, turnRecords.size(), usage);
            turn++;
            stopReason = guard.evaluate(tracker.trajectory(), usage);
        }

        List<ExecutionStep> trajectory = tracker.trajectory();
        log.info("[ToolLoop] Run {} stopped: {} after {} turn(s), {} step(s), {} tokens", runId,
                stopReason.getWireName(), turn, trajectory.size(), usage.getTotalTokens());
        emit(runId, RuntimeEventType.LOOP_STOPPED, Map.of(
                "reason", stopReason.getWireName(),
                "turns", turn,
                "steps", trajectory.size(),
                "totalTokens", usage.getTotalTokens()));

        String resolvedFinish = stopReason == StopReason.ABORTED ? "aborted" : finishReason;
        StateSnapshot finalState = tracker.finalState().orElse(null);
        return new ToolLoopRunResult(trajectory, List.copyOf(transcript), tracker.views(), taskSnapshot(request),
                usage, resolvedFinish, stopReason, finalText, finalState, turn);
    }

    private TurnCapture consumeTurn(LlmRequest llmRequest, ActionCallTracker tracker, AbortSignal abortSignal,
            int turn) {
        TurnCapture capture = new TurnCapture();
        Set<String> emittedIds = new HashSet<>();
        try {
            Iterable<LlmEvent> events = llmPort.issue(llmRequest)
                    .takeUntilOther(abortSignal.whenAborted())
                    .toIterable();
            for (LlmEvent event : events) {
                switch (event.type()) {
                case TEXT_DELTA -> {
                    if (event.text() != null) {
                        capture.text.append(event.text());
                    }
                }
                case CALL_STREAMING -> {
                    if (event.callId() != null && !tracker.isSettled(event.callId())) {
                        tracker.streaming(event.callId(), toolName(event));
                    }
                }
                case CALL_EMITTED -> {
                    String id = uniqueCallId(event.callId(), tracker, emittedIds, turn, capture.calls.size());
                    emittedIds.add(id);
                    Optional<ActionCallRecord> streamed = tracker.find(id);
                    capture.calls.add(new ActionCall(id, toolName(event), event.arguments(),
                            streamed.map(ActionCallRecord::getStartedAt).orElse(clock.instant())));
                }
                case FINISH -> {
                    capture.finishReason = event.finishReason();
                    capture.usage = capture.usage.plus(event.usage());
                }
                }
            }
        } catch (RuntimeException e) {
            if (abortSignal.isAborted()) {
                log.debug("[ToolLoop] Stream ended by abort: {}", e.getMessage());
                return capture;
            }
            Throwable cause = Exceptions.unwrap(e);
            String code = LlmErrorClassifier.classifyFromThrowable(cause);
            log.warn("[ToolLoop] Model stream failed on turn {} [{}]: {}", turn, code, cause.getMessage());
            throw new RunFailureException(code, LlmErrorClassifier.withCode(code, cause.getMessage()), cause);
        }
        return capture;
    }

    // Providers may emit calls without a name; such calls fail as unknown tools
    private static String toolName(LlmEvent event) {
        return event.toolName() != null ? event.toolName().strip() : "";
    }

    private String uniqueCallId(String rawId, ActionCallTracker tracker, Set<String> emittedIds, int turn,
            int index) {
        String candidate = rawId != null && !rawId.isBlank() ? rawId : "call_" + turn + "_" + index;
        if (!tracker.isSettled(candidate) && !emittedIds.contains(candidate)) {
            return candidate;
        }
        // Some providers reuse ids across turns
        int suffix = 1;
        String unique = candidate + "_" + turn + "_" + suffix;
        while (tracker.isSettled(unique) || emittedIds.contains(unique)) {
            suffix++;
            unique = candidate + "_" + turn + "_" + suffix;
        }
        return unique;
    }

    private ToolExecutionOutcome executeCall(String runId, ActionCall call, ToolRegistry registry,
            ActionCallTracker tracker, AbortSignal abortSignal) {
        Map<String, Object> startedPayload = new LinkedHashMap<>();
        startedPayload.put("callId", call.id());
        startedPayload.put("action", call.name());
        emit(runId, RuntimeEventType.TOOL_CALL_STARTED, startedPayload);

        if (call.name() == null || call.name().isBlank()) {
            log.warn("[ToolLoop] Call {} has no action name", call.id());
            return ToolExecutionOutcome.synthetic(call, ToolFailureKind.UNKNOWN_TOOL,
                    "Unknown tool: call has no name. Available tools: " + String.join(", ", registry.names()));
        }
        Optional<ToolComponent> resolved = registry.find(call.name());
        if (resolved.isEmpty()) {
            log.warn("[ToolLoop] Unknown action '{}' ({})", call.name(), call.id());
            return ToolExecutionOutcome.synthetic(call, ToolFailureKind.UNKNOWN_TOOL,
                    "Unknown tool: " + call.name() + ". Available tools: " + String.join(", ", registry.names()));
        }
        ToolComponent tool = resolved.get();

        ActionCall effective = call;
        List<String> violations = argumentValidator.validate(tool.getDefinition().getInputSchema(), call.args());
        if (!violations.isEmpty()) {
            log.info("[ToolLoop] Invalid arguments for {} ({}): {}", call.name(), call.id(), violations);
            Optional<Map<String, Object>> repaired = callRepairer.repair(call, tool.getDefinition(), violations,
                    abortSignal);
            if (abortSignal.isAborted()) {
                return ToolExecutionOutcome.synthetic(call, ToolFailureKind.ABORTED, "Run aborted");
            }
            List<String> remaining = repaired
                    .map(args -> argumentValidator.validate(tool.getDefinition().getInputSchema(), args))
                    .orElse(violations);
            if (repaired.isEmpty() || !remaining.isEmpty()) {
                return ToolExecutionOutcome.synthetic(call, ToolFailureKind.INVALID_ARGUMENTS,
                        "Invalid arguments for " + call.name() + ": " + String.join("; ", remaining));
            }
            tracker.repaired(call.id(), repaired.get());
            effective = call.withArgs(repaired.get());
        }

        return invoke(tool, effective, abortSignal);
    }

    private ToolExecutionOutcome invoke(ToolComponent tool, ActionCall call, AbortSignal abortSignal) {
        Duration timeout = settings.getToolTimeout();
        try {
            CompletableFuture<ToolResult> future = tool.execute(call.args());
            if (future == null) {
                return outcome(call, null);
            }
            ToolResult result = abortSignal.await(future, timeout);
            return outcome(call, result);
        } catch (CancellationException e) {
            return ToolExecutionOutcome.synthetic(call, ToolFailureKind.ABORTED, "Run aborted");
        } catch (TimeoutException e) {
            return ToolExecutionOutcome.synthetic(call, ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution timed out after " + timeout.toSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolExecutionOutcome.synthetic(call, ToolFailureKind.ABORTED, "Interrupted");
        } catch (ExecutionException | RuntimeException e) {
            log.warn("[ToolLoop] Action {} failed: {}", call.name(), safeCauseMessage(e));
            return ToolExecutionOutcome.synthetic(call, ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + safeCauseMessage(e));
        }
    }

    private ToolExecutionOutcome outcome(ActionCall call, ToolResult result) {
        CallOutcome callOutcome = CallOutcome.fromResult(result);
        return new ToolExecutionOutcome(call.id(), call.name(), callOutcome, buildToolMessageContent(result),
                false);
    }

    private void abortPending(ActionCallTracker tracker, List<Message> transcript, List<ActionCall> turnCalls) {
        for (ActionCallRecord pending : tracker.pendingCalls()) {
            ActionCall call = new ActionCall(pending.getId(), pending.getName(), pending.getArgs(),
                    pending.getStartedAt());
            ToolExecutionOutcome synthetic = ToolExecutionOutcome.synthetic(call, ToolFailureKind.ABORTED,
                    "Run aborted");
            tracker.complete(pending.getId(), synthetic.outcome());
            if (turnCalls.stream().anyMatch(c -> c.id().equals(pending.getId()))) {
                historyWriter.appendToolResult(transcript, synthetic);
            }
        }
    }

    private LlmRequest buildRequest(ToolLoopRequest request, List<Message> transcript, int turn) {
        ToolChoice toolChoice = settings.isRequireToolCall() ? ToolChoice.REQUIRED : ToolChoice.AUTO;
        String forced = null;
        if (turn == 0 && shouldForceStateCheck(request)) {
            toolChoice = ToolChoice.SPECIFIC;
            forced = settings.getStateCheckTool();
            log.debug("[ToolLoop] Pinning {} on first turn", forced);
        }
        return LlmRequest.builder()
                .model(llmSettings.getModel())
                .systemPrompt(request.systemPrompt())
                .messages(new ArrayList<>(transcript))
                .tools(request.registry().definitions())
                .toolChoice(toolChoice)
                .forcedToolName(forced)
                .temperature(llmSettings.getTemperature())
                .runId(request.runId())
                .build();
    }

    /**
     * The first turn is pinned to the state-check action unless some earlier
     * navigation was already followed by a state check.
     */
    boolean shouldForceStateCheck(ToolLoopRequest request) {
        String stateCheckTool = settings.getStateCheckTool();
        if (!settings.isForceStateCheckOnFirstTurn() || !request.registry().contains(stateCheckTool)) {
            return false;
        }
        List<ExecutionStep> prior = request.priorSteps();
        Set<String> navigation = navigationTools();
        int lastNavigation = -1;
        for (int i = 0; i < prior.size(); i++) {
            if (navigation.contains(prior.get(i).action())) {
                lastNavigation = i;
            }
        }
        if (lastNavigation < 0) {
            return true;
        }
        for (int i = lastNavigation + 1; i < prior.size(); i++) {
            if (stateCheckTool.equals(prior.get(i).action())) {
                return false;
            }
        }
        return true;
    }

    private String buildObjectiveMessage(ToolLoopRequest request) {
        StateSnapshot state = request.initialState();
        if (state == null || state.url() == null || state.url().isBlank()) {
            return request.objective();
        }
        StringBuilder sb = new StringBuilder(request.objective());
        sb.append("\n\nCurrent page: ").append(state.url());
        if (state.title() != null && !state.title().isBlank()) {
            sb.append(" (").append(state.title()).append(')');
        }
        return sb.toString();
    }

    private void pushLiveMessage(ToolLoopRequest request, String runId) {
        try {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("runId", runId);
            conversationStore.push(request.conversationId(), Message.builder()
                    .role(Message.ROLE_ASSISTANT)
                    .content("")
                    .toolExecutions(List.of())
                    .tasks(List.of())
                    .metadata(metadata)
                    .timestamp(clock.instant())
                    .build());
        } catch (Exception e) { // NOSONAR - conversation updates are best effort
            log.warn("[ToolLoop] Failed to push live message: {}", e.getMessage());
        }
    }

    private void flush(ToolLoopRequest request, StringBuilder visibleText, ActionCallTracker tracker) {
        String content = visibleText.toString();
        List<Task> tasks = taskSnapshot(request);
        try {
            conversationStore.updateLast(request.conversationId(), last -> last.toBuilder()
                    .content(content)
                    .toolExecutions(tracker.views())
                    .tasks(tasks)
                    .build());
        } catch (Exception e) { // NOSONAR - conversation updates are best effort
            log.warn("[ToolLoop] Failed to update live message: {}", e.getMessage());
        }
    }

    private List<Task> taskSnapshot(ToolLoopRequest request) {
        return request.taskBoard() != null ? request.taskBoard().snapshot() : List.of();
    }

    private Set<String> navigationTools() {
        return settings.getNavigationTools() != null ? Set.copyOf(settings.getNavigationTools()) : Set.of();
    }

    private void emitTurnFinished(String runId, int turn, int calls, LlmUsage usage) {
        emit(runId, RuntimeEventType.TURN_FINISHED, Map.of("turn", turn, "calls", calls,
                "totalTokens", usage.getTotalTokens()));
    }

    private Map<String, Object> toolFinishedPayload(ActionCall call, ToolExecutionOutcome outcome,
            ExecutionStep step) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("callId", call.id());
        payload.put("action", call.name());
        payload.put("success", outcome.success());
        payload.put("step", step.step());
        if (step.target() != null) {
            payload.put("target", truncate(step.target()));
        }
        if (!outcome.success() && outcome.outcome().failureKind() != null) {
            payload.put("failureKind", outcome.outcome().failureKind().name());
        }
        return payload;
    }

    private void emit(String runId, RuntimeEventType type, Map<String, Object> payload) {
        if (runtimeEventService != null) {
            runtimeEventService.emit(runId, type, payload);
        }
    }

    private static String buildToolMessageContent(ToolResult result) {
        if (result == null) {
            return "OK";
        }
        if (result.isSuccess()) {
            return result.getOutput() != null ? result.getOutput() : "OK";
        }
        if (result.getOutput() != null && !result.getOutput().isBlank()) {
            return result.getOutput();
        }
        return "Error: " + result.getError();
    }

    private static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    private static String truncate(String text) {
        return text.length() <= MAX_TARGET_LOG_LENGTH ? text : text.substring(0, MAX_TARGET_LOG_LENGTH) + "...";
    }

    private static final class TurnCapture {
        private final StringBuilder text = new StringBuilder();
        private final List<ActionCall> calls = new ArrayList<>();
        private String finishReason;
        private LlmUsage usage = LlmUsage.empty();
    }
}
