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

import lombok.Builder;
import me.golemcore.pilot.domain.component.ToolRegistry;
import me.golemcore.pilot.domain.model.AbortSignal;
import me.golemcore.pilot.domain.model.ExecutionStep;
import me.golemcore.pilot.domain.model.StateSnapshot;
import me.golemcore.pilot.domain.service.TaskBoard;

import java.util.List;

/**
 * Input for one tool loop run.
 *
 * @param runId
 *            correlation id for logs and telemetry
 * @param conversationId
 *            conversation receiving the live assistant message
 * @param objective
 *            user objective, sent as the first user message
 * @param systemPrompt
 *            rendered plan instructions
 * @param registry
 *            full action set offered on every turn
 * @param taskBoard
 *            per-run task board whose snapshot is attached to the live message,
 *            may be null
 * @param initialState
 *            environment state before the run, may be null
 * @param priorSteps
 *            trajectory carried over from earlier work, consulted by the
 *            first-turn state check
 * @param abortSignal
 *            cancellation signal
 */
@Builder
public record ToolLoopRequest(
        String runId,
        String conversationId,
        String objective,
        String systemPrompt,
        ToolRegistry registry,
        TaskBoard taskBoard,
        StateSnapshot initialState,
        List<ExecutionStep> priorSteps,
        AbortSignal abortSignal) {

    public ToolLoopRequest {
        registry = registry != null ? registry : ToolRegistry.empty();
        priorSteps = priorSteps != null ? List.copyOf(priorSteps) : List.of();
        abortSignal = abortSignal != null ? abortSignal : AbortSignal.create();
    }
}
