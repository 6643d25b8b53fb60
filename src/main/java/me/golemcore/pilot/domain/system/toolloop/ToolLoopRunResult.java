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

import me.golemcore.pilot.domain.model.ActionCallView;
import me.golemcore.pilot.domain.model.ExecutionStep;
import me.golemcore.pilot.domain.model.LlmUsage;
import me.golemcore.pilot.domain.model.Message;
import me.golemcore.pilot.domain.model.StateSnapshot;
import me.golemcore.pilot.domain.model.Task;

import java.util.List;

/**
 * Result of a tool loop run. Returned for graceful stops and for aborts; the
 * latter carry the partial trajectory.
 */
public record ToolLoopRunResult(
        List<ExecutionStep> trajectory,
        List<Message> transcript,
        List<ActionCallView> toolExecutions,
        List<Task> tasks,
        LlmUsage usage,
        String finishReason,
        StopReason stopReason,
        String finalText,
        StateSnapshot finalState,
        int turns) {

    public boolean aborted() {
        return stopReason == StopReason.ABORTED;
    }
}
