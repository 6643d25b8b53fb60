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

import me.golemcore.pilot.domain.model.ActionCall;
import me.golemcore.pilot.domain.model.CallOutcome;
import me.golemcore.pilot.domain.model.ToolFailureKind;

/**
 * Outcome of one action call as written back to the transcript.
 *
 * @param synthetic
 *            true when no executor ran (unknown action, invalid arguments,
 *            abort)
 */
public record ToolExecutionOutcome(String toolCallId, String toolName, CallOutcome outcome, String messageContent,
        boolean synthetic) {

    public static ToolExecutionOutcome synthetic(ActionCall call, ToolFailureKind kind, String reason) {
        return new ToolExecutionOutcome(call.id(), call.name(), CallOutcome.failure(kind, reason),
                "Error: " + reason, true);
    }

    public boolean success() {
        return outcome != null && outcome.success();
    }
}
