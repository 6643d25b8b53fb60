package me.golemcore.pilot.domain.model;

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
import lombok.Value;
import me.golemcore.pilot.domain.component.ToolRegistry;

/**
 * Caller-supplied context for a run.
 */
@Value
@Builder(toBuilder = true)
public class RunContext {

    String conversationId;

    /**
     * Environment state before the run, may be null.
     */
    StateSnapshot initialState;

    /**
     * Registered actions. The task board action is added per run.
     */
    ToolRegistry registry;

    @Builder.Default
    AbortSignal abortSignal = AbortSignal.create();

    /**
     * 0 for the first attempt, 1 for the recovery attempt.
     */
    int attempt;
}
