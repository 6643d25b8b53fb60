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

import java.time.Instant;

/**
 * One entry of the run trajectory. Appended as a placeholder with
 * {@code success=false} when the call becomes input-available, then backfilled
 * once the call reaches a terminal state.
 *
 * @param step
 *            1-based position in the trajectory
 * @param action
 *            action name
 * @param target
 *            resolved URL or target, may be null
 * @param success
 *            whether the call finished with output-available
 * @param timestamp
 *            when the entry was recorded
 */
public record ExecutionStep(int step, String action, String target, boolean success, Instant timestamp) {

    public ExecutionStep withResult(String resolvedTarget, boolean succeeded) {
        return new ExecutionStep(step, action, resolvedTarget != null ? resolvedTarget : target, succeeded,
                timestamp);
    }
}
