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
import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Final result of a run as returned to the caller.
 *
 * <p>
 * {@code success} means the pipeline finished without being aborted.
 * {@code taskCompleted} tells whether the objective was actually met.
 */
@Data
@Builder
public class RunOutcome {

    private String runId;
    private String objective;
    private boolean success;

    private ExecutionPlan plan;
    private boolean planFallback;

    @Builder.Default
    private List<ExecutionStep> trajectory = new ArrayList<>();

    @Builder.Default
    private List<ActionCallView> toolExecutions = new ArrayList<>();

    @Builder.Default
    private List<Task> tasks = new ArrayList<>();

    private LlmUsage usage;
    private String finishReason;
    private String stopReason;
    private Duration duration;

    private String summary;
    private OutcomeStatus status;
    private boolean taskCompleted;
    private StateSnapshot finalTargetState;

    private String error;

    private boolean retried;
    private int attempt;
    private RecoveryQuery recoveryQuery;
}
