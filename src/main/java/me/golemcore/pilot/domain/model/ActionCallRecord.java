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

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Mutable per-call bookkeeping owned by the tool loop. State changes go through
 * {@link #transitionTo(ActionCallState, Instant)} so the lifecycle can never
 * move backwards.
 */
@Getter
public class ActionCallRecord {

    private final String id;
    private final String name;
    private final Instant startedAt;
    private Map<String, Object> args;
    private ActionCallState state;
    private CallOutcome outcome;
    private Duration duration;
    private boolean repaired;
    private int trajectoryIndex = -1;

    public ActionCallRecord(String id, String name, Instant startedAt) {
        this.id = id;
        this.name = name;
        this.startedAt = startedAt;
        this.state = ActionCallState.INPUT_STREAMING;
        this.args = Map.of();
    }

    public void transitionTo(ActionCallState next, Instant at) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal action call transition " + state.getWireName() + " -> "
                            + (next != null ? next.getWireName() : "null") + " for call " + id);
        }
        state = next;
        if (next.isTerminal() && at != null && startedAt != null) {
            duration = Duration.between(startedAt, at);
        }
    }

    public void setArgs(Map<String, Object> args) {
        this.args = args != null ? args : Map.of();
    }

    public void markRepaired(Map<String, Object> repairedArgs) {
        setArgs(repairedArgs);
        this.repaired = true;
    }

    public void complete(CallOutcome callOutcome, Instant at) {
        transitionTo(callOutcome.success() ? ActionCallState.OUTPUT_AVAILABLE : ActionCallState.OUTPUT_ERROR, at);
        this.outcome = callOutcome;
    }

    public void setTrajectoryIndex(int index) {
        this.trajectoryIndex = index;
    }

    public ActionCallView toView() {
        return new ActionCallView(
                id,
                name,
                state,
                args,
                outcome != null ? outcome.output() : null,
                outcome != null ? outcome.errorText() : null,
                startedAt,
                duration != null ? duration.toMillis() : null,
                repaired);
    }
}
