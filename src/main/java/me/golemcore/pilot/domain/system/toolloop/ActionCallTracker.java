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
import me.golemcore.pilot.domain.model.ActionCallRecord;
import me.golemcore.pilot.domain.model.ActionCallState;
import me.golemcore.pilot.domain.model.ActionCallView;
import me.golemcore.pilot.domain.model.CallOutcome;
import me.golemcore.pilot.domain.model.ExecutionStep;
import me.golemcore.pilot.domain.model.StateSnapshot;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-run call bookkeeping: the state of every action call and the trajectory.
 *
 * <p>
 * A trajectory entry is appended exactly once per call, when the call becomes
 * input-available, and backfilled when it reaches a terminal state. Entries are
 * never removed or reordered.
 */
public class ActionCallTracker {

    private final Clock clock;
    private final String stateCheckTool;
    private final Map<String, ActionCallRecord> records = new LinkedHashMap<>();
    private final List<ExecutionStep> trajectory = new ArrayList<>();
    private StateSnapshot finalState;

    public ActionCallTracker(Clock clock, String stateCheckTool) {
        this.clock = clock;
        this.stateCheckTool = stateCheckTool;
    }

    /**
     * Records that the model started streaming arguments for a call.
     */
    public ActionCallRecord streaming(String id, String name) {
        return records.computeIfAbsent(id, key -> new ActionCallRecord(key, name, clock.instant()));
    }

    /**
     * Returns true when {@code id} belongs to a call that already left the
     * streaming phase, so a new emission with the same id is a different call.
     */
    public boolean isSettled(String id) {
        ActionCallRecord existing = records.get(id);
        return existing != null && existing.getState() != ActionCallState.INPUT_STREAMING;
    }

    /**
     * Moves a call to input-available and appends its trajectory placeholder.
     */
    public ActionCallRecord inputAvailable(ActionCall call) {
        ActionCallRecord callRecord = records.computeIfAbsent(call.id(),
                key -> new ActionCallRecord(key, call.name(),
                        call.startedAt() != null ? call.startedAt() : clock.instant()));
        callRecord.setArgs(call.args());
        callRecord.transitionTo(ActionCallState.INPUT_AVAILABLE, clock.instant());

        trajectory.add(new ExecutionStep(trajectory.size() + 1, call.name(), resolveTarget(call.args(), null),
                false, clock.instant()));
        callRecord.setTrajectoryIndex(trajectory.size() - 1);
        return callRecord;
    }

    public void repaired(String id, Map<String, Object> args) {
        require(id).markRepaired(args);
    }

    /**
     * Moves a call to its terminal state and backfills the trajectory entry.
     */
    public ExecutionStep complete(String id, CallOutcome outcome) {
        ActionCallRecord callRecord = require(id);
        callRecord.complete(outcome, clock.instant());

        int index = callRecord.getTrajectoryIndex();
        ExecutionStep updated = trajectory.get(index)
                .withResult(resolveTarget(callRecord.getArgs(), outcome.output()), outcome.success());
        trajectory.set(index, updated);

        if (outcome.success() && callRecord.getName().equals(stateCheckTool)) {
            StateSnapshot snapshot = StateSnapshot.fromData(outcome.output());
            if (snapshot != null && snapshot.isConfirmedLocation()) {
                finalState = snapshot;
            }
        }
        return updated;
    }

    public List<ActionCallRecord> pendingCalls() {
        List<ActionCallRecord> pending = new ArrayList<>();
        for (ActionCallRecord callRecord : records.values()) {
            if (callRecord.getState() == ActionCallState.INPUT_AVAILABLE) {
                pending.add(callRecord);
            }
        }
        return pending;
    }

    public Optional<ActionCallRecord> find(String id) {
        return Optional.ofNullable(records.get(id));
    }

    public List<ExecutionStep> trajectory() {
        return List.copyOf(trajectory);
    }

    public List<ActionCallView> views() {
        List<ActionCallView> views = new ArrayList<>(records.size());
        for (ActionCallRecord callRecord : records.values()) {
            views.add(callRecord.toView());
        }
        return views;
    }

    public Optional<StateSnapshot> finalState() {
        return Optional.ofNullable(finalState);
    }

    /**
     * Target of a trajectory entry: {@code args.url}, else the result's
     * {@code url}, else the result's {@code pageContext.url}.
     */
    static String resolveTarget(Map<String, Object> args, Object output) {
        if (args != null && args.get("url") instanceof String url && !url.isBlank()) {
            return url;
        }
        if (output instanceof StateSnapshot snapshot) {
            return snapshot.url();
        }
        if (output instanceof Map<?, ?> data) {
            if (data.get("url") instanceof String url && !url.isBlank()) {
                return url;
            }
            if (data.get("pageContext") instanceof Map<?, ?> pageContext
                    && pageContext.get("url") instanceof String url && !url.isBlank()) {
                return url;
            }
        }
        return null;
    }

    private ActionCallRecord require(String id) {
        ActionCallRecord callRecord = records.get(id);
        if (callRecord == null) {
            throw new IllegalStateException("Unknown action call: " + id);
        }
        return callRecord;
    }
}
