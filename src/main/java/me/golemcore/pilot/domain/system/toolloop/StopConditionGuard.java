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

import me.golemcore.pilot.domain.model.ExecutionStep;
import me.golemcore.pilot.domain.model.LlmUsage;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Stop conditions evaluated after every turn. Failure counting is per call, in
 * completion order; a success resets the streak.
 */
public class StopConditionGuard {

    private final int maxConsecutiveFailures;
    private final int loopGuardRepeats;
    private final long tokenBudget;
    private final Set<String> navigationTools;

    private int consecutiveFailures;

    public StopConditionGuard(int maxConsecutiveFailures, int loopGuardRepeats, long tokenBudget,
            Set<String> navigationTools) {
        this.maxConsecutiveFailures = maxConsecutiveFailures;
        this.loopGuardRepeats = loopGuardRepeats;
        this.tokenBudget = tokenBudget;
        this.navigationTools = navigationTools;
    }

    public void recordCall(boolean success) {
        consecutiveFailures = success ? 0 : consecutiveFailures + 1;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    /**
     * Returns the reason to stop, or null to keep going.
     */
    public StopReason evaluate(List<ExecutionStep> trajectory, LlmUsage usage) {
        if (consecutiveFailures > maxConsecutiveFailures) {
            return StopReason.CONSECUTIVE_FAILURES;
        }
        if (isLooping(trajectory)) {
            return StopReason.LOOP_DETECTED;
        }
        if (usage != null && tokenBudget > 0 && usage.getTotalTokens() > tokenBudget) {
            return StopReason.TOKEN_BUDGET;
        }
        return null;
    }

    /**
     * True when the last {@code loopGuardRepeats} navigation entries all point at
     * the same target.
     */
    boolean isLooping(List<ExecutionStep> trajectory) {
        if (loopGuardRepeats <= 1) {
            return false;
        }
        List<String> targets = new ArrayList<>();
        for (int i = trajectory.size() - 1; i >= 0 && targets.size() < loopGuardRepeats; i--) {
            ExecutionStep step = trajectory.get(i);
            if (navigationTools.contains(step.action())) {
                targets.add(step.target());
            }
        }
        if (targets.size() < loopGuardRepeats || targets.get(0) == null) {
            return false;
        }
        String first = targets.get(0);
        return targets.stream().allMatch(target -> Objects.equals(first, target));
    }
}
