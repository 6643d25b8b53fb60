package me.golemcore.pilot.domain.system.toolloop;

import me.golemcore.pilot.domain.model.ExecutionStep;
import me.golemcore.pilot.domain.model.LlmUsage;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StopConditionGuardTest {

    private static final Instant NOW = Instant.parse("2026-02-14T00:00:00Z");

    private final StopConditionGuard guard = new StopConditionGuard(3, 3, 100, Set.of("navigate"));

    private static ExecutionStep step(int index, String action, String target) {
        return new ExecutionStep(index, action, target, true, NOW);
    }

    @Test
    void shouldStopOnlyWhenFailuresExceedMaximum() {
        for (int i = 0; i < 3; i++) {
            guard.recordCall(false);
        }
        assertNull(guard.evaluate(List.of(), LlmUsage.empty()));

        guard.recordCall(false);

        assertEquals(StopReason.CONSECUTIVE_FAILURES, guard.evaluate(List.of(), LlmUsage.empty()));
    }

    @Test
    void shouldResetFailureStreakOnSuccess() {
        guard.recordCall(false);
        guard.recordCall(false);
        guard.recordCall(true);

        assertEquals(0, guard.getConsecutiveFailures());
    }

    @Test
    void shouldDetectRepeatedNavigationTargetsAcrossOtherActions() {
        List<ExecutionStep> trajectory = List.of(
                step(1, "navigate", "https://a.test"),
                step(2, "getPageContext", "https://a.test"),
                step(3, "navigate", "https://a.test"),
                step(4, "click", null),
                step(5, "navigate", "https://a.test"));

        assertEquals(StopReason.LOOP_DETECTED, guard.evaluate(trajectory, LlmUsage.empty()));
    }

    @Test
    void shouldNotDetectLoopForDistinctOrMissingTargets() {
        assertFalse(guard.isLooping(List.of(
                step(1, "navigate", "https://a.test"),
                step(2, "navigate", "https://b.test"),
                step(3, "navigate", "https://a.test"))));
        assertFalse(guard.isLooping(List.of(
                step(1, "navigate", null),
                step(2, "navigate", null),
                step(3, "navigate", null))));
        assertFalse(guard.isLooping(List.of(
                step(1, "navigate", "https://a.test"),
                step(2, "navigate", "https://a.test"))));
    }

    @Test
    void shouldStopWhenTokenBudgetExceeded() {
        assertNull(guard.evaluate(List.of(), LlmUsage.of(60, 40)));
        assertEquals(StopReason.TOKEN_BUDGET, guard.evaluate(List.of(), LlmUsage.of(60, 41)));
    }

    @Test
    void shouldIgnoreNonNavigationRepeats() {
        assertTrue(guard.evaluate(List.of(
                step(1, "click", "#a"),
                step(2, "click", "#a"),
                step(3, "click", "#a")), LlmUsage.empty()) == null);
    }
}
