package me.golemcore.pilot.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActionCallStateTest {

    private static final Instant STARTED = Instant.parse("2026-02-14T00:00:00Z");

    @Test
    void shouldOnlyMoveForward() {
        for (ActionCallState from : ActionCallState.values()) {
            for (ActionCallState to : ActionCallState.values()) {
                boolean allowed = from.canTransitionTo(to);
                boolean expected = (from == ActionCallState.INPUT_STREAMING && to == ActionCallState.INPUT_AVAILABLE)
                        || (from == ActionCallState.INPUT_AVAILABLE && to.isTerminal());
                assertEquals(expected, allowed, from + " -> " + to);
            }
        }
    }

    @Test
    void shouldUseWireNames() {
        assertEquals("input-streaming", ActionCallState.INPUT_STREAMING.getWireName());
        assertEquals("output-error", ActionCallState.OUTPUT_ERROR.getWireName());
    }

    @Test
    void shouldRejectOutputBeforeInputAvailable() {
        ActionCallRecord callRecord = new ActionCallRecord("c1", "navigate", STARTED);

        assertThrows(IllegalStateException.class,
                () -> callRecord.complete(CallOutcome.success(null), STARTED.plusMillis(5)));
        assertEquals(ActionCallState.INPUT_STREAMING, callRecord.getState());
    }

    @Test
    void shouldRecordDurationOnCompletion() {
        ActionCallRecord callRecord = new ActionCallRecord("c1", "navigate", STARTED);
        callRecord.setArgs(Map.of("url", "https://a.test"));
        callRecord.transitionTo(ActionCallState.INPUT_AVAILABLE, STARTED);

        callRecord.complete(CallOutcome.success("ok"), STARTED.plusMillis(250));

        ActionCallView view = callRecord.toView();
        assertEquals(ActionCallState.OUTPUT_AVAILABLE, view.state());
        assertEquals(250L, view.durationMs());
        assertEquals("ok", view.output());
        assertFalse(view.repaired());
    }

    @Test
    void shouldTreatOnlyExplicitFailureAsFailure() {
        assertTrue(CallOutcome.fromResult(null).success());
        assertTrue(CallOutcome.fromResult(ToolResult.success("done")).success());
        CallOutcome failed = CallOutcome.fromResult(ToolResult.failure("boom"));
        assertFalse(failed.success());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, failed.failureKind());
        assertEquals("boom", failed.errorText());
    }
}
