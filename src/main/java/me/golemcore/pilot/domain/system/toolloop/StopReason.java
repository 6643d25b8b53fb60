package me.golemcore.pilot.domain.system.toolloop;

import java.util.Locale;

/**
 * Why the tool loop stopped.
 */
public enum StopReason {

    /** The model answered without calling any action. */
    NO_MORE_CALLS,

    /** Hard turn ceiling reached. */
    STEP_CEILING,

    /** Too many failed calls in a row. */
    CONSECUTIVE_FAILURES,

    /** The same navigation target repeated. */
    LOOP_DETECTED,

    /** Cumulative token usage crossed the budget. */
    TOKEN_BUDGET,

    /** The caller cancelled the run. */
    ABORTED;

    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
