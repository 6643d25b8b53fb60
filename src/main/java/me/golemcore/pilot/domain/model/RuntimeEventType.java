package me.golemcore.pilot.domain.model;

import java.util.Locale;

/**
 * Telemetry events emitted during a run. Wire names are the lower-case enum
 * names.
 */
public enum RuntimeEventType {
    RUN_STARTED,
    PLANNING_COMPLETE,
    TURN_STARTED,
    TURN_FINISHED,
    TOOL_CALL_STARTED,
    TOOL_CALL_FINISHED,
    LOOP_STOPPED,
    SUMMARY_READY,
    RETRY_STARTED,
    RUN_FINISHED;

    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
