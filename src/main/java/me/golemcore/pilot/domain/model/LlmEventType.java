package me.golemcore.pilot.domain.model;

/**
 * Kinds of events in a model response stream.
 */
public enum LlmEventType {
    TEXT_DELTA,
    CALL_STREAMING,
    CALL_EMITTED,
    FINISH
}
