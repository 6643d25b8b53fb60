package me.golemcore.pilot.domain.model;

/**
 * How the model may use the offered actions on a turn.
 */
public enum ToolChoice {

    /** Model decides whether to call actions. */
    AUTO,

    /** Model must call at least one action. */
    REQUIRED,

    /** Model must call {@link LlmRequest#getForcedToolName()}. */
    SPECIFIC
}
