package me.golemcore.pilot.domain.model;

/**
 * Machine-readable classification of action call failures.
 *
 * <p>
 * This exists to avoid relying on string matching in executor error messages.
 */
public enum ToolFailureKind {

    /**
     * The model named an action that is not registered. Never repaired.
     */
    UNKNOWN_TOOL,

    /**
     * Arguments failed schema validation and the single repair attempt did not
     * produce valid arguments.
     */
    INVALID_ARGUMENTS,

    /**
     * Executor threw, timed out, or returned a result with success=false.
     */
    EXECUTION_FAILED,

    /**
     * The run was cancelled while the call was pending.
     */
    ABORTED
}
