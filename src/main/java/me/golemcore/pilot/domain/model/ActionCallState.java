package me.golemcore.pilot.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of an action call. Transitions only move forward:
 * input-streaming, input-available, then exactly one of output-available or
 * output-error.
 */
public enum ActionCallState {

    INPUT_STREAMING("input-streaming"),
    INPUT_AVAILABLE("input-available"),
    OUTPUT_AVAILABLE("output-available"),
    OUTPUT_ERROR("output-error");

    private final String wireName;

    ActionCallState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == OUTPUT_AVAILABLE || this == OUTPUT_ERROR;
    }

    public boolean canTransitionTo(ActionCallState next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
        case INPUT_STREAMING -> next == INPUT_AVAILABLE;
        case INPUT_AVAILABLE -> next == OUTPUT_AVAILABLE || next == OUTPUT_ERROR;
        case OUTPUT_AVAILABLE, OUTPUT_ERROR -> false;
        };
    }
}
