package me.golemcore.pilot.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Deterministic classification of a finished run.
 */
public enum OutcomeStatus {

    SUCCESS,
    PARTIAL,
    FAILED;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
