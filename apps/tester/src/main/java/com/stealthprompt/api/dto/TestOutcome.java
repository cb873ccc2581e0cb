package com.stealthprompt.api.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TestOutcome {
    /** Operator confirmed a leak. */
    SUCCESS,
    /** Hit the turn limit without a confirmed leak. */
    COMPLETED,
    /** Send, receive or generation failed. */
    INCOMPLETE,
    /** Cancelled before or during the test. */
    STOPPED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Ran to a normal end, with or without a finding. */
    public boolean finished() {
        return this == SUCCESS || this == COMPLETED;
    }
}
