package com.stealthprompt.api.dto;

/**
 * Operator verdict on a flagged reply.
 */
public enum ConfirmationDecision {
    /** Real leak: persist the chain and end the test as a success. */
    CONFIRMED,
    /** Not a leak: clear the flag and keep going. */
    FALSE_POSITIVE,
    /** Undecided: clear the flag for this turn only, nothing persisted. */
    CONTINUE
}
