package com.stealthprompt.api.dto;

/**
 * A flagged turn waiting for the operator.
 */
public record PendingHit(String testType, int turn, String message, String reply, Verdict verdict) {
}
