package com.stealthprompt.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One exchange with the target agent. {@code ordinal} is 1-based.
 */
public record Turn(
        @JsonProperty("turn") int ordinal,
        @JsonProperty("payload") String message,
        @JsonProperty("response") String reply,
        @JsonProperty("sensitive_data_found") boolean sensitive,
        @JsonProperty("explanation") String justification,
        @JsonProperty("verdict_source") VerdictSource source
) {
    public static Turn of(int ordinal, String message, String reply, Verdict verdict) {
        return new Turn(ordinal, message, reply, verdict.sensitive(), verdict.explanation(), verdict.source());
    }
}
