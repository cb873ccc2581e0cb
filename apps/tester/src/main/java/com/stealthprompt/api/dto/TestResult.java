package com.stealthprompt.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class TestResult {

    @JsonProperty("test_type")
    String testType;

    @JsonProperty("status")
    TestOutcome outcome;

    @JsonProperty("conversation")
    Transcript transcript;

    /** Turns attempted, including a failed last one. */
    @JsonProperty("total_turns")
    int totalTurns;

    @JsonProperty("sensitive_data_found")
    boolean sensitiveDataFound;

    /** Id of the chain persisted on confirmation, null otherwise. */
    @JsonProperty("chain_id")
    String chainId;

    @JsonProperty("started_at")
    LocalDateTime startedAt;

    @JsonProperty("timestamp")
    LocalDateTime finishedAt;
}
