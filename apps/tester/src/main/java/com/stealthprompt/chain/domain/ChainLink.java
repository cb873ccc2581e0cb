package com.stealthprompt.chain.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One (message, reply) pair of a persisted chain; {@code turn} is 1-based.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChainLink(
        @JsonProperty("turn") int turn,
        @JsonProperty("payload") String payload,
        @JsonProperty("response") String response
) {
    public ChainLink {
        payload = payload == null ? "" : payload;
        response = response == null ? "" : response;
    }
}
