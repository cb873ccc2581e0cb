package com.stealthprompt.chain.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A human-confirmed attack chain as stored on disk.
 *
 * <p>{@code id} is the content hash of {@code chain}; two entries with equal chains share it.</p>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class AttackChainEntry {

    @JsonProperty("id")
    String id;

    @JsonProperty("test_type")
    String testType;

    @JsonProperty("conversation_chain")
    @Builder.Default
    List<ChainLink> chain = List.of();

    @JsonProperty("confirmed_by_user")
    @Builder.Default
    boolean confirmed = true;

    @JsonProperty("added_at")
    LocalDateTime createdAt;

    public int length() {
        return chain == null ? 0 : chain.size();
    }

    public boolean hasChain() {
        return chain != null && !chain.isEmpty();
    }

    /** Message at {@code index} (0-based). */
    public String messageAt(int index) {
        return chain.get(index).payload();
    }
}
