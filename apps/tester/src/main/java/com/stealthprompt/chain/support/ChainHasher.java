package com.stealthprompt.chain.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stealthprompt.chain.domain.ChainLink;
import com.stealthprompt.util.Fingerprint;
import com.stealthprompt.util.JsonCanonicalizer;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Content address of a chain: SHA-256 over the canonical JSON of its links
 * ({@code turn}, {@code payload}, {@code response}; keys sorted).
 */
@RequiredArgsConstructor
public class ChainHasher {

    private final ObjectMapper mapper;

    public String hash(List<ChainLink> chain) {
        List<ChainLink> links = chain == null ? List.of() : chain;
        return Fingerprint.sha256(JsonCanonicalizer.canonicalize(mapper, links));
    }
}
