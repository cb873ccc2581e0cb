package com.stealthprompt.api.dto;

public enum VerdictSource {
    /** Matched a secret value already captured by a confirmed chain. */
    STORE,
    /** Decided by the semantic classifier. */
    SEMANTIC
}
