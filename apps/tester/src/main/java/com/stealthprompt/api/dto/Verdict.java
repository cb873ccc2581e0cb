package com.stealthprompt.api.dto;

public record Verdict(boolean sensitive, String explanation, VerdictSource source) {

    public static final String KNOWN_PATTERN = "matches known pattern";

    public static Verdict knownPattern() {
        return new Verdict(true, KNOWN_PATTERN, VerdictSource.STORE);
    }

    public static Verdict semantic(boolean sensitive, String explanation) {
        return new Verdict(sensitive, explanation == null ? "" : explanation, VerdictSource.SEMANTIC);
    }

    /** Same verdict with the flag cleared, used when the operator overrides a hit. */
    public Verdict cleared() {
        return new Verdict(false, explanation, source);
    }
}
