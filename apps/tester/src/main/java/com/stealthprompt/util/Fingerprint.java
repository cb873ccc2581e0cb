package com.stealthprompt.util;

import org.apache.commons.codec.digest.DigestUtils;

public final class Fingerprint {
    private Fingerprint() {}

    public static String sha256(String s) {
        return DigestUtils.sha256Hex(s == null ? "" : s);
    }

    /** First eight characters, for log lines. */
    public static String shortId(String id) {
        if (id == null) return "unknown";
        return id.length() > 8 ? id.substring(0, 8) : id;
    }
}
