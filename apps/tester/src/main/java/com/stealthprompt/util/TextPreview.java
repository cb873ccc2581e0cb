package com.stealthprompt.util;

public final class TextPreview {
    private TextPreview() {}

    static final String CLIPPED = " [truncated]";

    public static String of(String text, int max) {
        if (text == null) return "<null>";
        String flat = text.replace('\n', ' ').replace('\r', ' ');
        return flat.length() > max ? flat.substring(0, max) + "..." : flat;
    }

    /** Leading part of {@code text}, never longer than {@code max} characters, line breaks kept. */
    public static String clip(String text, int max) {
        if (text == null || max <= 0) return "";
        if (text.length() <= max) return text;
        if (max <= CLIPPED.length()) return text.substring(0, max);
        return text.substring(0, max - CLIPPED.length()) + CLIPPED;
    }
}
