package com.stealthprompt.strategy;

import java.util.List;
import java.util.Locale;

/**
 * Strips wrapping artifacts that models add around a generated message.
 */
public final class PayloadCleaner {
    private PayloadCleaner() {}

    private static final List<String> SPEAKER_LABELS = List.of("pentester:", "user:");

    public static String clean(String raw) {
        if (raw == null) return "";
        String s = raw.strip();

        if (s.length() >= 2 && ((s.startsWith("\"") && s.endsWith("\"")) || (s.startsWith("'") && s.endsWith("'")))) {
            s = s.substring(1, s.length() - 1).strip();
        }

        if (s.length() >= 6 && s.startsWith("```") && s.endsWith("```")) {
            String[] lines = s.split("\n", -1);
            if (lines.length >= 2) {
                s = String.join("\n", List.of(lines).subList(1, lines.length - 1)).strip();
            } else {
                s = "";
            }
        }

        for (String label : SPEAKER_LABELS) {
            if (s.toLowerCase(Locale.ROOT).startsWith(label)) {
                s = s.substring(label.length()).strip();
            }
        }
        return s;
    }
}
