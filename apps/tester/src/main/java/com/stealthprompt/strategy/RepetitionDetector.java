package com.stealthprompt.strategy;

import com.stealthprompt.api.dto.Transcript;
import com.stealthprompt.api.dto.Turn;
import com.stealthprompt.config.StrategyProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Flags an agent that keeps answering the same way.
 *
 * <p>Each non-empty reply in the window is reduced to a signature (head and tail of the
 * lower-cased text when long, the whole text otherwise). Two adjacent signatures whose shared
 * whitespace tokens exceed the threshold, relative to the larger token set, count as a repeat.</p>
 */
@Component
@RequiredArgsConstructor
public class RepetitionDetector implements TranscriptSignal {

    private final StrategyProperties props;

    @Override
    public boolean detect(Transcript transcript) {
        if (transcript.size() < 2) return false;

        List<String> signatures = new ArrayList<>();
        for (Turn turn : transcript.lastTurns(props.getWindow())) {
            String reply = turn.reply() == null ? "" : turn.reply().strip().toLowerCase(Locale.ROOT);
            if (!reply.isEmpty()) signatures.add(signature(reply));
        }
        if (signatures.size() < 2) return false;

        for (int i = 0; i < signatures.size() - 1; i++) {
            if (overlap(signatures.get(i), signatures.get(i + 1)) > props.getRepetitionThreshold()) {
                return true;
            }
        }
        return false;
    }

    String signature(String reply) {
        int edge = props.getSignatureEdge();
        if (reply.length() > edge * 2) {
            return reply.substring(0, edge) + "..." + reply.substring(reply.length() - edge);
        }
        return reply;
    }

    static double overlap(String a, String b) {
        Set<String> wa = tokens(a);
        Set<String> wb = tokens(b);
        if (wa.isEmpty() || wb.isEmpty()) return 0.0;
        Set<String> shared = new HashSet<>(wa);
        shared.retainAll(wb);
        return (double) shared.size() / Math.max(wa.size(), wb.size());
    }

    private static Set<String> tokens(String s) {
        String trimmed = s.strip();
        if (trimmed.isEmpty()) return Set.of();
        return new HashSet<>(Arrays.asList(trimmed.split("\\s+")));
    }
}
