package com.stealthprompt.strategy;

import com.stealthprompt.api.dto.Transcript;
import com.stealthprompt.api.dto.Turn;
import com.stealthprompt.config.StrategyProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Flags an approach the agent keeps refusing: enough refusing replies in the trailing window.
 */
@Component
@RequiredArgsConstructor
public class RefusalDetector implements TranscriptSignal {

    private final StrategyProperties props;

    @Override
    public boolean detect(Transcript transcript) {
        if (transcript.size() < 2) return false;
        long refusals = transcript.lastTurns(props.getWindow()).stream()
                .filter(this::isRefusal)
                .count();
        return refusals >= props.getRefusalThreshold();
    }

    boolean isRefusal(Turn turn) {
        String reply = turn.reply() == null ? "" : turn.reply().strip().toLowerCase(Locale.ROOT);
        if (reply.isEmpty()) return false;
        for (String phrase : props.getRefusalPhrases()) {
            if (reply.contains(phrase.toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }
}
