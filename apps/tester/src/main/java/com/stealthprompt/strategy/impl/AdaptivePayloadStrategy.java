package com.stealthprompt.strategy.impl;

import com.stealthprompt.ai.GenerationException;
import com.stealthprompt.ai.GenerationOptions;
import com.stealthprompt.ai.TextGenerator;
import com.stealthprompt.api.dto.Transcript;
import com.stealthprompt.config.AiProperties;
import com.stealthprompt.config.StrategyProperties;
import com.stealthprompt.strategy.AttackFocus;
import com.stealthprompt.strategy.Directive;
import com.stealthprompt.strategy.PayloadCleaner;
import com.stealthprompt.strategy.PayloadStrategy;
import com.stealthprompt.strategy.PromptLibrary;
import com.stealthprompt.strategy.RefusalDetector;
import com.stealthprompt.strategy.RepetitionDetector;
import com.stealthprompt.util.TextPreview;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Generates the opening attack and adaptive follow-ups.
 *
 * <p>Follow-ups look at the trailing replies first: repetition forces a pivot, refusals ask for a
 * softer change. A candidate equal to an already sent message is re-requested, without cache,
 * with a note demanding a structurally different attack. The rendered history is cut, oldest
 * turns first, to stay within {@code ai.client.max-prompt-chars}.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdaptivePayloadStrategy implements PayloadStrategy {

    private final TextGenerator generator;
    private final RepetitionDetector repetition;
    private final RefusalDetector refusal;
    private final StrategyProperties props;
    private final AiProperties ai;

    @Override
    public String nextMessage(String testType, Transcript transcript) {
        AttackFocus focus = AttackFocus.fromTestType(testType);
        if (transcript == null || transcript.isEmpty()) {
            return initial(testType, focus);
        }
        return followUp(transcript, focus);
    }

    private String initial(String testType, AttackFocus focus) {
        String raw = generator.generate(
                PromptLibrary.initialSystem(focus), PromptLibrary.initialUser(testType), GenerationOptions.defaults());
        String message = PayloadCleaner.clean(raw);
        if (message.isEmpty()) {
            log.warn("[Strategy] empty initial generation, using fallback message");
            return PromptLibrary.INITIAL_FALLBACK;
        }
        log.info("[Strategy] initial message: {}", TextPreview.of(message, 200));
        return message;
    }

    private String followUp(Transcript transcript, AttackFocus focus) {
        boolean repetitive = repetition.detect(transcript);
        boolean ineffective = refusal.detect(transcript);
        Directive directive = Directive.from(repetitive, ineffective);
        log.info("[Strategy] follow-up after {} turns, directive={}", transcript.size(), directive);

        String system = PromptLibrary.followUpSystem(focus, directive);
        String base = PromptLibrary.followUpUser(transcript, directive, ai.getClient().getMaxPromptChars());
        Set<String> previous = new HashSet<>(transcript.sentMessages());

        int attempts = Math.max(1, props.getMaxAttempts());
        String user = base;
        String candidate = "";
        boolean reachedProvider = false;
        GenerationException lastFailure = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            GenerationOptions options = attempt == 1 ? GenerationOptions.defaults() : GenerationOptions.uncached();
            try {
                candidate = PayloadCleaner.clean(generator.generate(system, user, options));
                reachedProvider = true;
            } catch (GenerationException e) {
                log.warn("[Strategy] generation attempt {}/{} failed: {}", attempt, attempts, e.getMessage());
                lastFailure = e;
                candidate = "";
            }

            if (!candidate.isEmpty() && !previous.contains(candidate)) {
                break;
            }
            if (attempt < attempts) {
                log.info("[Strategy] attempt {}/{} rejected (empty or repeated), re-requesting", attempt, attempts);
                user = PromptLibrary.withRetryNote(base);
            }
        }

        if (!reachedProvider && lastFailure != null) {
            throw lastFailure;
        }
        if (candidate.isEmpty()) {
            log.warn("[Strategy] no usable follow-up after {} attempts, using fallback message", attempts);
            return PromptLibrary.FOLLOW_UP_FALLBACK;
        }
        log.info("[Strategy] follow-up message: {}", TextPreview.of(candidate, 200));
        return candidate;
    }
}
