package com.stealthprompt.judge;

import com.stealthprompt.api.dto.Verdict;
import com.stealthprompt.chain.AttackChainStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Known secrets from confirmed chains first; the semantic classifier only when none matches.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SensitivityJudge {

    private final AttackChainStore store;
    private final SemanticClassifier classifier;

    /**
     * @throws com.stealthprompt.ai.GenerationException when the semantic check cannot be reached
     */
    public Verdict evaluate(String reply, String testType) {
        if (store.containsKnownSecret(reply, testType)) {
            log.info("[Judge] reply matches a known secret, skipping semantic check");
            return Verdict.knownPattern();
        }
        SemanticClassifier.Classification c = classifier.classify(reply);
        return Verdict.semantic(c.flag(), c.explanation());
    }
}
