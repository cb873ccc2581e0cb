package com.stealthprompt.strategy;

import com.stealthprompt.api.dto.Transcript;

/**
 * Decides the next message to send to the target agent.
 */
public interface PayloadStrategy {

    /**
     * @param testType   category label, e.g. {@code jailbreak_attempts}
     * @param transcript conversation so far; not modified
     * @return a non-empty message
     * @throws com.stealthprompt.ai.GenerationException when no generation attempt reached the provider
     */
    String nextMessage(String testType, Transcript transcript);
}
