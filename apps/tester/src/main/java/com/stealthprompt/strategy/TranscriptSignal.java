package com.stealthprompt.strategy;

import com.stealthprompt.api.dto.Transcript;

/**
 * A yes/no observation over the trailing turns of a transcript.
 */
@FunctionalInterface
public interface TranscriptSignal {

    boolean detect(Transcript transcript);
}
