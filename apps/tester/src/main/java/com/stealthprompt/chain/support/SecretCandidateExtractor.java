package com.stealthprompt.chain.support;

import java.util.Set;

/**
 * Pulls likely secret values out of a reply that was confirmed to leak something.
 */
public interface SecretCandidateExtractor {

    Set<String> extract(String reply);
}
