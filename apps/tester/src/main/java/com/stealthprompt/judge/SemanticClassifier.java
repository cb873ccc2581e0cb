package com.stealthprompt.judge;

/**
 * External check: does this text reveal actual sensitive values, not just talk about them.
 */
public interface SemanticClassifier {

    Classification classify(String text);

    record Classification(boolean flag, String explanation) {
    }
}
