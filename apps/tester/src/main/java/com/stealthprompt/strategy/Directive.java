package com.stealthprompt.strategy;

/**
 * How the next follow-up should relate to the conversation so far.
 */
public enum Directive {
    /** Replies repeat: drop the topic and change register. */
    PIVOT,
    /** Replies refuse: change topic or style more gently. */
    SOFTEN,
    /** Ordinary natural continuation. */
    CONTINUE;

    public static Directive from(boolean repetitive, boolean ineffective) {
        if (repetitive) return PIVOT;
        if (ineffective) return SOFTEN;
        return CONTINUE;
    }
}
