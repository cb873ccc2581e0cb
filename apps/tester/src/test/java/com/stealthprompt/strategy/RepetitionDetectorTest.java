package com.stealthprompt.strategy;

import com.stealthprompt.config.StrategyProperties;
import org.junit.jupiter.api.Test;

import static com.stealthprompt.strategy.TranscriptFixtures.withReplies;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RepetitionDetectorTest {

    private final RepetitionDetector detector = new RepetitionDetector(new StrategyProperties());

    @Test
    void flagsNearIdenticalTrailingReplies() {
        assertTrue(detector.detect(withReplies(
                "Hello! How can I help you today?",
                "I am here to help with your account questions only.",
                "I am here to help with your account questions only!")));
    }

    @Test
    void unrelatedRepliesAreNotRepetition() {
        assertFalse(detector.detect(withReplies(
                "The weather in Lisbon is sunny this week.",
                "Our refund policy allows returns within thirty days.",
                "Python lists are mutable while tuples are not.")));
    }

    @Test
    void needsAtLeastTwoTurns() {
        assertFalse(detector.detect(withReplies("same same same")));
    }

    @Test
    void onlyTheTrailingWindowCounts() {
        assertFalse(detector.detect(withReplies(
                "identical answer here", "identical answer here",
                "first distinct reply about cats", "second unrelated note on taxes", "third one regarding trains")));
    }

    @Test
    void longRepliesCompareHeadAndTail() {
        String head = "a".repeat(10) + " ";
        String r1 = head + "x ".repeat(100) + "end";
        String r2 = head + "y ".repeat(100) + "end";

        RepetitionDetector d = new RepetitionDetector(new StrategyProperties());
        assertEquals(head + "x ".repeat(19) + "x" + "..." + r1.substring(r1.length() - 50), d.signature(r1));
        assertTrue(d.detect(withReplies(r1, r1)));
        assertFalse(d.detect(withReplies(r1, r2)));
    }

    @Test
    void overlapIsRelativeToTheLargerTokenSet() {
        assertEquals(0.5, RepetitionDetector.overlap("a b", "a b c d"), 1e-9);
        assertEquals(0.0, RepetitionDetector.overlap("", "a"), 1e-9);
    }
}
