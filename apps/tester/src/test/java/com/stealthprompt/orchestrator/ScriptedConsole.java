package com.stealthprompt.orchestrator;

import com.stealthprompt.api.dto.ConfirmationDecision;
import com.stealthprompt.api.dto.PendingHit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Operator stand-in answering from a script. */
class ScriptedConsole implements OperatorConsole {

    final List<PendingHit> reviewed = new ArrayList<>();
    private final Deque<ConfirmationDecision> decisions = new ArrayDeque<>();
    private final boolean keepTesting;
    int keepTestingAsked;

    ScriptedConsole(boolean keepTesting, ConfirmationDecision... decisions) {
        this.keepTesting = keepTesting;
        this.decisions.addAll(List.of(decisions));
    }

    @Override
    public ConfirmationDecision review(PendingHit hit) {
        reviewed.add(hit);
        return decisions.isEmpty() ? ConfirmationDecision.CONTINUE : decisions.poll();
    }

    @Override
    public boolean keepTesting() {
        keepTestingAsked++;
        return keepTesting;
    }
}
