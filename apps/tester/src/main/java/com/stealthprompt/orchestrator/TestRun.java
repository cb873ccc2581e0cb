package com.stealthprompt.orchestrator;

import lombok.Getter;

/**
 * Lifecycle of one test: IDLE, RUNNING, optional PAUSED_FOR_CONFIRMATION back to RUNNING, then STOPPED.
 */
@Getter
public class TestRun {

    private final String testType;
    private volatile OrchestratorState state = OrchestratorState.IDLE;

    public TestRun(String testType) {
        this.testType = testType;
    }

    public void start() {
        transition(OrchestratorState.IDLE, OrchestratorState.RUNNING);
    }

    public void pauseForConfirmation() {
        transition(OrchestratorState.RUNNING, OrchestratorState.PAUSED_FOR_CONFIRMATION);
    }

    public void resume() {
        transition(OrchestratorState.PAUSED_FOR_CONFIRMATION, OrchestratorState.RUNNING);
    }

    public void stop() {
        if (state == OrchestratorState.STOPPED) {
            throw new IllegalStateException("Test run for " + testType + " already stopped");
        }
        state = OrchestratorState.STOPPED;
    }

    private void transition(OrchestratorState expected, OrchestratorState next) {
        if (state != expected) {
            throw new IllegalStateException("Cannot move from " + state + " to " + next + " (expected " + expected + ")");
        }
        state = next;
    }
}
