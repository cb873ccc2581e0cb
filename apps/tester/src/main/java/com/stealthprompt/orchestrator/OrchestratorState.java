package com.stealthprompt.orchestrator;

public enum OrchestratorState {
    IDLE,
    RUNNING,
    PAUSED_FOR_CONFIRMATION,
    STOPPED
}
