package com.stealthprompt.orchestrator;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Session-wide stop request. Checked at the top of every turn and before every scheduled test;
 * never interrupts a call already in flight.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
