package com.stealthprompt.orchestrator;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Deliberate pacing between turns and tests.
 */
@FunctionalInterface
public interface Pacer {

    void pause(Duration duration);

    static Pacer sleeping() {
        return SleepingPacer.INSTANCE;
    }

    @Slf4j
    final class SleepingPacer implements Pacer {
        static final SleepingPacer INSTANCE = new SleepingPacer();

        private SleepingPacer() {}

        @Override
        public void pause(Duration duration) {
            if (duration == null || duration.isZero() || duration.isNegative()) return;
            try {
                Thread.sleep(duration.toMillis());
            } catch (InterruptedException e) {
                log.debug("[Orchestrator] pacing interrupted");
                Thread.currentThread().interrupt();
            }
        }
    }
}
