package com.stealthprompt.orchestrator;

import com.stealthprompt.api.dto.ConfirmationDecision;
import com.stealthprompt.api.dto.PendingHit;

/**
 * Human decisions the orchestrator waits on. Both calls block until answered.
 */
public interface OperatorConsole {

    ConfirmationDecision review(PendingHit hit);

    /** Asked after a confirmed leak; false stops every remaining test. */
    boolean keepTesting();
}
