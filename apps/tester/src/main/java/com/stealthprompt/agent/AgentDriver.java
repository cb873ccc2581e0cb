package com.stealthprompt.agent;

import java.time.Duration;
import java.util.Optional;

/**
 * Delivers messages to the agent under test and hands back its replies.
 *
 * <p>{@code send} and {@code receive} alternate: one reply is expected per sent message.
 * Neither throws for transport problems; {@code false} and empty are the failure signals.</p>
 */
public interface AgentDriver extends AutoCloseable {

    /** Prepares the interface. @throws AgentDriverException when it is misconfigured */
    void start();

    boolean send(String message);

    Optional<String> receive(Duration timeout);

    @Override
    void close();
}
