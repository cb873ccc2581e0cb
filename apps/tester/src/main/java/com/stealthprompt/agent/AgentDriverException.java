package com.stealthprompt.agent;

public class AgentDriverException extends RuntimeException {

    public AgentDriverException(String message) {
        super(message);
    }

    public AgentDriverException(String message, Throwable cause) {
        super(message, cause);
    }
}
