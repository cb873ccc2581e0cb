package com.stealthprompt.orchestrator;

/**
 * Settings that make a test impossible to start. Fatal to the invocation only.
 */
public class InvalidTestConfigurationException extends RuntimeException {

    public InvalidTestConfigurationException(String message) {
        super(message);
    }
}
