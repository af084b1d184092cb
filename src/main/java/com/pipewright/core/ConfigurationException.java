package com.pipewright.core;

/**
 * Thrown when a pipeline is mis-configured: dependency cycles, references to unknown task or
 * stage ids, or stages without a policy. Never retried.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
