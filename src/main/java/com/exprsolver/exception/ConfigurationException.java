package com.exprsolver.exception;

/**
 * Exception thrown when solver configuration is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends ExprSolverException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
