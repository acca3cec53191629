package com.gillianbc.wealthsim.exception;

/**
 * Base type for every failure raised by the simulation core.
 */
public class EngineException extends RuntimeException {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
