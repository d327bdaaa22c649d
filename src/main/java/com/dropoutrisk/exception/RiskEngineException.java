package com.dropoutrisk.exception;

/**
 * Base exception for the risk assessment engine.
 */
public class RiskEngineException extends RuntimeException {

    public RiskEngineException(String message) {
        super(message);
    }

    public RiskEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
