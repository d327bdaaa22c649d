package com.dropoutrisk.exception;

/**
 * Thrown on an unknown model version or an illegal lifecycle transition.
 */
public class ModelLifecycleException extends RiskEngineException {

    public ModelLifecycleException(String message) {
        super(message);
    }

    public ModelLifecycleException(String message, Throwable cause) {
        super(message, cause);
    }
}
