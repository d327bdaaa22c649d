package com.dropoutrisk.exception;

/**
 * Thrown when a threshold configuration violates its invariants.
 * The previously loaded configuration stays in effect.
 */
public class ThresholdConfigException extends RiskEngineException {

    public ThresholdConfigException(String message) {
        super(message);
    }
}
