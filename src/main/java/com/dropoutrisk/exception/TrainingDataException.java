package com.dropoutrisk.exception;

/**
 * Thrown when a training dataset cannot produce a usable model.
 */
public class TrainingDataException extends RiskEngineException {

    public TrainingDataException(String message) {
        super(message);
    }
}
