package com.dropoutrisk.engine.assess;

/**
 * A student that could not be assessed in a batch run.
 */
public record AssessmentFailure(String studentId, String errorType, String message) {
}
