package com.dropoutrisk.event;

import com.dropoutrisk.engine.assess.RiskAssessment;

import java.time.Instant;

/**
 * Event published for every stored assessment.
 *
 * {@code requestId} correlates the result with the request that triggered it
 * (a Kafka request id or a REST-generated id).
 */
public record RiskAssessmentCompleted(
    String assessmentId,
    String requestId,
    RiskAssessment assessment,
    Instant timestamp
) {
    public RiskAssessmentCompleted {
        if (assessmentId == null || assessmentId.isBlank()) {
            throw new IllegalArgumentException("Assessment ID cannot be null or empty");
        }
        if (assessment == null) {
            throw new IllegalArgumentException("Assessment cannot be null");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
