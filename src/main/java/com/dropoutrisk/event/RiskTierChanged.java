package com.dropoutrisk.event;

import com.dropoutrisk.engine.assess.RiskAssessment;
import com.dropoutrisk.model.Tier;

import java.time.Instant;

/**
 * Event published when a student's final tier differs from the previous assessment.
 * {@code previousFinalTier} is null for the student's first assessment.
 */
public record RiskTierChanged(
    String studentId,
    Tier previousFinalTier,
    Tier newFinalTier,
    RiskAssessment assessment,
    Instant timestamp
) {
    public RiskTierChanged {
        if (studentId == null || studentId.isBlank()) {
            throw new IllegalArgumentException("Student ID cannot be null or empty");
        }
        if (newFinalTier == null) {
            throw new IllegalArgumentException("New final tier cannot be null");
        }
        if (newFinalTier == previousFinalTier) {
            throw new IllegalArgumentException("Tier did not change for student " + studentId);
        }
        if (assessment == null) {
            throw new IllegalArgumentException("Assessment cannot be null");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
