package com.dropoutrisk.event;

import com.dropoutrisk.engine.feature.StudentRecords;

import java.time.Instant;

/**
 * Inbound request to assess one student from the records carried in the event.
 * {@code requestId} doubles as the idempotency key.
 */
public record StudentAssessmentRequested(
    String requestId,
    StudentRecords records,
    Instant timestamp
) {
    public StudentAssessmentRequested {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("Request ID cannot be null or empty");
        }
        if (records == null) {
            throw new IllegalArgumentException("Student records cannot be null");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
