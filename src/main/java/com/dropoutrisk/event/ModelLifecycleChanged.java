package com.dropoutrisk.event;

import com.dropoutrisk.engine.ml.LifecycleState;

import java.time.Instant;

/**
 * Event published for every model lifecycle transition and for rejected promotions.
 *
 * {@code fromState} is null when the artifact was just staged. For a rejection,
 * {@code fromState} and {@code toState} are both the artifact's unchanged state and
 * {@code detail} carries the reason.
 */
public record ModelLifecycleChanged(
    String modelVersion,
    LifecycleState fromState,
    LifecycleState toState,
    boolean rejected,
    Double holdoutMetric,
    String detail,
    Instant timestamp
) {
    public ModelLifecycleChanged {
        if (modelVersion == null || modelVersion.isBlank()) {
            throw new IllegalArgumentException("Model version cannot be null or empty");
        }
        if (toState == null) {
            throw new IllegalArgumentException("Target state cannot be null");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
