package com.dropoutrisk.engine.ml;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * How and on what an artifact was trained.
 */
public record TrainingMetadata(
    Instant trainedAt,
    String datasetId,
    String metricName,
    double holdoutMetric,
    int trainingSize,
    int holdoutSize,
    int skippedExamples,
    Map<String, Double> memberMetrics
) {
    public TrainingMetadata {
        if (trainedAt == null) {
            throw new IllegalArgumentException("Training timestamp cannot be null");
        }
        memberMetrics = memberMetrics == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(memberMetrics));
    }
}
