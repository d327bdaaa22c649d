package com.dropoutrisk.event;

import com.dropoutrisk.engine.training.LabeledExample;

import java.time.Instant;
import java.util.List;

/**
 * Inbound request to train a new model on a labeled dataset.
 * {@code datasetId} doubles as the idempotency key.
 */
public record TrainingDatasetSubmitted(
    String datasetId,
    List<LabeledExample> examples,
    Instant timestamp
) {
    public TrainingDatasetSubmitted {
        if (datasetId == null || datasetId.isBlank()) {
            throw new IllegalArgumentException("Dataset ID cannot be null or empty");
        }
        examples = examples == null ? List.of() : List.copyOf(examples);
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
