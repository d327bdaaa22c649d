package com.dropoutrisk.engine.training;

import java.util.List;

/**
 * Batch of labeled examples supplied for one training run.
 */
public record TrainingDataset(String datasetId, List<LabeledExample> examples) {

    public TrainingDataset {
        if (datasetId == null || datasetId.isBlank()) {
            throw new IllegalArgumentException("Dataset ID cannot be null or empty");
        }
        examples = examples == null ? List.of() : List.copyOf(examples);
    }
}
