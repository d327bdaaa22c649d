package com.dropoutrisk.engine.training;

/**
 * Hyper-parameters and promotion policy for a training run.
 */
public record TrainingSettings(
    double holdoutFraction,
    long seed,
    double promotionTolerance,
    int minExamples,
    double logisticLearningRate,
    int logisticIterations,
    double logisticL2,
    int forestTrees,
    int forestMaxDepth,
    int forestMinSamplesLeaf
) {
    public TrainingSettings {
        if (!(holdoutFraction > 0.0 && holdoutFraction < 1.0)) {
            throw new IllegalArgumentException("Holdout fraction must be in (0, 1)");
        }
        if (promotionTolerance < 0.0) {
            throw new IllegalArgumentException("Promotion tolerance cannot be negative");
        }
        if (forestTrees < 1 || forestMaxDepth < 1 || forestMinSamplesLeaf < 1) {
            throw new IllegalArgumentException("Forest needs at least one tree, depth 1 and leaf size 1");
        }
        if (logisticIterations < 1 || !(logisticLearningRate > 0.0) || logisticL2 < 0.0) {
            throw new IllegalArgumentException("Invalid logistic regression parameters");
        }
    }

    public static TrainingSettings defaults() {
        return new TrainingSettings(0.2, 42L, 0.02, 20, 0.1, 1000, 0.01, 100, 8, 2);
    }
}
