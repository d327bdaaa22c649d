package com.dropoutrisk.engine.training;

import com.dropoutrisk.engine.ml.ModelArtifact;
import com.dropoutrisk.engine.ml.PromotionGate;
import com.dropoutrisk.exception.ModelQualityRegressionException;

import java.util.Optional;

/**
 * Rejects a candidate whose holdout metric is below the active model's metric minus the tolerance.
 * The first model ever trained has nothing to compare against and always passes.
 */
public class QualityGate implements PromotionGate {

    private final double tolerance;

    public QualityGate(double tolerance) {
        this.tolerance = tolerance;
    }

    @Override
    public void check(ModelArtifact candidate, Optional<ModelArtifact> active) {
        if (active.isEmpty()) {
            return;
        }
        double activeMetric = active.get().holdoutMetric();
        double candidateMetric = candidate.holdoutMetric();
        if (Double.isNaN(candidateMetric) || candidateMetric < activeMetric - tolerance) {
            throw new ModelQualityRegressionException(candidate.version(), candidateMetric, activeMetric, tolerance);
        }
    }
}
