package com.dropoutrisk.engine.ml;

/**
 * Linear probabilistic classifier: sigmoid(intercept + weights . x).
 */
public record LogisticRegressionClassifier(double[] weights, double intercept) implements EnsembleMember {

    public static final String NAME = "logistic_regression";

    public LogisticRegressionClassifier {
        if (weights == null || weights.length == 0) {
            throw new IllegalArgumentException("Weights cannot be null or empty");
        }
        weights = weights.clone();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double predictProba(double[] standardized) {
        if (standardized.length != weights.length) {
            throw new IllegalArgumentException(
                    "Expected " + weights.length + " features, got " + standardized.length);
        }
        double z = intercept;
        for (int i = 0; i < weights.length; i++) {
            z += weights[i] * standardized[i];
        }
        return sigmoid(z);
    }

    public static double sigmoid(double z) {
        if (z >= 0) {
            return 1.0 / (1.0 + Math.exp(-z));
        }
        double e = Math.exp(z);
        return e / (1.0 + e);
    }
}
