package com.dropoutrisk.engine.training;

import com.dropoutrisk.engine.ml.EnsembleMember;
import com.dropoutrisk.engine.ml.LogisticRegressionClassifier;
import lombok.extern.slf4j.Slf4j;

/**
 * Full-batch gradient descent on L2-regularized log loss. Deterministic: starts from zero weights.
 */
@Slf4j
public class LogisticRegressionTrainer implements MemberTrainer {

    private final double learningRate;
    private final int iterations;
    private final double l2;

    public LogisticRegressionTrainer(double learningRate, int iterations, double l2) {
        this.learningRate = learningRate;
        this.iterations = iterations;
        this.l2 = l2;
    }

    @Override
    public EnsembleMember fit(double[][] x, int[] labels, long seed) {
        int n = x.length;
        int d = x[0].length;
        double[] weights = new double[d];
        double intercept = 0.0;

        for (int iter = 0; iter < iterations; iter++) {
            double[] gradient = new double[d];
            double interceptGradient = 0.0;
            for (int i = 0; i < n; i++) {
                double z = intercept;
                for (int j = 0; j < d; j++) {
                    z += weights[j] * x[i][j];
                }
                double error = LogisticRegressionClassifier.sigmoid(z) - labels[i];
                for (int j = 0; j < d; j++) {
                    gradient[j] += error * x[i][j];
                }
                interceptGradient += error;
            }
            for (int j = 0; j < d; j++) {
                weights[j] -= learningRate * (gradient[j] / n + l2 * weights[j]);
            }
            intercept -= learningRate * interceptGradient / n;
        }

        log.debug("Fitted logistic regression on {} rows: intercept={}", n, intercept);
        return new LogisticRegressionClassifier(weights, intercept);
    }
}
