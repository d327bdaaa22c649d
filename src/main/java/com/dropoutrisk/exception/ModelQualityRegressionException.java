package com.dropoutrisk.exception;

/**
 * Thrown when a staged model fails the promotion gate.
 * The currently active model keeps serving.
 */
public class ModelQualityRegressionException extends RiskEngineException {

    private final String stagedVersion;
    private final double stagedMetric;
    private final double activeMetric;
    private final double tolerance;

    public ModelQualityRegressionException(String stagedVersion, double stagedMetric,
                                           double activeMetric, double tolerance) {
        super(String.format("Model %s holdout metric %.4f is below active metric %.4f minus tolerance %.4f",
                stagedVersion, stagedMetric, activeMetric, tolerance));
        this.stagedVersion = stagedVersion;
        this.stagedMetric = stagedMetric;
        this.activeMetric = activeMetric;
        this.tolerance = tolerance;
    }

    public String getStagedVersion() {
        return stagedVersion;
    }

    public double getStagedMetric() {
        return stagedMetric;
    }

    public double getActiveMetric() {
        return activeMetric;
    }

    public double getTolerance() {
        return tolerance;
    }
}
