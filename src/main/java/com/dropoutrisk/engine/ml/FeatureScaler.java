package com.dropoutrisk.engine.ml;

/**
 * Zero-mean / unit-variance transform fitted at training time. Never refitted at inference.
 */
public record FeatureScaler(double[] means, double[] scales) {

    public FeatureScaler {
        if (means == null || scales == null || means.length != scales.length) {
            throw new IllegalArgumentException("Scaler means and scales must have the same length");
        }
        for (double scale : scales) {
            if (!(scale > 0.0)) {
                throw new IllegalArgumentException("Scaler scales must be positive");
            }
        }
        means = means.clone();
        scales = scales.clone();
    }

    public int dimension() {
        return means.length;
    }

    public double[] transform(double[] raw) {
        if (raw.length != means.length) {
            throw new IllegalArgumentException("Expected " + means.length + " features, got " + raw.length);
        }
        double[] out = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            out[i] = (raw[i] - means[i]) / scales[i];
        }
        return out;
    }
}
