package com.dropoutrisk.engine.ml;

import java.util.Map;

/**
 * Ensemble output for one vector. {@code memberProbabilities} keeps ensemble order.
 */
public record Prediction(
    double probability,
    double confidence,
    String modelVersion,
    Map<String, Double> memberProbabilities
) {
}
