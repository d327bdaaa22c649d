package com.dropoutrisk.engine.feature;

import java.util.List;

/**
 * Versioned, ordered set of features. A model artifact can only score vectors
 * built against the schema version it was trained on.
 */
public record FeatureSchema(String version, List<Feature> features) {

    public static final FeatureSchema CURRENT = new FeatureSchema("fs-1", List.of(
            Feature.ATTENDANCE_PERCENTAGE,
            Feature.AVERAGE_SCORE,
            Feature.SCORE_STD_DEV,
            Feature.FAILED_EXAM_COUNT,
            Feature.OVERDUE_FEES_RATIO,
            Feature.ATTEMPT_COUNT));

    public FeatureSchema {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Schema version cannot be null or empty");
        }
        if (features == null || features.isEmpty()) {
            throw new IllegalArgumentException("Schema must declare at least one feature");
        }
        if (features.stream().distinct().count() != features.size()) {
            throw new IllegalArgumentException("Schema " + version + " declares a feature twice");
        }
        features = List.copyOf(features);
    }

    public int dimension() {
        return features.size();
    }

    /**
     * Position of the feature in the vector, or -1 if the schema does not include it.
     */
    public int indexOf(Feature feature) {
        return features.indexOf(feature);
    }
}
