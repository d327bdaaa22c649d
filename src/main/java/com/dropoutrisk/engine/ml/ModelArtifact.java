package com.dropoutrisk.engine.ml;

import java.util.List;

/**
 * Versioned, immutable bundle of everything needed to score a feature vector.
 * State changes produce a new instance via {@link #withState(LifecycleState)}.
 */
public record ModelArtifact(
    String version,
    String featureSchemaVersion,
    double[] imputationMeans,
    FeatureScaler scaler,
    List<EnsembleMember> members,
    TrainingMetadata metadata,
    LifecycleState state
) {
    public ModelArtifact {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Model version cannot be null or empty");
        }
        if (featureSchemaVersion == null || featureSchemaVersion.isBlank()) {
            throw new IllegalArgumentException("Feature schema version cannot be null or empty");
        }
        if (scaler == null || imputationMeans == null || imputationMeans.length != scaler.dimension()) {
            throw new IllegalArgumentException("Imputation means must match the scaler dimension");
        }
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("Model " + version + " has no ensemble members");
        }
        if (state == null) {
            throw new IllegalArgumentException("Lifecycle state cannot be null");
        }
        imputationMeans = imputationMeans.clone();
        members = List.copyOf(members);
    }

    public ModelArtifact withState(LifecycleState next) {
        return new ModelArtifact(version, featureSchemaVersion, imputationMeans, scaler, members, metadata, next);
    }

    public double holdoutMetric() {
        return metadata == null ? Double.NaN : metadata.holdoutMetric();
    }
}
