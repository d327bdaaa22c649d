package com.dropoutrisk.engine.ml;

import com.dropoutrisk.engine.feature.FeatureVector;
import com.dropoutrisk.exception.ModelVersionMismatchException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Scores feature vectors with the ensemble of a model artifact.
 *
 * Steps per vector:
 * 1. impute missing fields with the artifact's training means
 * 2. standardize with the artifact's scaler
 * 3. average the members' positive-class probabilities
 * 4. derive a confidence from distance to 0.5 and member agreement
 */
@Slf4j
public class MLPredictor {

    private final ModelRegistry registry;

    public MLPredictor(ModelRegistry registry) {
        this.registry = registry;
    }

    /**
     * Snapshot of the active artifact. Callers that score several vectors should take one
     * snapshot and pass it to {@link #predict(ModelArtifact, FeatureVector)}.
     */
    public Optional<ModelArtifact> activeModel() {
        return registry.active();
    }

    /**
     * Scores against the currently active artifact; empty when no model is active.
     */
    public Optional<Prediction> predict(FeatureVector vector) {
        return registry.active().map(artifact -> predict(artifact, vector));
    }

    public Prediction predict(ModelArtifact artifact, FeatureVector vector) {
        if (!artifact.featureSchemaVersion().equals(vector.schemaVersion())) {
            throw new ModelVersionMismatchException(
                    artifact.version(), vector.schemaVersion(), artifact.featureSchemaVersion());
        }

        double[] standardized = artifact.scaler().transform(impute(vector.toArray(), artifact.imputationMeans()));

        Map<String, Double> memberProbabilities = new LinkedHashMap<>();
        double sum = 0.0;
        double min = 1.0;
        double max = 0.0;
        for (EnsembleMember member : artifact.members()) {
            double p = clamp(member.predictProba(standardized));
            memberProbabilities.put(member.name(), p);
            sum += p;
            min = Math.min(min, p);
            max = Math.max(max, p);
        }
        double probability = clamp(sum / artifact.members().size());
        double confidence = confidence(probability, max - min);

        log.debug("Student {} scored by model {}: p={} confidence={} members={}",
                vector.studentId(), artifact.version(), probability, confidence, memberProbabilities);
        return new Prediction(probability, confidence, artifact.version(),
                Collections.unmodifiableMap(memberProbabilities));
    }

    /**
     * {@code 2|p - 0.5| * (1 - spread)}: grows as the ensemble moves away from the decision
     * boundary and as members agree; 0 at p = 0.5 or at total disagreement.
     */
    static double confidence(double probability, double spread) {
        double distance = 2.0 * Math.abs(probability - 0.5);
        double agreement = 1.0 - clamp(spread);
        return clamp(distance * agreement);
    }

    static double[] impute(double[] raw, double[] means) {
        if (raw.length != means.length) {
            throw new IllegalStateException(
                    "Vector has " + raw.length + " features but model expects " + means.length);
        }
        double[] out = raw.clone();
        for (int i = 0; i < out.length; i++) {
            if (Double.isNaN(out[i])) {
                out[i] = means[i];
            }
        }
        return out;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            throw new IllegalStateException("Ensemble member produced NaN probability");
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
