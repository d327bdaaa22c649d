package com.dropoutrisk.engine;

import com.dropoutrisk.engine.feature.FeatureSchema;
import com.dropoutrisk.engine.ml.EnsembleMember;
import com.dropoutrisk.engine.ml.FeatureScaler;
import com.dropoutrisk.engine.ml.LifecycleState;
import com.dropoutrisk.engine.ml.LogisticRegressionClassifier;
import com.dropoutrisk.engine.ml.ModelArtifact;
import com.dropoutrisk.engine.ml.RandomForestClassifier;
import com.dropoutrisk.engine.ml.TrainingMetadata;
import com.dropoutrisk.engine.ml.TreeNode;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Hand-built model artifacts over the current feature schema.
 */
public final class ModelFixtures {

    public static final Instant TRAINED_AT = Instant.parse("2024-06-01T00:00:00Z");

    private ModelFixtures() {
    }

    /**
     * Members that both answer {@code probability} for every input.
     */
    public static List<EnsembleMember> constantMembers(double probability) {
        double logit = Math.log(probability / (1.0 - probability));
        return List.of(
                new LogisticRegressionClassifier(new double[FeatureSchema.CURRENT.dimension()], logit),
                new RandomForestClassifier(List.of(TreeNode.leaf(probability))));
    }

    public static ModelArtifact artifact(String version, double holdoutMetric, List<EnsembleMember> members,
                                         LifecycleState state) {
        int d = FeatureSchema.CURRENT.dimension();
        double[] ones = new double[d];
        Arrays.fill(ones, 1.0);
        return new ModelArtifact(version, FeatureSchema.CURRENT.version(), new double[d],
                new FeatureScaler(new double[d], ones), members,
                new TrainingMetadata(TRAINED_AT, "dataset-" + version, "roc_auc", holdoutMetric, 80, 20, 0, Map.of()),
                state);
    }

    public static ModelArtifact staged(String version, double holdoutMetric) {
        return artifact(version, holdoutMetric, constantMembers(0.2), LifecycleState.STAGED);
    }

    public static ModelArtifact active(String version, double probability) {
        return artifact(version, 0.8, constantMembers(probability), LifecycleState.ACTIVE);
    }
}
