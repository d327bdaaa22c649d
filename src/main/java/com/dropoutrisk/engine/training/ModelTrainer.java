package com.dropoutrisk.engine.training;

import com.dropoutrisk.engine.feature.FeatureExtractor;
import com.dropoutrisk.engine.feature.FeatureVector;
import com.dropoutrisk.engine.ml.EnsembleMember;
import com.dropoutrisk.engine.ml.FeatureScaler;
import com.dropoutrisk.engine.ml.LifecycleState;
import com.dropoutrisk.engine.ml.MLPredictor;
import com.dropoutrisk.engine.ml.ModelArtifact;
import com.dropoutrisk.engine.ml.ModelRegistry;
import com.dropoutrisk.engine.ml.Prediction;
import com.dropoutrisk.engine.ml.TrainingMetadata;
import com.dropoutrisk.exception.InsufficientDataException;
import com.dropoutrisk.exception.ModelQualityRegressionException;
import com.dropoutrisk.exception.TrainingDataException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Offline pipeline: extract, split, fit, evaluate, stage, gate, promote.
 *
 * FLOW:
 * =====
 * 1. Extract features for every labeled example (students with no data are skipped)
 * 2. Stratified, seeded holdout split
 * 3. Imputation means and scaler fitted on the training split only
 * 4. Fit every ensemble member on the standardized training split
 * 5. Score the holdout with the full ensemble, record ROC AUC
 * 6. Stage the artifact, check it against the active model, validate, promote
 *
 * A rejected candidate stays STAGED and the active model is untouched.
 * Nothing here holds a lock that assessments need; only the final swap is serialized.
 */
@Slf4j
public class ModelTrainer {

    private final FeatureExtractor extractor;
    private final ModelRegistry registry;
    private final MLPredictor predictor;
    private final List<MemberTrainer> memberTrainers;
    private final TrainingSettings settings;
    private final Clock clock;

    public ModelTrainer(FeatureExtractor extractor, ModelRegistry registry, MLPredictor predictor,
                        List<MemberTrainer> memberTrainers, TrainingSettings settings, Clock clock) {
        if (memberTrainers == null || memberTrainers.isEmpty()) {
            throw new IllegalArgumentException("At least one member trainer is required");
        }
        this.extractor = extractor;
        this.registry = registry;
        this.predictor = predictor;
        this.memberTrainers = List.copyOf(memberTrainers);
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Standard ensemble: logistic regression plus random forest.
     */
    public static List<MemberTrainer> defaultMembers(TrainingSettings settings) {
        return List.of(
                new LogisticRegressionTrainer(settings.logisticLearningRate(),
                        settings.logisticIterations(), settings.logisticL2()),
                new RandomForestTrainer(settings.forestTrees(), settings.forestMaxDepth(),
                        settings.forestMinSamplesLeaf()));
    }

    /**
     * Trains a new artifact and promotes it if it passes the quality gate.
     *
     * @return the artifact now ACTIVE
     * @throws ModelQualityRegressionException if the candidate is worse than the active model
     */
    public ModelArtifact trainAndPromote(TrainingDataset dataset) {
        ModelArtifact staged = registry.stage(train(dataset));
        // gate, validation and promotion happen under the registry lock; a rejected candidate stays STAGED
        return registry.validateAndPromote(staged.version(), new QualityGate(settings.promotionTolerance()));
    }

    /**
     * Fits and evaluates a STAGED artifact without registering it.
     */
    public ModelArtifact train(TrainingDataset dataset) {
        log.info("Training on dataset {} with {} examples", dataset.datasetId(), dataset.examples().size());

        List<FeatureVector> vectors = new ArrayList<>();
        List<double[]> rows = new ArrayList<>();
        List<Integer> labels = new ArrayList<>();
        int skipped = 0;
        for (LabeledExample example : dataset.examples()) {
            try {
                FeatureVector vector = extractor.extract(example.records());
                vectors.add(vector);
                rows.add(vector.toArray());
                labels.add(example.droppedOut() ? 1 : 0);
            } catch (InsufficientDataException e) {
                skipped++;
                log.debug("Skipping training example: {}", e.getMessage());
            }
        }
        if (rows.size() < settings.minExamples()) {
            throw new TrainingDataException(String.format(
                    "Dataset %s has %d usable examples, at least %d required",
                    dataset.datasetId(), rows.size(), settings.minExamples()));
        }

        Split split = stratifiedSplit(labels);
        double[][] trainRaw = select(rows, split.train());
        List<FeatureVector> holdout = split.holdout().stream().map(vectors::get).toList();
        int[] trainLabels = selectLabels(labels, split.train());
        int[] holdoutLabels = selectLabels(labels, split.holdout());

        double[] means = columnMeans(trainRaw);
        imputeInPlace(trainRaw, means);
        FeatureScaler scaler = fitScaler(trainRaw);
        double[][] trainScaled = standardize(trainRaw, scaler);

        List<EnsembleMember> members = new ArrayList<>();
        for (int i = 0; i < memberTrainers.size(); i++) {
            members.add(memberTrainers.get(i).fit(trainScaled, trainLabels, settings.seed() + i));
        }

        String version = registry.nextVersion();
        Instant trainedAt = clock.instant();
        ModelArtifact unscored = new ModelArtifact(version, extractor.schema().version(), means, scaler, members,
                new TrainingMetadata(trainedAt, dataset.datasetId(), ModelEvaluator.AUC, Double.NaN,
                        trainRaw.length, holdout.size(), skipped, Map.of()),
                LifecycleState.STAGED);

        Evaluation evaluation = evaluate(unscored, holdout, holdoutLabels);
        TrainingMetadata metadata = new TrainingMetadata(trainedAt, dataset.datasetId(), ModelEvaluator.AUC,
                evaluation.auc(), trainRaw.length, holdout.size(), skipped, evaluation.memberMetrics());

        log.info("Trained model {} on {} rows ({} holdout, {} skipped): {} = {}",
                version, trainRaw.length, holdout.size(), skipped, ModelEvaluator.AUC,
                String.format("%.4f", evaluation.auc()));
        return new ModelArtifact(version, unscored.featureSchemaVersion(), means, scaler, members, metadata,
                LifecycleState.STAGED);
    }

    /**
     * Scores the holdout through the same inference path used for live assessments.
     */
    private Evaluation evaluate(ModelArtifact artifact, List<FeatureVector> holdout, int[] holdoutLabels) {
        int n = holdout.size();
        double[] ensemble = new double[n];
        Map<String, double[]> perMember = new LinkedHashMap<>();
        artifact.members().forEach(m -> perMember.put(m.name(), new double[n]));

        for (int i = 0; i < n; i++) {
            Prediction prediction = predictor.predict(artifact, holdout.get(i));
            ensemble[i] = prediction.probability();
            int row = i;
            prediction.memberProbabilities().forEach((name, p) -> perMember.get(name)[row] = p);
        }

        Map<String, Double> memberMetrics = new LinkedHashMap<>();
        perMember.forEach((name, scores) -> {
            memberMetrics.put(name + "." + ModelEvaluator.AUC, ModelEvaluator.auc(scores, holdoutLabels));
            memberMetrics.put(name + ".accuracy", ModelEvaluator.accuracy(scores, holdoutLabels));
        });
        memberMetrics.put("ensemble.accuracy", ModelEvaluator.accuracy(ensemble, holdoutLabels));
        return new Evaluation(ModelEvaluator.auc(ensemble, holdoutLabels), memberMetrics);
    }

    private Split stratifiedSplit(List<Integer> labels) {
        List<Integer> positives = new ArrayList<>();
        List<Integer> negatives = new ArrayList<>();
        for (int i = 0; i < labels.size(); i++) {
            (labels.get(i) == 1 ? positives : negatives).add(i);
        }
        if (positives.size() < 2 || negatives.size() < 2) {
            throw new TrainingDataException(String.format(
                    "Need at least two examples of each outcome, got %d dropouts and %d retained",
                    positives.size(), negatives.size()));
        }

        Random random = new Random(settings.seed());
        Collections.shuffle(positives, random);
        Collections.shuffle(negatives, random);

        List<Integer> train = new ArrayList<>();
        List<Integer> holdout = new ArrayList<>();
        for (List<Integer> group : List.of(positives, negatives)) {
            int holdoutSize = Math.max(1, (int) Math.round(group.size() * settings.holdoutFraction()));
            holdout.addAll(group.subList(0, holdoutSize));
            train.addAll(group.subList(holdoutSize, group.size()));
        }
        Collections.sort(train);
        Collections.sort(holdout);
        return new Split(train, holdout);
    }

    /**
     * Mean of the observed (non-missing) values per column; 0 for a column with no observations.
     */
    private static double[] columnMeans(double[][] rows) {
        int d = rows[0].length;
        double[] means = new double[d];
        for (int j = 0; j < d; j++) {
            DescriptiveStatistics column = new DescriptiveStatistics();
            for (double[] row : rows) {
                if (!Double.isNaN(row[j])) {
                    column.addValue(row[j]);
                }
            }
            means[j] = column.getN() == 0 ? 0.0 : column.getMean();
        }
        return means;
    }

    private static FeatureScaler fitScaler(double[][] rows) {
        int d = rows[0].length;
        double[] means = new double[d];
        double[] scales = new double[d];
        for (int j = 0; j < d; j++) {
            DescriptiveStatistics column = new DescriptiveStatistics();
            for (double[] row : rows) {
                column.addValue(row[j]);
            }
            means[j] = column.getMean();
            double std = Math.sqrt(column.getPopulationVariance());
            scales[j] = std > 1e-12 ? std : 1.0;
        }
        return new FeatureScaler(means, scales);
    }

    private static double[][] standardize(double[][] rows, FeatureScaler scaler) {
        double[][] out = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            out[i] = scaler.transform(rows[i]);
        }
        return out;
    }

    private static void imputeInPlace(double[][] rows, double[] means) {
        for (double[] row : rows) {
            for (int j = 0; j < row.length; j++) {
                if (Double.isNaN(row[j])) {
                    row[j] = means[j];
                }
            }
        }
    }

    private static double[][] select(List<double[]> rows, List<Integer> indices) {
        double[][] out = new double[indices.size()][];
        for (int i = 0; i < indices.size(); i++) {
            out[i] = rows.get(indices.get(i)).clone();
        }
        return out;
    }

    private static int[] selectLabels(List<Integer> labels, List<Integer> indices) {
        return indices.stream().mapToInt(labels::get).toArray();
    }

    private record Split(List<Integer> train, List<Integer> holdout) {
    }

    private record Evaluation(double auc, Map<String, Double> memberMetrics) {
    }
}
