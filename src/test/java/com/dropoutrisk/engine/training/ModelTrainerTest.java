package com.dropoutrisk.engine.training;

import com.dropoutrisk.engine.feature.FeatureExtractor;
import com.dropoutrisk.engine.feature.FeatureSchema;
import com.dropoutrisk.engine.feature.StudentRecords;
import com.dropoutrisk.engine.ml.LifecycleState;
import com.dropoutrisk.engine.ml.MLPredictor;
import com.dropoutrisk.engine.ml.ModelArtifact;
import com.dropoutrisk.engine.ml.ModelArtifactStore;
import com.dropoutrisk.engine.ml.ModelRegistry;
import com.dropoutrisk.engine.ml.PromotionGate;
import com.dropoutrisk.exception.ModelQualityRegressionException;
import com.dropoutrisk.exception.TrainingDataException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.dropoutrisk.engine.ModelFixtures.staged;
import static com.dropoutrisk.engine.StudentFixtures.student;
import static org.assertj.core.api.Assertions.*;

class ModelTrainerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-30T12:00:00Z"), ZoneOffset.UTC);

    // small ensemble so the suite stays fast
    private static final TrainingSettings SETTINGS =
            new TrainingSettings(0.25, 7L, 0.02, 20, 0.1, 300, 0.01, 15, 4, 2);

    private ModelRegistry registry;
    private ModelTrainer trainer;

    @BeforeEach
    void setUp() {
        registry = new ModelRegistry(ModelArtifactStore.NONE);
        trainer = newTrainer(registry);
    }

    private static ModelTrainer newTrainer(ModelRegistry registry) {
        return new ModelTrainer(new FeatureExtractor(FeatureSchema.CURRENT, 10, 5), registry,
                new MLPredictor(registry), ModelTrainer.defaultMembers(SETTINGS), SETTINGS, CLOCK);
    }

    /**
     * Dropouts attend 30-50% and score 20-40; retained students attend 80-100% and score 60-90.
     */
    private static TrainingDataset separableDataset(int perClass) {
        Random random = new Random(11);
        List<LabeledExample> examples = new ArrayList<>();
        for (int i = 0; i < perClass; i++) {
            examples.add(new LabeledExample(
                    student("D-" + i, 30 + random.nextInt(21), 20 + random.nextInt(21), 0.4), true));
            examples.add(new LabeledExample(
                    student("R-" + i, 80 + random.nextInt(21), 60 + random.nextInt(31), 0.0), false));
        }
        return new TrainingDataset("separable", examples);
    }

    @Test
    @DisplayName("Should train, validate and promote a model that separates the classes")
    void shouldPromoteGoodModel() {
        ModelArtifact active = trainer.trainAndPromote(separableDataset(30));

        assertThat(active.state()).isEqualTo(LifecycleState.ACTIVE);
        assertThat(active.version()).isEqualTo("v1");
        assertThat(active.holdoutMetric()).isGreaterThan(0.8);
        assertThat(active.metadata().trainedAt()).isEqualTo(CLOCK.instant());
        assertThat(active.metadata().holdoutSize()).isEqualTo(16);
        assertThat(active.metadata().trainingSize()).isEqualTo(44);
        assertThat(active.metadata().memberMetrics())
                .containsKeys("logistic_regression.roc_auc", "random_forest.roc_auc", "ensemble.accuracy");
        assertThat(registry.active()).contains(active);
    }

    @Test
    @DisplayName("Should reject a worse candidate and keep the active model serving")
    void shouldRejectRegression() {
        registry.stage(staged("v1", 1.0));
        registry.markValidated("v1");
        registry.promote("v1", PromotionGate.ALWAYS);

        // identical features for everyone: the candidate cannot rank better than chance
        List<LabeledExample> examples = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            examples.add(new LabeledExample(student("S-" + i, 70, 50, 0.1), i % 2 == 0));
        }

        assertThatThrownBy(() -> trainer.trainAndPromote(new TrainingDataset("noise", examples)))
                .isInstanceOf(ModelQualityRegressionException.class);

        assertThat(registry.active()).map(ModelArtifact::version).contains("v1");
        assertThat(registry.find("v2")).map(ModelArtifact::state).contains(LifecycleState.STAGED);
        assertThat(registry.find("v2")).map(ModelArtifact::holdoutMetric).contains(0.5);
    }

    @Test
    @DisplayName("Should produce the same model from the same data and seed")
    void shouldTrainDeterministically() {
        ModelArtifact first = trainer.train(separableDataset(30));
        ModelArtifact second = newTrainer(new ModelRegistry(ModelArtifactStore.NONE)).train(separableDataset(30));

        assertThat(second.metadata()).isEqualTo(first.metadata());
        assertThat(second.imputationMeans()).containsExactly(first.imputationMeans());
        assertThat(second.members()).hasSameSizeAs(first.members());
    }

    @Test
    @DisplayName("Should skip students without data and count them")
    void shouldSkipInsufficientExamples() {
        List<LabeledExample> examples = new ArrayList<>(separableDataset(30).examples());
        examples.add(new LabeledExample(new StudentRecords("EMPTY", List.of(), List.of(), List.of()), true));

        ModelArtifact artifact = trainer.train(new TrainingDataset("with-empty", examples));

        assertThat(artifact.metadata().skippedExamples()).isEqualTo(1);
        assertThat(artifact.state()).isEqualTo(LifecycleState.STAGED);
    }

    @Test
    @DisplayName("Should refuse datasets that are too small or have a single outcome")
    void shouldRejectUnusableDatasets() {
        assertThatThrownBy(() -> trainer.train(separableDataset(5)))
                .isInstanceOf(TrainingDataException.class)
                .hasMessageContaining("usable examples");

        List<LabeledExample> allRetained = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            allRetained.add(new LabeledExample(student("R-" + i, 90, 80, 0.0), false));
        }
        assertThatThrownBy(() -> trainer.train(new TrainingDataset("one-class", allRetained)))
                .isInstanceOf(TrainingDataException.class);
        assertThat(registry.active()).isEmpty();
    }
}
