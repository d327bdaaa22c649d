package com.dropoutrisk.engine.training;

import com.dropoutrisk.exception.TrainingDataException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ModelEvaluatorTest {

    @Test
    @DisplayName("Should give AUC 1 for a perfect ranking and 0 for an inverted one")
    void shouldScorePerfectRankings() {
        int[] labels = {0, 0, 1, 1};

        assertThat(ModelEvaluator.auc(new double[]{0.1, 0.2, 0.8, 0.9}, labels)).isEqualTo(1.0);
        assertThat(ModelEvaluator.auc(new double[]{0.9, 0.8, 0.2, 0.1}, labels)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should give tied scores half credit")
    void shouldHandleTies() {
        assertThat(ModelEvaluator.auc(new double[]{0.5, 0.5, 0.5, 0.5}, new int[]{0, 1, 0, 1})).isEqualTo(0.5);
        assertThat(ModelEvaluator.auc(new double[]{0.1, 0.4, 0.35, 0.8}, new int[]{0, 0, 1, 1})).isEqualTo(0.75);
    }

    @Test
    @DisplayName("Should refuse a holdout with a single outcome class")
    void shouldRejectSingleClass() {
        assertThatThrownBy(() -> ModelEvaluator.auc(new double[]{0.2, 0.7}, new int[]{1, 1}))
                .isInstanceOf(TrainingDataException.class);
    }

    @Test
    @DisplayName("Should count predictions at 0.5 or above as dropouts")
    void shouldComputeAccuracy() {
        assertThat(ModelEvaluator.accuracy(new double[]{0.5, 0.49, 0.9, 0.1}, new int[]{1, 0, 0, 0})).isEqualTo(0.75);
    }
}
