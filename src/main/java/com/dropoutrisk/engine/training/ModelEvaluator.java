package com.dropoutrisk.engine.training;

import com.dropoutrisk.exception.TrainingDataException;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Holdout metrics for binary dropout predictions.
 */
public final class ModelEvaluator {

    public static final String AUC = "roc_auc";

    private ModelEvaluator() {
    }

    /**
     * Area under the ROC curve via the rank-sum statistic; tied scores share their average rank.
     */
    public static double auc(double[] scores, int[] labels) {
        int n = scores.length;
        long positives = Arrays.stream(labels).filter(l -> l == 1).count();
        long negatives = n - positives;
        if (positives == 0 || negatives == 0) {
            throw new TrainingDataException("AUC needs both outcome classes in the holdout split");
        }

        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble(i -> scores[i]));

        double positiveRankSum = 0.0;
        int i = 0;
        while (i < n) {
            int j = i;
            while (j + 1 < n && scores[order[j + 1]] == scores[order[i]]) {
                j++;
            }
            double averageRank = (i + j) / 2.0 + 1.0;
            for (int k = i; k <= j; k++) {
                if (labels[order[k]] == 1) {
                    positiveRankSum += averageRank;
                }
            }
            i = j + 1;
        }
        return (positiveRankSum - positives * (positives + 1) / 2.0) / ((double) positives * negatives);
    }

    public static double accuracy(double[] scores, int[] labels) {
        int correct = 0;
        for (int i = 0; i < scores.length; i++) {
            int predicted = scores[i] >= 0.5 ? 1 : 0;
            if (predicted == labels[i]) {
                correct++;
            }
        }
        return (double) correct / scores.length;
    }
}
