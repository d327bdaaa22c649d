package com.dropoutrisk.engine.training;

import com.dropoutrisk.engine.ml.EnsembleMember;
import com.dropoutrisk.engine.ml.RandomForestClassifier;
import com.dropoutrisk.engine.ml.TreeNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Bagged Gini decision trees with sqrt(d) features considered per split.
 * All sampling draws from one seeded {@link Random}, so a given seed always grows the same forest.
 */
@Slf4j
public class RandomForestTrainer implements MemberTrainer {

    private final int trees;
    private final int maxDepth;
    private final int minSamplesLeaf;

    public RandomForestTrainer(int trees, int maxDepth, int minSamplesLeaf) {
        this.trees = trees;
        this.maxDepth = maxDepth;
        this.minSamplesLeaf = minSamplesLeaf;
    }

    @Override
    public EnsembleMember fit(double[][] x, int[] labels, long seed) {
        Random random = new Random(seed);
        int n = x.length;
        int featuresPerSplit = Math.max(1, (int) Math.round(Math.sqrt(x[0].length)));

        List<TreeNode> forest = new ArrayList<>(trees);
        for (int t = 0; t < trees; t++) {
            int[] sample = new int[n];
            for (int i = 0; i < n; i++) {
                sample[i] = random.nextInt(n);
            }
            forest.add(grow(x, labels, sample, 0, featuresPerSplit, random));
        }

        log.debug("Grew {} trees on {} rows ({} features per split)", trees, n, featuresPerSplit);
        return new RandomForestClassifier(forest);
    }

    private TreeNode grow(double[][] x, int[] labels, int[] rows, int depth, int featuresPerSplit, Random random) {
        int positives = countPositives(labels, rows);
        double probability = (double) positives / rows.length;

        if (depth >= maxDepth || positives == 0 || positives == rows.length || rows.length < 2 * minSamplesLeaf) {
            return TreeNode.leaf(probability);
        }

        Split best = findBestSplit(x, labels, rows, positives, candidateFeatures(x[0].length, featuresPerSplit, random));
        if (best == null) {
            return TreeNode.leaf(probability);
        }

        int[] left = Arrays.stream(rows).filter(r -> x[r][best.feature] <= best.threshold).toArray();
        int[] right = Arrays.stream(rows).filter(r -> x[r][best.feature] > best.threshold).toArray();
        return TreeNode.split(best.feature, best.threshold,
                grow(x, labels, left, depth + 1, featuresPerSplit, random),
                grow(x, labels, right, depth + 1, featuresPerSplit, random),
                probability);
    }

    private Split findBestSplit(double[][] x, int[] labels, int[] rows, int positives, List<Integer> features) {
        int n = rows.length;
        double bestImpurity = gini(positives, n);
        Split best = null;

        for (int feature : features) {
            Integer[] order = Arrays.stream(rows).boxed().toArray(Integer[]::new);
            Arrays.sort(order, Comparator.comparingDouble(r -> x[r][feature]));

            int leftPositives = 0;
            for (int i = 0; i < n - 1; i++) {
                leftPositives += labels[order[i]];
                int leftCount = i + 1;
                int rightCount = n - leftCount;
                double current = x[order[i]][feature];
                double next = x[order[i + 1]][feature];
                if (current == next || leftCount < minSamplesLeaf || rightCount < minSamplesLeaf) {
                    continue;
                }
                double impurity = (leftCount * gini(leftPositives, leftCount)
                        + rightCount * gini(positives - leftPositives, rightCount)) / n;
                if (impurity < bestImpurity) {
                    bestImpurity = impurity;
                    best = new Split(feature, (current + next) / 2.0);
                }
            }
        }
        return best;
    }

    private static List<Integer> candidateFeatures(int dimension, int count, Random random) {
        List<Integer> all = new ArrayList<>(dimension);
        for (int i = 0; i < dimension; i++) {
            all.add(i);
        }
        Collections.shuffle(all, random);
        return all.subList(0, count);
    }

    private static int countPositives(int[] labels, int[] rows) {
        int positives = 0;
        for (int r : rows) {
            positives += labels[r];
        }
        return positives;
    }

    private static double gini(int positives, int count) {
        double p = (double) positives / count;
        return 2.0 * p * (1.0 - p);
    }

    private record Split(int feature, double threshold) {
    }
}
