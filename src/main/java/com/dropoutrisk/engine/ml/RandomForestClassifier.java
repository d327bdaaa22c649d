package com.dropoutrisk.engine.ml;

import java.util.List;

/**
 * Tree-ensemble classifier; the probability is the mean of the trees' leaf probabilities.
 */
public record RandomForestClassifier(List<TreeNode> trees) implements EnsembleMember {

    public static final String NAME = "random_forest";

    public RandomForestClassifier {
        if (trees == null || trees.isEmpty()) {
            throw new IllegalArgumentException("Forest needs at least one tree");
        }
        trees = List.copyOf(trees);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double predictProba(double[] standardized) {
        double sum = 0.0;
        for (TreeNode tree : trees) {
            sum += tree.predict(standardized);
        }
        return sum / trees.size();
    }
}
