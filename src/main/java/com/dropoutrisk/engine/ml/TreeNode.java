package com.dropoutrisk.engine.ml;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Node of a binary decision tree. Split nodes send {@code x[feature] <= threshold} left;
 * leaves carry the positive-class probability observed in training.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TreeNode(
    Integer feature,
    Double threshold,
    TreeNode left,
    TreeNode right,
    double probability
) {
    public TreeNode {
        boolean split = feature != null;
        if (split && (threshold == null || left == null || right == null)) {
            throw new IllegalArgumentException("Split node needs a threshold and both children");
        }
        if (!split && (left != null || right != null)) {
            throw new IllegalArgumentException("Leaf node cannot have children");
        }
    }

    public static TreeNode leaf(double probability) {
        return new TreeNode(null, null, null, null, probability);
    }

    public static TreeNode split(int feature, double threshold, TreeNode left, TreeNode right, double probability) {
        return new TreeNode(feature, threshold, left, right, probability);
    }

    @JsonIgnore
    public boolean isLeaf() {
        return feature == null;
    }

    public double predict(double[] x) {
        TreeNode node = this;
        while (!node.isLeaf()) {
            node = x[node.feature] <= node.threshold ? node.left : node.right;
        }
        return node.probability;
    }
}
