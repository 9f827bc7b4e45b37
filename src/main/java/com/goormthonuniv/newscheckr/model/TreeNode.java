package com.goormthonuniv.newscheckr.model;

import com.goormthonuniv.newscheckr.feature.FeatureVector;

import java.util.Objects;

/**
 * 이진 결정 트리 노드. value <= threshold 이면 왼쪽.
 */
public final class TreeNode {

    private final FeatureRef feature;
    private final double threshold;
    private final TreeNode left;
    private final TreeNode right;
    private final double leafValue;

    private TreeNode(FeatureRef feature, double threshold, TreeNode left, TreeNode right, double leafValue) {
        this.feature = feature;
        this.threshold = threshold;
        this.left = left;
        this.right = right;
        this.leafValue = leafValue;
    }

    public static TreeNode leaf(double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException("leaf value must be in [0,1]: " + value);
        }
        return new TreeNode(null, 0.0, null, null, value);
    }

    public static TreeNode split(FeatureRef feature, double threshold, TreeNode left, TreeNode right) {
        if (Double.isNaN(threshold)) {
            throw new IllegalArgumentException("split threshold is NaN for " + feature);
        }
        return new TreeNode(Objects.requireNonNull(feature), threshold,
                Objects.requireNonNull(left), Objects.requireNonNull(right), Double.NaN);
    }

    public boolean isLeaf() {
        return feature == null;
    }

    public double predict(FeatureVector vector) {
        TreeNode node = this;
        while (!node.isLeaf()) {
            node = node.feature.resolve(vector) <= node.threshold ? node.left : node.right;
        }
        return node.leafValue;
    }
}
