package com.goormthonuniv.newscheckr.model;

import com.goormthonuniv.newscheckr.feature.FeatureVector;

import java.util.List;

/** 트리 리프 값의 평균 = "신뢰할 수 있는 기사"일 확률 */
public final class RandomForest {

    private final List<TreeNode> trees;

    public RandomForest(List<TreeNode> trees) {
        if (trees == null || trees.isEmpty()) {
            throw new IllegalArgumentException("forest has no trees");
        }
        this.trees = List.copyOf(trees);
    }

    public double predict(FeatureVector vector) {
        double sum = 0.0;
        for (TreeNode tree : trees) sum += tree.predict(vector);
        double p = sum / trees.size();
        return Math.max(0.0, Math.min(1.0, p));
    }

    public int size() {
        return trees.size();
    }
}
