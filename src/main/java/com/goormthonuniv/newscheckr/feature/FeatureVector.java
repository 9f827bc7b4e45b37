package com.goormthonuniv.newscheckr.feature;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 어휘 기반 희소 TF-IDF 벡터(L2 정규화) + 문체 통계.
 */
public record FeatureVector(
        SortedMap<String, Double> termWeights,
        TextStats stats
) {
    public FeatureVector {
        termWeights = Collections.unmodifiableSortedMap(new TreeMap<>(termWeights));
    }

    public double termWeight(String term) {
        Double w = termWeights.get(term);
        return w == null ? 0.0 : w;
    }

    public double stat(TextStats.Stat stat) {
        return stats.value(stat);
    }

    public boolean isEmpty() {
        return termWeights.isEmpty();
    }
}
