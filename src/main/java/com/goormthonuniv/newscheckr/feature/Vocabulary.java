package com.goormthonuniv.newscheckr.feature;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 학습 시점에 확정된 어휘와 idf 가중치. 요청마다 재계산하지 않는다.
 */
public final class Vocabulary {

    private final Map<String, Double> idf;

    public Vocabulary(Map<String, Double> idf) {
        if (idf == null || idf.isEmpty()) {
            throw new IllegalArgumentException("vocabulary is empty");
        }
        Map<String, Double> copy = new LinkedHashMap<>();
        idf.forEach((term, weight) -> {
            if (weight == null || weight.isNaN() || weight <= 0.0) {
                throw new IllegalArgumentException("invalid idf for term '" + term + "': " + weight);
            }
            copy.put(term, weight);
        });
        this.idf = Collections.unmodifiableMap(copy);
    }

    public boolean contains(String term) {
        return idf.containsKey(term);
    }

    public double idf(String term) {
        Double w = idf.get(term);
        return w == null ? 0.0 : w;
    }

    public Set<String> terms() {
        return idf.keySet();
    }

    public int size() {
        return idf.size();
    }
}
