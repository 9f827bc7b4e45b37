package com.goormthonuniv.newscheckr.model;

import com.goormthonuniv.newscheckr.feature.FeatureVector;
import com.goormthonuniv.newscheckr.feature.TextStats;

/**
 * 트리 분기가 참조하는 입력값. 아티팩트 표기: {@code term:<어휘>} 또는 {@code stat:<통계명>}.
 */
public record FeatureRef(String term, TextStats.Stat stat) {

    private static final String TERM_PREFIX = "term:";
    private static final String STAT_PREFIX = "stat:";

    public static FeatureRef parse(String ref) {
        if (ref == null) {
            throw new IllegalArgumentException("feature reference is missing");
        }
        if (ref.startsWith(TERM_PREFIX) && ref.length() > TERM_PREFIX.length()) {
            return new FeatureRef(ref.substring(TERM_PREFIX.length()), null);
        }
        if (ref.startsWith(STAT_PREFIX)) {
            return new FeatureRef(null, TextStats.Stat.fromKey(ref.substring(STAT_PREFIX.length())));
        }
        throw new IllegalArgumentException("malformed feature reference: " + ref);
    }

    public boolean isTerm() {
        return term != null;
    }

    public double resolve(FeatureVector vector) {
        return isTerm() ? vector.termWeight(term) : vector.stat(stat);
    }

    @Override
    public String toString() {
        return isTerm() ? TERM_PREFIX + term : STAT_PREFIX + stat.key();
    }
}
