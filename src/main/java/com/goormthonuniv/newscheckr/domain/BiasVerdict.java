package com.goormthonuniv.newscheckr.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record BiasVerdict(
        Bias bias,
        double confidence,                 // 0.0~1.0
        Map<Bias, Double> probabilities    // 분류기를 건너뛴 경우 빈 맵
) {
    public BiasVerdict {
        if (bias == null) {
            throw new IllegalArgumentException("bias is required");
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        probabilities = probabilities == null || probabilities.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(probabilities));
    }

    /** 분류 없이 출처 성향만으로 정한 판정 (신뢰도 0) */
    public static BiasVerdict fromSource(Bias knownBias) {
        return new BiasVerdict(knownBias == null ? Bias.CENTER : knownBias, 0.0, Map.of());
    }
}
