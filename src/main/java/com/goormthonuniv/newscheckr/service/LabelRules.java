package com.goormthonuniv.newscheckr.service;

import com.goormthonuniv.newscheckr.domain.Bias;
import com.goormthonuniv.newscheckr.domain.BiasVerdict;
import com.goormthonuniv.newscheckr.domain.SourceRating;
import com.goormthonuniv.newscheckr.feature.TextStats;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 라벨 규칙표. 입력이 같으면 결과도 같다 (순서 포함).
 *
 * <pre>
 * score >= 80            Highly Reliable
 * 60 <= score < 80       Mixed Reliability, Needs Verification
 * 40 <= score < 60       Low Reliability
 * score < 40 + 선정성     Satire/Clickbait
 * score < 40             Likely Biased
 * bias != Center, conf >= 0.6   Biased
 * reputation >= 85       Well-sourced
 * 특징 추출 생략          InsufficientData
 * 요약 실패              SummaryUnavailable
 * </pre>
 */
public final class LabelRules {

    public static final String HIGHLY_RELIABLE = "Highly Reliable";
    public static final String MIXED_RELIABILITY = "Mixed Reliability";
    public static final String NEEDS_VERIFICATION = "Needs Verification";
    public static final String LOW_RELIABILITY = "Low Reliability";
    public static final String SATIRE_CLICKBAIT = "Satire/Clickbait";
    public static final String LIKELY_BIASED = "Likely Biased";
    public static final String BIASED = "Biased";
    public static final String WELL_SOURCED = "Well-sourced";
    public static final String INSUFFICIENT_DATA = "InsufficientData";
    public static final String SUMMARY_UNAVAILABLE = "SummaryUnavailable";

    static final double HIGH_BAND = 80.0;
    static final double MIXED_BAND = 60.0;
    static final double LOW_BAND = 40.0;
    static final double BIASED_CONFIDENCE = 0.6;
    static final double WELL_SOURCED_REPUTATION = 85.0;

    // 선정성 신호
    static final double EXCLAMATION_DENSITY = 0.02;
    static final double CAPS_RATIO = 0.15;
    static final double ALL_CAPS_RATIO = 0.10;

    private LabelRules() {}

    public static List<String> derive(double score,
                                      BiasVerdict verdict,
                                      SourceRating rating,
                                      boolean sensational,
                                      boolean featuresSkipped,
                                      boolean summaryFailed) {
        Set<String> labels = new LinkedHashSet<>();

        if (score >= HIGH_BAND) {
            labels.add(HIGHLY_RELIABLE);
        } else if (score >= MIXED_BAND) {
            labels.add(MIXED_RELIABILITY);
            labels.add(NEEDS_VERIFICATION);
        } else if (score >= LOW_BAND) {
            labels.add(LOW_RELIABILITY);
        } else if (sensational) {
            labels.add(SATIRE_CLICKBAIT);
        } else {
            labels.add(LIKELY_BIASED);
        }

        if (verdict.bias() != Bias.CENTER && verdict.confidence() >= BIASED_CONFIDENCE) {
            labels.add(BIASED);
        }
        if (rating.reputationScore() >= WELL_SOURCED_REPUTATION) {
            labels.add(WELL_SOURCED);
        }
        if (featuresSkipped) labels.add(INSUFFICIENT_DATA);
        if (summaryFailed) labels.add(SUMMARY_UNAVAILABLE);

        return List.copyOf(labels);
    }

    public static boolean isSensational(TextStats stats) {
        if (stats == null || stats.wordCount() == 0) return false;
        return stats.exclamationDensity() >= EXCLAMATION_DENSITY
                || stats.capsRatio() >= CAPS_RATIO
                || stats.allCapsRatio() >= ALL_CAPS_RATIO;
    }
}
