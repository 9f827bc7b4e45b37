package com.goormthonuniv.newscheckr.classify;

import com.goormthonuniv.newscheckr.domain.SourceRating;
import com.goormthonuniv.newscheckr.feature.FeatureVector;
import com.goormthonuniv.newscheckr.model.RandomForest;

/**
 * 신뢰도 점수 = 100 * (w_model * p + w_source * reputation / 100)
 * p는 랜덤 포레스트의 "신뢰 가능" 확률.
 */
public class CredibilityClassifier {

    private static final double WEIGHT_TOLERANCE = 1e-9;

    private final RandomForest forest;
    private final double modelWeight;
    private final double sourceWeight;

    public CredibilityClassifier(RandomForest forest, double modelWeight, double sourceWeight) {
        if (modelWeight < 0.0 || sourceWeight < 0.0
                || Math.abs(modelWeight + sourceWeight - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException(
                    "blend weights must be non-negative and sum to 1: " + modelWeight + " + " + sourceWeight);
        }
        this.forest = forest;
        this.modelWeight = modelWeight;
        this.sourceWeight = sourceWeight;
    }

    public CredibilityScore score(FeatureVector vector, SourceRating rating) {
        double p = forest.predict(vector);
        double raw = 100.0 * (modelWeight * p + sourceWeight * rating.reputationScore() / 100.0);
        return new CredibilityScore(finish(raw), p);
    }

    /** 특징 추출이 불가능할 때: 출처 평판 그대로 */
    public CredibilityScore sourceOnly(SourceRating rating) {
        return new CredibilityScore(finish(rating.reputationScore()), CredibilityScore.NO_MODEL);
    }

    private static double finish(double raw) {
        if (Double.isNaN(raw)) {
            throw new IllegalStateException("credibility score is NaN");
        }
        double clamped = Math.max(0.0, Math.min(100.0, raw));
        return Math.round(clamped * 10.0) / 10.0;
    }
}
