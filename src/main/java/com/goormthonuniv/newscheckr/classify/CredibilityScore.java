package com.goormthonuniv.newscheckr.classify;

/**
 * @param score            0~100, 소수 첫째 자리 반올림
 * @param modelProbability 포레스트 출력 p (출처만으로 계산한 경우 NaN 대신 -1)
 */
public record CredibilityScore(double score, double modelProbability) {

    public static final double NO_MODEL = -1.0;

    public boolean modelUsed() {
        return modelProbability >= 0.0;
    }
}
