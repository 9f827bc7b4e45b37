package com.goormthonuniv.newscheckr.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"domain", "reputation_score", "known_bias"})
public record SourceRating(
        String domain,                                        // 정규화된 도메인 (소문자, www. 제거)
        @JsonProperty("reputation_score") double reputationScore, // 0~100
        @JsonProperty("known_bias")
        @JsonInclude(JsonInclude.Include.NON_NULL) Bias knownBias,
        @JsonIgnore boolean known                             // 레지스트리에 실제로 존재하는 도메인인지
) {
    public static final double NEUTRAL_SCORE = 50.0;

    public SourceRating {
        if (Double.isNaN(reputationScore) || reputationScore < 0.0 || reputationScore > 100.0) {
            throw new IllegalArgumentException("reputation score out of range: " + reputationScore);
        }
    }

    public static SourceRating known(String domain, double reputationScore, Bias knownBias) {
        return new SourceRating(domain, reputationScore, knownBias, true);
    }

    /** 미등록 도메인의 중립 기본값 */
    public static SourceRating neutral(String domain) {
        return new SourceRating(domain == null ? "" : domain, NEUTRAL_SCORE, Bias.CENTER, false);
    }
}
