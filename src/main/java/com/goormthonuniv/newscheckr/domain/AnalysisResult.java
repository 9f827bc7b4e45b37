package com.goormthonuniv.newscheckr.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonPropertyOrder({"source", "credibility_score", "bias", "summary", "labels", "metadata"})
public record AnalysisResult(
        String source,
        @JsonProperty("credibility_score") double credibilityScore, // 0.0~100.0
        Bias bias,
        String summary,
        List<String> labels,
        Map<String, Object> metadata
) {
    public AnalysisResult {
        if (Double.isNaN(credibilityScore) || credibilityScore < 0.0 || credibilityScore > 100.0) {
            throw new IllegalArgumentException("credibility score out of range: " + credibilityScore);
        }
        if (bias == null) {
            throw new IllegalArgumentException("bias is required");
        }
        source = source == null ? "" : source;
        summary = summary == null ? "" : summary;
        labels = labels == null ? List.of() : List.copyOf(labels);
        // 삽입 순서 유지
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
