package com.goormthonuniv.newscheckr.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * 모델 아티팩트(JSON)의 직렬화 형태. 검증/변환은 {@link ModelLoader}가 담당한다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelDefinition(
        String version,
        Map<String, Double> vocabulary,            // term -> idf
        CredibilitySection credibility,
        BiasSection bias
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CredibilitySection(
            List<Node> trees
    ) {}

    /** 분기 노드는 feature/threshold/left/right, 리프는 value만 가진다 */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Node(
            String feature,
            Double threshold,
            Node left,
            Node right,
            Double value
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BiasSection(
            List<String> classes,
            Double alpha,
            Map<String, Double> priors,
            @JsonProperty("feature_counts") Map<String, Map<String, Double>> featureCounts
    ) {}
}
