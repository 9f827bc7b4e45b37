package com.goormthonuniv.newscheckr.model;

import com.goormthonuniv.newscheckr.feature.Vocabulary;

import java.util.Objects;

/**
 * 기동 시 한 번 만들어지는 불변 모델 묶음. 요청 간 락 없이 공유한다.
 */
public record ModelBundle(
        String version,
        Vocabulary vocabulary,
        RandomForest credibilityForest,
        NaiveBayesModel biasModel
) {
    public ModelBundle {
        Objects.requireNonNull(vocabulary, "vocabulary");
        Objects.requireNonNull(credibilityForest, "credibilityForest");
        Objects.requireNonNull(biasModel, "biasModel");
        version = version == null || version.isBlank() ? "unversioned" : version;
    }
}
