package com.goormthonuniv.newscheckr.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.newscheckr.TestArticles;
import com.goormthonuniv.newscheckr.domain.Bias;
import com.goormthonuniv.newscheckr.exception.ErrorCode;
import com.goormthonuniv.newscheckr.exception.ModelUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelLoaderTest {

    private final ModelLoader loader = new ModelLoader(new ObjectMapper(), new DefaultResourceLoader());

    @Test
    @DisplayName("번들 모델 아티팩트를 읽어 불변 모델 묶음을 만든다")
    void loadsBundledArtifact() {
        ModelBundle bundle = loader.load(TestArticles.MODEL_LOCATION);

        assertThat(bundle.version()).isEqualTo("2024.1");
        assertThat(bundle.vocabulary().size()).isEqualTo(78);
        assertThat(bundle.vocabulary().contains("bipartisan")).isTrue();
        assertThat(bundle.credibilityForest().size()).isEqualTo(7);
        assertThat(bundle.biasModel().classes()).containsExactly(Bias.LEFT, Bias.CENTER, Bias.RIGHT);
    }

    @Test
    @DisplayName("priors/alpha 생략 시 균등 prior, alpha=1")
    void defaultsForOptionalBiasFields() {
        ModelBundle bundle = loader.load("classpath:model/minimal-model.json");

        assertThat(bundle.credibilityForest().size()).isEqualTo(2);
        assertThat(bundle.vocabulary().terms()).containsExactly("budget", "senate");
    }

    @Test
    @DisplayName("아티팩트가 없으면 MODEL_UNAVAILABLE")
    void missingArtifact() {
        assertThatThrownBy(() -> loader.load("classpath:model/does-not-exist.json"))
                .isInstanceOfSatisfying(ModelUnavailableException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.MODEL_UNAVAILABLE));
    }

    @Test
    @DisplayName("JSON 파싱 실패는 MODEL_UNAVAILABLE")
    void unreadableArtifact() {
        assertThatThrownBy(() -> loader.load("classpath:model/broken-model.json"))
                .isInstanceOf(ModelUnavailableException.class)
                .hasMessageContaining("unreadable");
    }

    @Test
    @DisplayName("어휘에 없는 단어로 분기하는 트리는 거절")
    void treeTermOutsideVocabulary() {
        assertThatThrownBy(() -> loader.load("classpath:model/unknown-term-model.json"))
                .isInstanceOf(ModelUnavailableException.class)
                .hasMessageContaining("hoax");
    }

    @Test
    @DisplayName("알 수 없는 성향 클래스 / 잘못된 리프 값은 거절")
    void invalidDefinitions() {
        ModelDefinition.Node leaf = new ModelDefinition.Node(null, null, null, null, 0.5);
        ModelDefinition.CredibilitySection forest = new ModelDefinition.CredibilitySection(List.of(leaf));

        ModelDefinition unknownClass = new ModelDefinition("x", Map.of("budget", 1.0), forest,
                new ModelDefinition.BiasSection(null, 1.0, null, Map.of("Liberal", Map.of("budget", 1.0))));
        assertThatThrownBy(() -> loader.build(unknownClass))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Liberal");

        ModelDefinition.Node badLeaf = new ModelDefinition.Node(null, null, null, null, 1.5);
        ModelDefinition badForest = new ModelDefinition("x", Map.of("budget", 1.0),
                new ModelDefinition.CredibilitySection(List.of(badLeaf)),
                new ModelDefinition.BiasSection(null, 1.0, null, null));
        assertThatThrownBy(() -> loader.build(badForest))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("특징 참조 문자열 파싱")
    void featureRefParsing() {
        assertThat(FeatureRef.parse("term:hoax").isTerm()).isTrue();
        assertThat(FeatureRef.parse("stat:caps_ratio").toString()).isEqualTo("stat:caps_ratio");
        assertThatThrownBy(() -> FeatureRef.parse("caps_ratio"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
