package com.goormthonuniv.newscheckr.classify;

import com.goormthonuniv.newscheckr.domain.Bias;
import com.goormthonuniv.newscheckr.domain.BiasVerdict;
import com.goormthonuniv.newscheckr.feature.FeatureVector;
import com.goormthonuniv.newscheckr.feature.TextStats;
import com.goormthonuniv.newscheckr.model.NaiveBayesModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.*;

class BiasClassifierTest {

    // 클래스별 총합이 같도록 구성 (각 10)
    private final NaiveBayesModel model = new NaiveBayesModel(
            Map.of(Bias.LEFT, 1.0, Bias.CENTER, 1.0, Bias.RIGHT, 1.0),
            Map.of(
                    Bias.LEFT, Map.of("equity", 8.0, "report", 2.0),
                    Bias.CENTER, Map.of("bipartisan", 8.0, "report", 2.0),
                    Bias.RIGHT, Map.of("patriots", 8.0, "report", 2.0)),
            List.of("equity", "bipartisan", "patriots", "report"),
            1.0);
    private final BiasClassifier classifier = new BiasClassifier(model, 0.05);

    private static FeatureVector vector(Map<String, Double> weights) {
        return new FeatureVector(new TreeMap<>(weights), TextStats.of("Plain text."));
    }

    @Test
    @DisplayName("진보 어휘만 있으면 Left, 신뢰도 = Left 확률")
    void leftVocabulary() {
        BiasVerdict verdict = classifier.classify(vector(Map.of("equity", 1.0)));

        assertThat(verdict.bias()).isEqualTo(Bias.LEFT);
        // theta 비율 9:1:1
        assertThat(verdict.confidence()).isCloseTo(9.0 / 11.0, within(1e-9));
        assertThat(verdict.probabilities().values().stream().mapToDouble(Double::doubleValue).sum())
                .isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("보수 어휘만 있으면 Right")
    void rightVocabulary() {
        assertThat(classifier.classify(vector(Map.of("patriots", 1.0))).bias()).isEqualTo(Bias.RIGHT);
    }

    @Test
    @DisplayName("공통 어휘만 있으면 세 클래스가 동률 → Center")
    void sharedVocabularyIsTie() {
        BiasVerdict verdict = classifier.classify(vector(Map.of("report", 1.0)));

        assertThat(verdict.bias()).isEqualTo(Bias.CENTER);
        assertThat(verdict.confidence()).isCloseTo(1.0 / 3.0, within(1e-9));
    }

    @Test
    @DisplayName("1, 2위 확률 차이가 epsilon 미만이면 Center (Center가 3위여도)")
    void nearTieDefaultsToCenter() {
        double w = Math.sqrt(0.5);
        BiasVerdict verdict = classifier.classify(vector(Map.of("equity", w, "patriots", w)));

        assertThat(verdict.bias()).isEqualTo(Bias.CENTER);
        assertThat(verdict.confidence()).isEqualTo(verdict.probabilities().get(Bias.CENTER));
        assertThat(verdict.probabilities().get(Bias.LEFT)).isGreaterThan(verdict.probabilities().get(Bias.CENTER));
    }

    @Test
    @DisplayName("빈 벡터는 prior만 남아 Center")
    void emptyVector() {
        assertThat(classifier.classify(vector(Map.of())).bias()).isEqualTo(Bias.CENTER);
    }

    @Test
    @DisplayName("epsilon 범위 검증")
    void epsilonValidated() {
        assertThatThrownBy(() -> new BiasClassifier(model, 1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BiasClassifier(model, -0.01)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("출처 기반 판정은 신뢰도 0, 성향이 없으면 Center")
    void verdictFromSource() {
        assertThat(BiasVerdict.fromSource(Bias.RIGHT).confidence()).isZero();
        assertThat(BiasVerdict.fromSource(null).bias()).isEqualTo(Bias.CENTER);
    }
}
