package com.goormthonuniv.newscheckr.feature;

import com.goormthonuniv.newscheckr.exception.InsufficientContentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class FeatureExtractorTest {

    private static final String SENTENCE = "The budget passed the senate and the budget office agreed.";

    private final Vocabulary vocabulary = new Vocabulary(new LinkedHashMap<>(Map.of(
            "budget", 2.0,
            "senate", 1.0,
            "hoax", 3.0)));
    private final FeatureExtractor extractor = new FeatureExtractor(vocabulary, 50);

    @Nested
    @DisplayName("TF-IDF 벡터")
    class Vector {

        @Test
        @DisplayName("등장 횟수 x idf 후 L2 정규화, 어휘 밖 단어와 불용어는 무시")
        void weightsAreTfIdfNormalized() {
            // given: 10단어 문장 x 6 = 60단어
            String text = String.join(" ", Collections.nCopies(6, SENTENCE));

            // when
            FeatureVector v = extractor.extract(text);

            // then: budget 12*2=24, senate 6*1=6
            assertThat(v.termWeights()).containsOnlyKeys("budget", "senate");
            double norm = Math.sqrt(24 * 24 + 6 * 6);
            assertThat(v.termWeight("budget")).isCloseTo(24 / norm, within(1e-9));
            assertThat(v.termWeight("senate")).isCloseTo(6 / norm, within(1e-9));
            assertThat(v.termWeight("the")).isZero();
            assertThat(v.termWeight("hoax")).isZero();
        }

        @Test
        @DisplayName("어휘 단어가 하나도 없으면 빈 벡터 (0으로 나누지 않음)")
        void noVocabularyTerms() {
            String text = String.join(" ", Collections.nCopies(60, "weather"));

            FeatureVector v = extractor.extract(text);

            assertThat(v.isEmpty()).isTrue();
            assertThat(v.stats().wordCount()).isEqualTo(60);
        }

        @Test
        @DisplayName("같은 입력이면 같은 벡터")
        void deterministic() {
            String text = String.join(" ", Collections.nCopies(6, SENTENCE));

            assertThat(extractor.extract(text)).isEqualTo(extractor.extract(text));
        }
    }

    @Nested
    @DisplayName("최소 단어 수")
    class MinimumWords {

        @Test
        @DisplayName("50단어 미만이면 InsufficientContentException")
        void tooShort() {
            String text = String.join(" ", Collections.nCopies(4, SENTENCE)); // 40 words

            assertThatThrownBy(() -> extractor.extract(text))
                    .isInstanceOfSatisfying(InsufficientContentException.class, e -> {
                        assertThat(e.getWordCount()).isEqualTo(40);
                        assertThat(e.getMinimumWords()).isEqualTo(50);
                    });
        }

        @Test
        @DisplayName("단어 수는 불용어 제거 전 기준")
        void stopwordsCountTowardsMinimum() {
            String text = String.join(" ", Collections.nCopies(50, "the"));

            FeatureVector v = extractor.extract(text);

            assertThat(v.stats().wordCount()).isEqualTo(50);
            assertThat(v.isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("문체 통계")
    class Stats {

        @Test
        @DisplayName("느낌표/물음표 밀도, 대문자 비율, 전부 대문자 단어 비율")
        void stylisticStatistics() {
            TextStats stats = TextStats.of("WOW! This is BIG news?");

            assertThat(stats.wordCount()).isEqualTo(5);
            assertThat(stats.sentenceCount()).isEqualTo(2);
            assertThat(stats.avgWordLength()).isCloseTo(16.0 / 5, within(1e-9));
            assertThat(stats.exclamationDensity()).isCloseTo(0.2, within(1e-9));
            assertThat(stats.questionDensity()).isCloseTo(0.2, within(1e-9));
            assertThat(stats.capsRatio()).isCloseTo(7.0 / 16, within(1e-9));
            assertThat(stats.allCapsRatio()).isCloseTo(0.4, within(1e-9));
        }

        @Test
        @DisplayName("빈 텍스트는 모든 통계가 0")
        void emptyText() {
            TextStats stats = TextStats.of("");

            assertThat(stats.wordCount()).isZero();
            assertThat(stats.capsRatio()).isZero();
            assertThat(stats.exclamationDensity()).isZero();
        }

        @Test
        @DisplayName("통계 이름으로 값을 조회할 수 있다")
        void lookupByKey() {
            TextStats stats = TextStats.of("WOW! This is BIG news?");

            assertThat(stats.value(TextStats.Stat.fromKey("caps_ratio"))).isEqualTo(stats.capsRatio());
            assertThatThrownBy(() -> TextStats.Stat.fromKey("no_such_stat"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
