package com.goormthonuniv.newscheckr.summarize;

import com.goormthonuniv.newscheckr.TestArticles;
import com.goormthonuniv.newscheckr.util.TextUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SummaryStrategyTest {

    private static final String STORY = String.join(" ",
            "The city council approved a new transit budget on Monday.",
            "The transit budget expands bus service to eastern neighborhoods.",
            "Council members debated the budget for several hours before voting.",
            "Residents of eastern neighborhoods have requested more bus service for years.",
            "The mayor said the transit plan will be reviewed again next spring.",
            "Local weather stayed mild throughout the week.");

    static Stream<Arguments> strategies() {
        return Stream.of(
                Arguments.of(new LexRankStrategy()),
                Arguments.of(new TextRankStrategy()),
                Arguments.of(new LsaStrategy()),
                Arguments.of(new LeadStrategy()));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("strategies")
    @DisplayName("선택 결과는 원문 문장의 부분수열: 오름차순, 최대 2개, 범위 내 인덱스")
    void selectionIsOrderedSubsequence(SummaryStrategy strategy) {
        for (String text : List.of(STORY, TestArticles.neutralReuters())) {
            List<String> sentences = TextUtils.sentences(text);

            List<Integer> picked = strategy.select(sentences, 2);

            assertThat(picked).isNotEmpty().hasSizeLessThanOrEqualTo(2);
            assertThat(picked).isSorted().doesNotHaveDuplicates();
            assertThat(picked).allMatch(i -> i >= 0 && i < sentences.size());
        }
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("strategies")
    @DisplayName("문장이 하나뿐이면 전략은 실패한다")
    void singleSentenceRejected(SummaryStrategy strategy) {
        assertThatThrownBy(() -> strategy.select(List.of("Only one sentence here."), 2))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("겹치는 단어가 없으면 그래프 기반 전략은 실패한다")
    void disconnectedGraph() {
        List<String> sentences = List.of("Apples grow quickly.", "Rivers flow south.", "Stars shine brightly.");

        assertThatThrownBy(() -> new LexRankStrategy().select(sentences, 2))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new TextRankStrategy().select(sentences, 2))
                .isInstanceOf(IllegalStateException.class);
        assertThat(new LsaStrategy().select(sentences, 2)).hasSize(2);
    }

    @Test
    @DisplayName("내용어가 하나도 없으면 LSA도 실패한다")
    void lsaNeedsTerms() {
        assertThatThrownBy(() -> new LsaStrategy().select(List.of("It is.", "So it was."), 2))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("거의 같은 문장은 한 번만 선택")
    void nearDuplicatesSkipped() {
        List<String> sentences = List.of(
                "Officials confirmed the budget agreement late on Tuesday evening.",
                "Officials confirmed the budget agreement late on Tuesday evening!",
                "A short note.");
        double[] scores = {0.9, 0.8, 0.1};

        assertThat(SentenceRanker.pick(sentences, scores, 2)).containsExactly(0, 2);
    }

    @Test
    @DisplayName("동점이면 앞 문장을 우선")
    void tiesBrokenByPosition() {
        List<String> sentences = List.of("Alpha story text.", "Beta report words.", "Gamma update lines.");

        assertThat(SentenceRanker.pick(sentences, new double[]{0.5, 0.5, 0.5}, 2)).containsExactly(0, 1);
    }

    @Test
    @DisplayName("lead: 앞쪽 문장이 높은 점수")
    void leadPrefersEarlySentences() {
        List<String> sentences = TextUtils.sentences(STORY);

        assertThat(new LeadStrategy().select(sentences, 2)).containsExactly(0, 1);
    }
}
