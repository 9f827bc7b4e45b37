package com.goormthonuniv.newscheckr.summarize;

import com.goormthonuniv.newscheckr.TestArticles;
import com.goormthonuniv.newscheckr.exception.SummarizationException;
import com.goormthonuniv.newscheckr.util.TextUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;

class TextSummarizerTest {

    private final TextSummarizer summarizer = TextSummarizer.standard(2);

    @Test
    @DisplayName("정상 기사는 LexRank가 두 문장 이하를 원문 순서대로 고른다")
    void lexRankFirst() {
        String text = TestArticles.neutralReuters();

        Summary summary = summarizer.summarize(text);

        assertThat(summary.method()).isEqualTo("lexrank");
        assertThat(summary.text()).isNotBlank();
        assertSubsequence(summary.text(), TextUtils.sentences(text));
    }

    @Test
    @DisplayName("문장이 하나면 그 문장을 그대로 돌려준다")
    void singleSentenceVerbatim() {
        String text = "The committee approved the budget on Tuesday.";

        Summary summary = summarizer.summarize(text);

        assertThat(summary.text()).isEqualTo(text);
        assertThat(summary.method()).isEqualTo(Summary.VERBATIM);
    }

    @Test
    @DisplayName("원문 그대로 반환할 때 문장 안의 줄바꿈도 유지한다")
    void verbatimKeepsOriginalWhitespace() {
        String text = "The committee approved\n  the budget on Tuesday.";

        Summary summary = summarizer.summarize("  " + text + "\n");

        assertThat(summary.method()).isEqualTo(Summary.VERBATIM);
        assertThat(summary.text()).isEqualTo(text);
    }

    @Test
    @DisplayName("그래프 전략이 실패하면 LSA로 넘어간다")
    void fallsThroughToLsa() {
        Summary summary = summarizer.summarize("Apples grow quickly. Rivers flow south. Stars shine brightly.");

        assertThat(summary.method()).isEqualTo("lsa");
        assertSubsequence(summary.text(),
                List.of("Apples grow quickly.", "Rivers flow south.", "Stars shine brightly."));
    }

    @Test
    @DisplayName("모든 전략이 실패하고 문장이 많으면 lead 휴리스틱")
    void leadAsLastResort() {
        Summary summary = summarizer.summarize("It is. So it was. And then it is.");

        assertThat(summary.method()).isEqualTo("lead");
        assertThat(summary.text()).isEqualTo("It is. So it was.");
    }

    @Test
    @DisplayName("모든 전략이 실패해도 문장 수가 최대치 이하면 원문 그대로")
    void verbatimWhenShortEnough() {
        Summary summary = summarizer.summarize("It is. So it was.");

        assertThat(summary.method()).isEqualTo(Summary.VERBATIM);
        assertThat(summary.text()).isEqualTo("It is. So it was.");
    }

    @Test
    @DisplayName("체인은 선언 순서대로 시도하고 실패한 전략 다음으로 넘어간다")
    void chainOrder() {
        SummaryStrategy failing = mock(SummaryStrategy.class);
        given(failing.name()).willReturn("failing");
        given(failing.select(anyList(), anyInt())).willThrow(new IllegalStateException("boom"));
        SummaryStrategy second = mock(SummaryStrategy.class);
        given(second.name()).willReturn("second");
        given(second.select(anyList(), anyInt())).willReturn(List.of(1));

        TextSummarizer chain = new TextSummarizer(List.of(failing, second), new LeadStrategy(), 2);
        Summary summary = chain.summarize("First one here. Second one here. Third one here.");

        assertThat(summary).isEqualTo(new Summary("Second one here.", "second"));
        verify(failing).select(anyList(), eq(2));
        assertThat(chain.strategyNames()).containsExactly("failing", "second", "lead");
    }

    @Test
    @DisplayName("문장 경계를 찾을 수 없으면 SummarizationException")
    void noSentences() {
        assertThatThrownBy(() -> summarizer.summarize("!!! ... ???"))
                .isInstanceOf(SummarizationException.class);
        assertThatThrownBy(() -> summarizer.summarize(""))
                .isInstanceOf(SummarizationException.class);
    }

    private static void assertSubsequence(String summary, List<String> sentences) {
        int from = 0;
        String rest = summary;
        while (!rest.isEmpty()) {
            boolean matched = false;
            for (int i = from; i < sentences.size(); i++) {
                if (rest.startsWith(sentences.get(i))) {
                    rest = rest.substring(sentences.get(i).length()).stripLeading();
                    from = i + 1;
                    matched = true;
                    break;
                }
            }
            assertThat(matched).as("summary is an ordered subsequence of source sentences").isTrue();
        }
    }
}
