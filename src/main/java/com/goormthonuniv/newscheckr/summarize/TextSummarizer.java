package com.goormthonuniv.newscheckr.summarize;

import com.goormthonuniv.newscheckr.exception.SummarizationException;
import com.goormthonuniv.newscheckr.util.TextUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 전략 체인 요약기. 앞 전략이 실패하면 다음 전략을 시도한다.
 * 모두 실패하면: 문장 수가 maxSentences 이하 → 원문 그대로 (앞뒤 공백만 제거), 아니면 lead 휴리스틱.
 * 문장이 하나도 없을 때만 SummarizationException.
 */
@Slf4j
public class TextSummarizer {

    private final List<SummaryStrategy> chain;
    private final SummaryStrategy lastResort;
    private final int defaultMaxSentences;

    public TextSummarizer(List<SummaryStrategy> chain, SummaryStrategy lastResort, int defaultMaxSentences) {
        if (defaultMaxSentences < 1) {
            throw new IllegalArgumentException("maxSentences must be positive: " + defaultMaxSentences);
        }
        this.chain = List.copyOf(chain);
        this.lastResort = lastResort;
        this.defaultMaxSentences = defaultMaxSentences;
    }

    /** LexRank → TextRank → LSA, 최후 수단 lead */
    public static TextSummarizer standard(int maxSentences) {
        return new TextSummarizer(
                List.of(new LexRankStrategy(), new TextRankStrategy(), new LsaStrategy()),
                new LeadStrategy(),
                maxSentences);
    }

    public Summary summarize(String text) {
        return summarize(text, defaultMaxSentences);
    }

    public Summary summarize(String text, int maxSentences) {
        if (maxSentences < 1) {
            throw new IllegalArgumentException("maxSentences must be positive: " + maxSentences);
        }
        List<String> sentences = TextUtils.sentences(text);
        if (sentences.isEmpty()) {
            throw new SummarizationException("no sentence boundary found in text");
        }

        for (SummaryStrategy strategy : chain) {
            try {
                List<Integer> picked = strategy.select(sentences, maxSentences);
                if (!picked.isEmpty()) {
                    return new Summary(join(sentences, picked), strategy.name());
                }
                log.debug("Summary strategy {} selected nothing", strategy.name());
            } catch (RuntimeException e) {
                log.debug("Summary strategy {} failed: {}", strategy.name(), e.getMessage());
            }
        }

        if (sentences.size() <= maxSentences) {
            return new Summary(text.strip(), Summary.VERBATIM);
        }
        return new Summary(join(sentences, lastResort.select(sentences, maxSentences)), lastResort.name());
    }

    public List<String> strategyNames() {
        List<String> names = new ArrayList<>();
        for (SummaryStrategy s : chain) names.add(s.name());
        names.add(lastResort.name());
        return names;
    }

    private static String join(List<String> sentences, List<Integer> indices) {
        StringBuilder sb = new StringBuilder();
        for (int i : indices) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(sentences.get(i));
        }
        return sb.toString();
    }
}
