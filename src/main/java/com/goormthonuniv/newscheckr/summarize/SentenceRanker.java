package com.goormthonuniv.newscheckr.summarize;

import com.goormthonuniv.newscheckr.util.TextUtils;
import org.apache.commons.text.similarity.LevenshteinDistance;

import java.util.*;

/**
 * 점수 기반 추출 요약의 공통 골격.
 * 문장 점수 → 상위 k개 (동점이면 앞 문장) → 거의 같은 문장은 건너뜀 → 원문 순서로 복원.
 */
public abstract class SentenceRanker implements SummaryStrategy {

    /** 정규화 편집거리 유사도가 이 값 이상이면 중복 문장으로 본다 */
    static final double NEAR_DUPLICATE_SIMILARITY = 0.9;

    private static final LevenshteinDistance LEVENSHTEIN = LevenshteinDistance.getDefaultInstance();

    @Override
    public List<Integer> select(List<String> sentences, int maxSentences) {
        if (maxSentences < 1) {
            throw new IllegalArgumentException("maxSentences must be positive: " + maxSentences);
        }
        if (sentences.size() < 2) {
            throw new IllegalStateException(name() + " needs at least two sentences");
        }
        List<List<String>> tokens = new ArrayList<>(sentences.size());
        for (String s : sentences) tokens.add(TextUtils.contentTokens(s));

        double[] scores = score(sentences, tokens);
        for (double s : scores) {
            if (Double.isNaN(s)) throw new IllegalStateException(name() + " produced NaN scores");
        }
        return pick(sentences, scores, maxSentences);
    }

    /**
     * @param sentences 원문 문장
     * @param tokens    문장별 내용어 토큰 (소문자, 불용어 제거)
     * @return 문장별 점수. 그래프/행렬이 퇴화하면 IllegalStateException
     */
    protected abstract double[] score(List<String> sentences, List<List<String>> tokens);

    static List<Integer> pick(List<String> sentences, double[] scores, int k) {
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) order.add(i);
        order.sort(Comparator.<Integer>comparingDouble(i -> scores[i]).reversed()
                .thenComparing(Comparator.naturalOrder()));

        List<Integer> chosen = new ArrayList<>(k);
        for (int idx : order) {
            if (chosen.size() == k) break;
            boolean duplicate = false;
            for (int c : chosen) {
                if (nearDuplicate(sentences.get(idx), sentences.get(c))) {
                    duplicate = true;
                    break;
                }
            }
            if (!duplicate) chosen.add(idx);
        }
        Collections.sort(chosen);
        return chosen;
    }

    static boolean nearDuplicate(String a, String b) {
        String x = a.toLowerCase(Locale.ROOT);
        String y = b.toLowerCase(Locale.ROOT);
        int longest = Math.max(x.length(), y.length());
        if (longest == 0) return true;
        int distance = LEVENSHTEIN.apply(x, y);
        return 1.0 - (double) distance / longest >= NEAR_DUPLICATE_SIMILARITY;
    }

    /**
     * 가중 그래프 위의 PageRank (power iteration). 나가는 간선이 없는 노드의 질량은 균등 분배.
     */
    static double[] pageRank(double[][] weights, double damping, int maxIterations, double tolerance) {
        int n = weights.length;
        double[] outSum = new double[n];
        boolean anyEdge = false;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                outSum[i] += weights[i][j];
                if (weights[i][j] > 0) anyEdge = true;
            }
        }
        if (!anyEdge) {
            throw new IllegalStateException("sentence graph has no edges");
        }

        double[] rank = new double[n];
        Arrays.fill(rank, 1.0 / n);
        for (int iter = 0; iter < maxIterations; iter++) {
            double dangling = 0.0;
            for (int i = 0; i < n; i++) {
                if (outSum[i] == 0) dangling += rank[i];
            }
            double[] next = new double[n];
            Arrays.fill(next, (1.0 - damping) / n + damping * dangling / n);
            for (int i = 0; i < n; i++) {
                if (outSum[i] == 0) continue;
                for (int j = 0; j < n; j++) {
                    if (weights[i][j] > 0) next[j] += damping * rank[i] * weights[i][j] / outSum[i];
                }
            }
            double delta = 0.0;
            for (int i = 0; i < n; i++) delta += Math.abs(next[i] - rank[i]);
            rank = next;
            if (delta < tolerance) break;
        }
        return rank;
    }
}
