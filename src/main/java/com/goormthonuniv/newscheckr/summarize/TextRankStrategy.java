package com.goormthonuniv.newscheckr.summarize;

import java.util.List;

/** TextRank: 단어 겹침 가중치 그래프 위의 가중 PageRank */
public class TextRankStrategy extends SentenceRanker {

    static final double DAMPING = 0.85;

    @Override
    public String name() {
        return "textrank";
    }

    @Override
    protected double[] score(List<String> sentences, List<List<String>> tokens) {
        int n = tokens.size();
        double[][] weights = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double w = SentenceSimilarity.overlap(tokens.get(i), tokens.get(j));
                weights[i][j] = w;
                weights[j][i] = w;
            }
        }
        return pageRank(weights, DAMPING, 100, 1e-6);
    }
}
