package com.goormthonuniv.newscheckr.summarize;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * LexRank: idf-modified cosine 유사도가 임계값을 넘는 문장 쌍을 간선으로 잇고
 * 차수 정규화 후 PageRank.
 */
public class LexRankStrategy extends SentenceRanker {

    static final double SIMILARITY_THRESHOLD = 0.1;
    static final double DAMPING = 0.85;

    @Override
    public String name() {
        return "lexrank";
    }

    @Override
    protected double[] score(List<String> sentences, List<List<String>> tokens) {
        List<Map<String, Integer>> tfs = new ArrayList<>(tokens.size());
        for (List<String> t : tokens) tfs.add(SentenceSimilarity.termFrequencies(t));
        Map<String, Double> idf = SentenceSimilarity.sentenceIdf(tfs);

        int n = tfs.size();
        double[][] adjacency = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (SentenceSimilarity.idfModifiedCosine(tfs.get(i), tfs.get(j), idf) > SIMILARITY_THRESHOLD) {
                    adjacency[i][j] = 1.0;
                    adjacency[j][i] = 1.0;
                }
            }
        }
        return pageRank(adjacency, DAMPING, 100, 1e-6);
    }
}
