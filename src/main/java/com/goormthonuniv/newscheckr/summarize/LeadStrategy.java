package com.goormthonuniv.newscheckr.summarize;

import java.util.List;

/** 위치 60% + 길이 40%. 앞쪽의 적당히 긴 문장을 고른다 */
public class LeadStrategy extends SentenceRanker {

    @Override
    public String name() {
        return "lead";
    }

    @Override
    protected double[] score(List<String> sentences, List<List<String>> tokens) {
        int n = sentences.size();
        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            double position = 1.0 - (double) i / n;
            double length = Math.min(sentences.get(i).length() / 200.0, 1.0);
            scores[i] = position * 0.6 + length * 0.4;
        }
        return scores;
    }
}
