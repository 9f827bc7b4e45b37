package com.goormthonuniv.newscheckr.summarize;

import java.util.*;

/**
 * 문장 간 유사도 계산 모음.
 */
final class SentenceSimilarity {

    private SentenceSimilarity() {}

    static Map<String, Integer> termFrequencies(List<String> tokens) {
        Map<String, Integer> m = new HashMap<>();
        for (String t : tokens) m.merge(t, 1, Integer::sum);
        return m;
    }

    /** 문장 집합 기준 idf = 1 + log(N / df) */
    static Map<String, Double> sentenceIdf(List<Map<String, Integer>> tfs) {
        Map<String, Integer> df = new HashMap<>();
        for (Map<String, Integer> tf : tfs) {
            for (String t : tf.keySet()) df.merge(t, 1, Integer::sum);
        }
        int n = tfs.size();
        Map<String, Double> idf = new HashMap<>();
        df.forEach((t, d) -> idf.put(t, 1.0 + Math.log((double) n / d)));
        return idf;
    }

    /** LexRank의 idf-modified cosine */
    static double idfModifiedCosine(Map<String, Integer> a, Map<String, Integer> b, Map<String, Double> idf) {
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        double dot = 0, na = 0, nb = 0;
        for (Map.Entry<String, Integer> e : a.entrySet()) {
            double w = idf.getOrDefault(e.getKey(), 1.0);
            double xa = e.getValue() * w;
            na += xa * xa;
            Integer xbCount = b.get(e.getKey());
            if (xbCount != null) dot += xa * xbCount * w;
        }
        for (Map.Entry<String, Integer> e : b.entrySet()) {
            double xb = e.getValue() * idf.getOrDefault(e.getKey(), 1.0);
            nb += xb * xb;
        }
        if (na == 0 || nb == 0) return 0.0;
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }

    /** TextRank 가중치: |Si ∩ Sj| / (log(1+|Si|) + log(1+|Sj|)) */
    static double overlap(List<String> a, List<String> b) {
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        Set<String> common = new HashSet<>(a);
        common.retainAll(new HashSet<>(b));
        if (common.isEmpty()) return 0.0;
        return common.size() / (Math.log1p(a.size()) + Math.log1p(b.size()));
    }
}
