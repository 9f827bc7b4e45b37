package com.goormthonuniv.newscheckr.feature;

import com.goormthonuniv.newscheckr.exception.InsufficientContentException;
import com.goormthonuniv.newscheckr.util.TextUtils;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 원문 → FeatureVector.
 * tf = 어휘에 포함된 토큰의 등장 횟수, weight = tf * idf, 이후 L2 정규화.
 * 같은 텍스트는 항상 같은 벡터가 된다 (정렬된 맵, 난수 없음).
 */
public class FeatureExtractor {

    private final Vocabulary vocabulary;
    private final int minWords;

    public FeatureExtractor(Vocabulary vocabulary, int minWords) {
        if (minWords < 1) {
            throw new IllegalArgumentException("minWords must be positive: " + minWords);
        }
        this.vocabulary = vocabulary;
        this.minWords = minWords;
    }

    public FeatureVector extract(String text) {
        List<String> words = TextUtils.words(text);
        if (words.size() < minWords) {
            throw new InsufficientContentException(words.size(), minWords);
        }
        TextStats stats = TextStats.of(text, words);

        Map<String, Integer> counts = new TreeMap<>();
        for (String token : TextUtils.contentTokens(words)) {
            if (vocabulary.contains(token)) counts.merge(token, 1, Integer::sum);
        }

        TreeMap<String, Double> weights = new TreeMap<>();
        double norm = 0.0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            double w = e.getValue() * vocabulary.idf(e.getKey());
            weights.put(e.getKey(), w);
            norm += w * w;
        }
        if (norm > 0.0) {
            double len = Math.sqrt(norm);
            weights.replaceAll((term, w) -> w / len);
        }
        return new FeatureVector(weights, stats);
    }
}
