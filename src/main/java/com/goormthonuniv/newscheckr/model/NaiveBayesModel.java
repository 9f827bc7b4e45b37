package com.goormthonuniv.newscheckr.model;

import com.goormthonuniv.newscheckr.domain.Bias;
import com.goormthonuniv.newscheckr.feature.FeatureVector;

import java.util.*;

/**
 * 다항 나이브 베이즈.
 * theta(c,t) = (count(c,t) + alpha) / (total(c) + alpha * |V|)
 * jll(c) = log P(c) + sum_t x_t * log theta(c,t)
 */
public final class NaiveBayesModel {

    private final List<Bias> classes;
    private final double[] logPriors;
    private final Map<String, double[]> logTheta;

    public NaiveBayesModel(Map<Bias, Double> priors,
                           Map<Bias, Map<String, Double>> featureCounts,
                           Collection<String> vocabulary,
                           double alpha) {
        if (!(alpha > 0.0)) {
            throw new IllegalArgumentException("smoothing alpha must be positive: " + alpha);
        }
        if (vocabulary.isEmpty()) {
            throw new IllegalArgumentException("vocabulary is empty");
        }
        this.classes = List.of(Bias.values());
        int k = classes.size();

        this.logPriors = new double[k];
        double priorSum = 0.0;
        for (Bias c : classes) {
            Double p = priors.get(c);
            if (p == null || !(p > 0.0)) {
                throw new IllegalArgumentException("missing or non-positive prior for " + c.label());
            }
            priorSum += p;
        }
        for (int i = 0; i < k; i++) {
            logPriors[i] = Math.log(priors.get(classes.get(i)) / priorSum);
        }

        double[] totals = new double[k];
        for (int i = 0; i < k; i++) {
            Map<String, Double> counts = featureCounts.getOrDefault(classes.get(i), Map.of());
            for (Map.Entry<String, Double> e : counts.entrySet()) {
                if (!vocabulary.contains(e.getKey())) {
                    throw new IllegalArgumentException("feature count for term outside vocabulary: " + e.getKey());
                }
                if (e.getValue() == null || e.getValue() < 0.0) {
                    throw new IllegalArgumentException("negative feature count for " + e.getKey());
                }
                totals[i] += e.getValue();
            }
        }

        Map<String, double[]> table = new HashMap<>();
        for (String term : vocabulary) {
            double[] row = new double[k];
            for (int i = 0; i < k; i++) {
                double count = featureCounts.getOrDefault(classes.get(i), Map.of()).getOrDefault(term, 0.0);
                row[i] = Math.log((count + alpha) / (totals[i] + alpha * vocabulary.size()));
            }
            table.put(term, row);
        }
        this.logTheta = Collections.unmodifiableMap(table);
    }

    public double[] jointLogLikelihood(FeatureVector vector) {
        double[] jll = logPriors.clone();
        for (Map.Entry<String, Double> e : vector.termWeights().entrySet()) {
            double[] row = logTheta.get(e.getKey());
            if (row == null) continue;
            for (int i = 0; i < jll.length; i++) jll[i] += e.getValue() * row[i];
        }
        return jll;
    }

    /** softmax(jll). 반환 맵 순서는 Left, Center, Right */
    public Map<Bias, Double> predictProbabilities(FeatureVector vector) {
        double[] jll = jointLogLikelihood(vector);
        double max = Arrays.stream(jll).max().orElse(0.0);
        double sum = 0.0;
        double[] exp = new double[jll.length];
        for (int i = 0; i < jll.length; i++) {
            exp[i] = Math.exp(jll[i] - max);
            sum += exp[i];
        }
        Map<Bias, Double> out = new EnumMap<>(Bias.class);
        for (int i = 0; i < jll.length; i++) out.put(classes.get(i), exp[i] / sum);
        return out;
    }

    public List<Bias> classes() {
        return classes;
    }
}
