package com.goormthonuniv.newscheckr.classify;

import com.goormthonuniv.newscheckr.domain.Bias;
import com.goormthonuniv.newscheckr.domain.BiasVerdict;
import com.goormthonuniv.newscheckr.feature.FeatureVector;
import com.goormthonuniv.newscheckr.model.NaiveBayesModel;

import java.util.Map;

/**
 * 나이브 베이즈 확률의 argmax. 1, 2위 확률 차이가 epsilon 미만이면 Center로 본다.
 */
public class BiasClassifier {

    private final NaiveBayesModel model;
    private final double tieEpsilon;

    public BiasClassifier(NaiveBayesModel model, double tieEpsilon) {
        if (tieEpsilon < 0.0 || tieEpsilon >= 1.0) {
            throw new IllegalArgumentException("tie epsilon must be in [0,1): " + tieEpsilon);
        }
        this.model = model;
        this.tieEpsilon = tieEpsilon;
    }

    public BiasVerdict classify(FeatureVector vector) {
        Map<Bias, Double> probs = model.predictProbabilities(vector);

        Bias best = null;
        double first = -1.0, second = -1.0;
        for (Map.Entry<Bias, Double> e : probs.entrySet()) {
            double p = e.getValue();
            if (p > first) {
                second = first;
                first = p;
                best = e.getKey();
            } else if (p > second) {
                second = p;
            }
        }

        if (best == null || first - second < tieEpsilon) {
            return new BiasVerdict(Bias.CENTER, probs.getOrDefault(Bias.CENTER, 0.0), probs);
        }
        return new BiasVerdict(best, first, probs);
    }
}
