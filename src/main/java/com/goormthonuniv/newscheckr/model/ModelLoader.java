package com.goormthonuniv.newscheckr.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.newscheckr.domain.Bias;
import com.goormthonuniv.newscheckr.exception.ModelUnavailableException;
import com.goormthonuniv.newscheckr.feature.Vocabulary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 모델 아티팩트를 읽어 {@link ModelBundle}로 변환한다.
 * 읽기/파싱/검증 중 어느 단계라도 실패하면 {@link ModelUnavailableException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelLoader {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public ModelBundle load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.error("Model artifact not found: {}", location);
            throw new ModelUnavailableException("model artifact not found: " + location);
        }
        ModelDefinition definition;
        try (InputStream in = resource.getInputStream()) {
            definition = objectMapper.readValue(in, ModelDefinition.class);
        } catch (IOException e) {
            log.error("Failed to read model artifact {}", location, e);
            throw new ModelUnavailableException("unreadable model artifact: " + location, e);
        }

        try {
            ModelBundle bundle = build(definition);
            log.info("Loaded model {} from {} (vocabulary={}, trees={})",
                    bundle.version(), location, bundle.vocabulary().size(), bundle.credibilityForest().size());
            return bundle;
        } catch (IllegalArgumentException | NullPointerException e) {
            log.error("Invalid model artifact {}: {}", location, e.getMessage());
            throw new ModelUnavailableException("invalid model artifact " + location + ": " + e.getMessage(), e);
        }
    }

    ModelBundle build(ModelDefinition definition) {
        if (definition == null) throw new IllegalArgumentException("empty artifact");
        if (definition.credibility() == null) throw new IllegalArgumentException("credibility section is missing");
        if (definition.bias() == null) throw new IllegalArgumentException("bias section is missing");

        Vocabulary vocabulary = new Vocabulary(definition.vocabulary());

        // ===== 신뢰도 포레스트 =====
        List<ModelDefinition.Node> treeDefs = definition.credibility().trees();
        if (treeDefs == null) throw new IllegalArgumentException("credibility trees are missing");
        List<TreeNode> trees = new ArrayList<>(treeDefs.size());
        for (ModelDefinition.Node def : treeDefs) trees.add(toNode(def, vocabulary));
        RandomForest forest = new RandomForest(trees);

        // ===== 성향 나이브 베이즈 =====
        ModelDefinition.BiasSection bias = definition.bias();
        Map<Bias, Double> priors = new EnumMap<>(Bias.class);
        if (bias.priors() == null) {
            for (Bias b : Bias.values()) priors.put(b, 1.0 / Bias.values().length);
        } else {
            bias.priors().forEach((label, p) -> priors.put(Bias.fromLabel(label), p));
        }
        Map<Bias, Map<String, Double>> counts = new EnumMap<>(Bias.class);
        if (bias.featureCounts() != null) {
            bias.featureCounts().forEach((label, c) -> counts.put(Bias.fromLabel(label), c));
        }
        double alpha = bias.alpha() == null ? 1.0 : bias.alpha();
        NaiveBayesModel nb = new NaiveBayesModel(priors, counts, vocabulary.terms(), alpha);

        return new ModelBundle(definition.version(), vocabulary, forest, nb);
    }

    private TreeNode toNode(ModelDefinition.Node def, Vocabulary vocabulary) {
        if (def == null) throw new IllegalArgumentException("tree node is missing");
        if (def.feature() == null) {
            if (def.value() == null) throw new IllegalArgumentException("leaf without value");
            return TreeNode.leaf(def.value());
        }
        FeatureRef ref = FeatureRef.parse(def.feature());
        if (ref.isTerm() && !vocabulary.contains(ref.term())) {
            throw new IllegalArgumentException("tree splits on term outside vocabulary: " + ref.term());
        }
        if (def.threshold() == null) throw new IllegalArgumentException("split without threshold: " + ref);
        return TreeNode.split(ref, def.threshold(), toNode(def.left(), vocabulary), toNode(def.right(), vocabulary));
    }
}
