package com.goormthonuniv.newscheckr.config;

import com.goormthonuniv.newscheckr.classify.BiasClassifier;
import com.goormthonuniv.newscheckr.classify.CredibilityClassifier;
import com.goormthonuniv.newscheckr.feature.FeatureExtractor;
import com.goormthonuniv.newscheckr.model.ModelBundle;
import com.goormthonuniv.newscheckr.model.ModelLoader;
import com.goormthonuniv.newscheckr.service.TransientScrapeRetryPolicy;
import com.goormthonuniv.newscheckr.source.SourceRegistry;
import com.goormthonuniv.newscheckr.summarize.TextSummarizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.retry.backoff.FixedBackOffPolicy;
import org.springframework.retry.support.RetryTemplate;

/**
 * 분석 파이프라인 구성 요소. 모델은 기동 시 한 번 읽고, 실패하면 컨텍스트가 뜨지 않는다.
 */
@Configuration
@PropertySource(
        value = "classpath:properties/env.properties",
        ignoreResourceNotFound = true
)
public class AnalysisConfig {

    @Bean
    public ModelBundle modelBundle(ModelLoader loader,
                                   @Value("${newscheckr.model.location:classpath:model/newscheckr-model.json}") String location) {
        return loader.load(location);
    }

    @Bean
    public SourceRegistry sourceRegistry() {
        return SourceRegistry.defaults();
    }

    @Bean
    public FeatureExtractor featureExtractor(ModelBundle bundle,
                                             @Value("${newscheckr.features.min-words:50}") int minWords) {
        return new FeatureExtractor(bundle.vocabulary(), minWords);
    }

    @Bean
    public CredibilityClassifier credibilityClassifier(ModelBundle bundle,
                                                       @Value("${newscheckr.credibility.model-weight:0.7}") double modelWeight) {
        return new CredibilityClassifier(bundle.credibilityForest(), modelWeight, 1.0 - modelWeight);
    }

    @Bean
    public BiasClassifier biasClassifier(ModelBundle bundle,
                                         @Value("${newscheckr.bias.tie-epsilon:0.05}") double tieEpsilon) {
        return new BiasClassifier(bundle.biasModel(), tieEpsilon);
    }

    @Bean
    public TextSummarizer textSummarizer(@Value("${newscheckr.summary.max-sentences:2}") int maxSentences) {
        return TextSummarizer.standard(maxSentences);
    }

    /** 일시 장애(unreachable)만 1회 재시도 */
    @Bean
    public RetryTemplate scrapeRetryTemplate(@Value("${newscheckr.scraper.retry-backoff-ms:500}") long backoffMillis) {
        FixedBackOffPolicy backOff = new FixedBackOffPolicy();
        backOff.setBackOffPeriod(backoffMillis);
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new TransientScrapeRetryPolicy(2));
        template.setBackOffPolicy(backOff);
        return template;
    }
}
