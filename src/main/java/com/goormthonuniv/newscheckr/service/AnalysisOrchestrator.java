package com.goormthonuniv.newscheckr.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.goormthonuniv.newscheckr.classify.BiasClassifier;
import com.goormthonuniv.newscheckr.classify.CredibilityClassifier;
import com.goormthonuniv.newscheckr.classify.CredibilityScore;
import com.goormthonuniv.newscheckr.domain.AnalysisResult;
import com.goormthonuniv.newscheckr.domain.Article;
import com.goormthonuniv.newscheckr.domain.BiasVerdict;
import com.goormthonuniv.newscheckr.domain.SourceRating;
import com.goormthonuniv.newscheckr.dto.HealthResponse;
import com.goormthonuniv.newscheckr.exception.*;
import com.goormthonuniv.newscheckr.feature.FeatureExtractor;
import com.goormthonuniv.newscheckr.feature.FeatureVector;
import com.goormthonuniv.newscheckr.feature.TextStats;
import com.goormthonuniv.newscheckr.model.ModelBundle;
import com.goormthonuniv.newscheckr.scraper.ArticleScraper;
import com.goormthonuniv.newscheckr.source.SourceRegistry;
import com.goormthonuniv.newscheckr.summarize.Summary;
import com.goormthonuniv.newscheckr.summarize.TextSummarizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.concurrent.*;

/**
 * 분석 파이프라인.
 * RECEIVED → SCRAPED → FEATURE_EXTRACTED → CLASSIFIED → SUMMARIZED → LABELED → COMPLETED
 */
@Slf4j
@Service
public class AnalysisOrchestrator {

    static final String UNKNOWN_SOURCE = "unknown";
    static final String METHOD_BLENDED = "blended";
    static final String METHOD_SOURCE_ONLY = "source_only";

    // ===== 의존성 =====
    private final SourceRegistry sourceRegistry;
    private final ModelBundle modelBundle;
    private final FeatureExtractor featureExtractor;
    private final CredibilityClassifier credibilityClassifier;
    private final BiasClassifier biasClassifier;
    private final TextSummarizer summarizer;
    private final ArticleScraper scraper;
    private final Executor analysisExecutor;
    private final AsyncTaskExecutor scrapeExecutor;
    private final RetryTemplate scrapeRetryTemplate;

    // ===== 설정 =====
    private final Duration scrapeTimeout;
    private final int maxTextLength;
    private final String serviceVersion;

    // ===== 캐시 =====
    private final Cache<String, Article> scrapeCache;

    public AnalysisOrchestrator(SourceRegistry sourceRegistry,
                                ModelBundle modelBundle,
                                FeatureExtractor featureExtractor,
                                CredibilityClassifier credibilityClassifier,
                                BiasClassifier biasClassifier,
                                TextSummarizer summarizer,
                                ArticleScraper scraper,
                                @Qualifier("analysisExecutor") Executor analysisExecutor,
                                @Qualifier("scrapeExecutor") AsyncTaskExecutor scrapeExecutor,
                                @Qualifier("scrapeRetryTemplate") RetryTemplate scrapeRetryTemplate,
                                @Value("${newscheckr.scraper.timeout:10s}") Duration scrapeTimeout,
                                @Value("${newscheckr.scraper.cache-ttl:15m}") Duration cacheTtl,
                                @Value("${newscheckr.scraper.cache-max-size:500}") long cacheMaxSize,
                                @Value("${newscheckr.input.max-text-length:100000}") int maxTextLength,
                                @Value("${newscheckr.version:0.1.0}") String serviceVersion) {
        this.sourceRegistry = sourceRegistry;
        this.modelBundle = modelBundle;
        this.featureExtractor = featureExtractor;
        this.credibilityClassifier = credibilityClassifier;
        this.biasClassifier = biasClassifier;
        this.summarizer = summarizer;
        this.scraper = scraper;
        this.analysisExecutor = analysisExecutor;
        this.scrapeExecutor = scrapeExecutor;
        this.scrapeRetryTemplate = scrapeRetryTemplate;
        this.scrapeTimeout = scrapeTimeout;
        this.maxTextLength = maxTextLength;
        this.serviceVersion = serviceVersion;
        this.scrapeCache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(cacheMaxSize)
                .build();
    }

    /** URL 분석: 스크래핑 후 파이프라인 */
    public AnalysisResult analyzeUrl(String url) {
        String target = validateUrl(url);
        PipelineRun run = new PipelineRun(target);

        Article article;
        try {
            article = fetch(target);
        } catch (AnalysisException e) {
            run.fail(e.getErrorCode().name());
            log.warn("Scrape failed for {}: {} ({})", target, e.getMessage(), e.getErrorCode());
            throw e;
        }
        run.advance(PipelineState.SCRAPED);
        return analyze(article, run);
    }

    /** 텍스트 직접 분석. source가 없으면 출처 미상 */
    public AnalysisResult analyzeText(String text, String source) {
        if (text == null || text.isBlank()) {
            throw new InputException("text must not be blank");
        }
        if (text.length() > maxTextLength) {
            throw new InputException("text exceeds " + maxTextLength + " characters");
        }
        String domain = source == null || source.isBlank() ? null : source.strip();
        PipelineRun run = new PipelineRun(domain == null ? "text" : domain);
        run.advance(PipelineState.SCRAPED);
        return analyze(Article.ofText(text, domain), run);
    }

    public List<SourceRating> listSources() {
        return sourceRegistry.listSources();
    }

    public HealthResponse health() {
        return new HealthResponse(
                "UP",
                "newscheckr",
                serviceVersion,
                true,
                modelBundle.version(),
                modelBundle.vocabulary().size(),
                sourceRegistry.size(),
                summarizer.strategyNames()
        );
    }

    // ===== 파이프라인 =====

    AnalysisResult analyze(Article article, PipelineRun run) {
        try {
            SourceRating rating = sourceRegistry.lookup(article.sourceDomain());
            TextStats stats = TextStats.of(article.text());

            // 1) 특징 추출 (부족하면 출처 기반으로 계속)
            FeatureVector vector = null;
            try {
                vector = featureExtractor.extract(article.text());
            } catch (InsufficientContentException e) {
                run.markDegraded();
                log.warn("Insufficient content ({} words < {}), falling back to source-only analysis for {}",
                        e.getWordCount(), e.getMinimumWords(), displaySource(rating));
            }
            run.advance(PipelineState.FEATURE_EXTRACTED);

            // 2) 신뢰도 / 성향 병렬 분류
            CredibilityScore credibility;
            BiasVerdict verdict;
            if (vector != null) {
                final FeatureVector v = vector;
                CompletableFuture<CredibilityScore> credibilityTask =
                        CompletableFuture.supplyAsync(() -> credibilityClassifier.score(v, rating), analysisExecutor);
                CompletableFuture<BiasVerdict> biasTask =
                        CompletableFuture.supplyAsync(() -> biasClassifier.classify(v), analysisExecutor);
                credibility = join(credibilityTask);
                verdict = join(biasTask);
            } else {
                credibility = credibilityClassifier.sourceOnly(rating);
                verdict = BiasVerdict.fromSource(rating.knownBias());
            }
            run.advance(PipelineState.CLASSIFIED);

            // 3) 요약 (실패해도 계속)
            Summary summary = null;
            try {
                summary = summarizer.summarize(article.text());
            } catch (SummarizationException e) {
                log.warn("Summarization failed for {}: {}", displaySource(rating), e.getMessage());
            }
            run.advance(PipelineState.SUMMARIZED);

            // 4) 라벨
            List<String> labels = LabelRules.derive(
                    credibility.score(),
                    verdict,
                    rating,
                    LabelRules.isSensational(stats),
                    run.isDegraded(),
                    summary == null);
            run.advance(PipelineState.LABELED);

            // 5) 결과 조립
            run.advance(PipelineState.COMPLETED);
            Map<String, Object> metadata = metadata(article, rating, credibility, verdict, summary, stats, run);
            AnalysisResult result = new AnalysisResult(
                    displaySource(rating),
                    credibility.score(),
                    verdict.bias(),
                    summary == null ? "" : summary.text(),
                    labels,
                    metadata);

            log.info("Analyzed {}: score={} bias={} method={} summary={} elapsed={}ms",
                    result.source(), result.credibilityScore(), result.bias().label(),
                    metadata.get("analysis_method"), metadata.get("summary_method"), run.elapsedMillis());
            return result;
        } catch (RuntimeException e) {
            if (!run.state().isTerminal()) {
                run.fail(e.getClass().getSimpleName());
            }
            log.error("Pipeline failed in state {} for {}", run.state(), article.sourceDomain(), e);
            throw e;
        }
    }

    private static Map<String, Object> metadata(Article article,
                                                SourceRating rating,
                                                CredibilityScore credibility,
                                                BiasVerdict verdict,
                                                Summary summary,
                                                TextStats stats,
                                                PipelineRun run) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("title", article.title());
        m.put("authors", article.authors());
        m.put("published_at", article.publishedAt() == null
                ? null
                : article.publishedAt().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        m.put("url", article.url());
        m.put("analysis_method", credibility.modelUsed() ? METHOD_BLENDED : METHOD_SOURCE_ONLY);
        m.put("source_known", rating.known());
        m.put("source_reputation", rating.reputationScore());
        m.put("model_probability", credibility.modelUsed() ? round4(credibility.modelProbability()) : null);
        m.put("bias_confidence", round4(verdict.confidence()));
        m.put("summary_method", summary == null ? null : summary.method());
        m.put("word_count", stats.wordCount());
        m.put("pipeline_state", run.state().name());
        return m;
    }

    // ===== 스크래핑 =====

    private Article fetch(String url) {
        Article cached = scrapeCache.getIfPresent(url);
        if (cached != null) {
            log.debug("Scrape cache hit: {}", url);
            return cached;
        }
        Article article = scrapeRetryTemplate.execute(ctx -> {
            if (ctx.getRetryCount() > 0) {
                log.warn("Retrying scrape of {} (attempt {}) after: {}",
                        url, ctx.getRetryCount() + 1, ctx.getLastThrowable().getMessage());
            }
            return scrapeWithTimeout(url);
        });
        scrapeCache.put(url, article);
        return article;
    }

    private Article scrapeWithTimeout(String url) {
        Future<Article> task;
        try {
            task = scrapeExecutor.submit(() -> scraper.scrape(url));
        } catch (RejectedExecutionException e) {
            // 수집 풀 포화: 호출 스레드에서 대신 긁지 않는다
            throw new ScrapeException(ScrapeFailureReason.UNREACHABLE, "scrape pool saturated: " + url, e);
        }
        try {
            return task.get(scrapeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            throw new ScrapeTimeoutException(url, scrapeTimeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new ScrapeException(ScrapeFailureReason.UNREACHABLE, "scrape failed: " + cause, cause);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new ScrapeException(ScrapeFailureReason.UNREACHABLE, "scrape interrupted: " + url, e);
        }
    }

    static String validateUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new InputException("url must not be blank");
        }
        String trimmed = url.strip();
        try {
            URI uri = new URI(trimmed);
            String scheme = uri.getScheme();
            if (scheme == null
                    || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    || uri.getHost() == null) {
                throw new InputException("url must be an absolute http(s) url: " + url);
            }
        } catch (URISyntaxException e) {
            throw new InputException("malformed url: " + url);
        }
        return trimmed;
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw e;
        }
    }

    private static String displaySource(SourceRating rating) {
        return rating.domain().isEmpty() ? UNKNOWN_SOURCE : rating.domain();
    }

    private static double round4(double v) {
        return Math.round(v * 10_000.0) / 10_000.0;
    }
}
