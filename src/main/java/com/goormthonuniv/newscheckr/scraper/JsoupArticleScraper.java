package com.goormthonuniv.newscheckr.scraper;

import com.goormthonuniv.newscheckr.domain.Article;
import com.goormthonuniv.newscheckr.exception.ScrapeException;
import com.goormthonuniv.newscheckr.exception.ScrapeFailureReason;
import com.goormthonuniv.newscheckr.source.SourceRegistry;
import com.goormthonuniv.newscheckr.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * jsoup 기반 기사 추출기.
 * 제목: og:title → title → h1, 본문: 기사 컨테이너 후보 중 첫 번째로 충분히 긴 것, 없으면 body.
 */
@Slf4j
@Component
public class JsoupArticleScraper implements ArticleScraper {

    private static final String[] CONTAINER_SELECTORS = {
            "article", "[role=main]", ".article-content", ".post-content", ".entry-content",
            ".article-body", ".story-body", "main"
    };
    private static final String NOISE = "script, style, noscript, nav, header, footer, aside, form, iframe";
    private static final String PAYWALL_MARKERS =
            ".paywall, #paywall, [class*=paywall], [data-paywall], .subscriber-only, .subscription-required, .meteredContent";
    private static final String[] AUTHOR_META = {
            "meta[name=author]", "meta[property=article:author]", "meta[name=byl]", "meta[name=parsely-author]"
    };
    private static final String[] DATE_META = {
            "meta[property=article:published_time]", "meta[name=pubdate]", "meta[name=publish-date]",
            "meta[itemprop=datePublished]", "meta[name=date]"
    };

    private final String userAgent;
    private final int timeoutMillis;
    private final int minTextLength;

    public JsoupArticleScraper(@Value("${newscheckr.scraper.user-agent}") String userAgent,
                               @Value("${newscheckr.scraper.timeout:10s}") Duration timeout,
                               @Value("${newscheckr.scraper.min-text-length:100}") int minTextLength) {
        this.userAgent = userAgent;
        this.timeoutMillis = (int) timeout.toMillis();
        this.minTextLength = minTextLength;
    }

    @Override
    public Article scrape(String url) {
        validateUrl(url);
        Document doc;
        try {
            doc = Jsoup.connect(url)
                    .userAgent(userAgent)
                    .timeout(timeoutMillis)
                    .followRedirects(true)
                    .get();
        } catch (HttpStatusException e) {
            // 5xx는 일시 장애로 보고 재시도 대상, 4xx는 기사 없음
            ScrapeFailureReason reason = e.getStatusCode() >= 500
                    ? ScrapeFailureReason.UNREACHABLE
                    : ScrapeFailureReason.NO_CONTENT;
            throw new ScrapeException(reason, "HTTP " + e.getStatusCode() + " from " + url, e);
        } catch (IllegalArgumentException e) {
            throw new ScrapeException(ScrapeFailureReason.MALFORMED_URL, "malformed url: " + url, e);
        } catch (IOException e) {
            throw new ScrapeException(ScrapeFailureReason.UNREACHABLE,
                    "failed to fetch " + url + ": " + e.getMessage(), e);
        }
        Article article = parse(doc, url);
        log.info("Scraped {} ({} chars)", article.sourceDomain(), article.text().length());
        return article;
    }

    /** 네트워크 없이 파싱만. 테스트에서 직접 호출 */
    Article parse(Document doc, String url) {
        boolean paywallMarked = !doc.select(PAYWALL_MARKERS).isEmpty();
        String title = extractTitle(doc);
        List<String> authors = extractAuthors(doc);
        OffsetDateTime publishedAt = extractPublishedAt(doc);

        doc.select(NOISE).remove();
        doc.select(PAYWALL_MARKERS).remove();
        String text = extractText(doc);

        if (text.length() < minTextLength) {
            if (paywallMarked) {
                throw new ScrapeException(ScrapeFailureReason.PAYWALLED, "article is behind a paywall: " + url);
            }
            throw new ScrapeException(ScrapeFailureReason.NO_CONTENT,
                    "article text too short (" + text.length() + " chars): " + url);
        }
        return new Article(url, SourceRegistry.normalize(url), title, text, authors, publishedAt);
    }

    static void validateUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new ScrapeException(ScrapeFailureReason.MALFORMED_URL, "url is blank");
        }
        try {
            URI uri = new URI(url.strip());
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    || uri.getHost() == null || uri.getHost().isBlank()) {
                throw new ScrapeException(ScrapeFailureReason.MALFORMED_URL, "not an http(s) url: " + url);
            }
        } catch (URISyntaxException e) {
            throw new ScrapeException(ScrapeFailureReason.MALFORMED_URL, "malformed url: " + url, e);
        }
    }

    private static String extractTitle(Document doc) {
        String og = doc.select("meta[property=og:title]").attr("content");
        if (!og.isBlank()) return og.strip();
        if (!doc.title().isBlank()) return doc.title().strip();
        Element h1 = doc.selectFirst("h1");
        return h1 == null ? "" : h1.text().strip();
    }

    private String extractText(Document doc) {
        for (String selector : CONTAINER_SELECTORS) {
            Element container = doc.selectFirst(selector);
            if (container == null) continue;
            String text = containerText(container);
            if (text.length() >= minTextLength) return text;
        }
        return doc.body() == null ? "" : containerText(doc.body());
    }

    /** 문단이 있으면 문단 단위로 이어 붙인다 */
    private static String containerText(Element container) {
        Elements paragraphs = container.select("p");
        if (paragraphs.isEmpty()) {
            return TextUtils.normalizeWhitespace(container.text());
        }
        StringJoiner joiner = new StringJoiner("\n\n");
        for (Element p : paragraphs) {
            String t = TextUtils.normalizeWhitespace(p.text());
            if (!t.isEmpty()) joiner.add(t);
        }
        return joiner.toString();
    }

    private static List<String> extractAuthors(Document doc) {
        Set<String> names = new LinkedHashSet<>();
        for (String selector : AUTHOR_META) {
            for (Element meta : doc.select(selector)) {
                addAuthors(names, meta.attr("content"));
            }
        }
        if (names.isEmpty()) {
            for (Element el : doc.select("[rel=author], .byline-name, .author-name")) {
                addAuthors(names, el.text());
            }
        }
        return new ArrayList<>(names);
    }

    private static void addAuthors(Set<String> names, String raw) {
        if (raw == null || raw.isBlank() || raw.contains("://")) return;
        String cleaned = raw.strip().replaceFirst("(?i)^by\\s+", "");
        for (String part : cleaned.split("\\s*(?:,|\\band\\b)\\s*")) {
            if (!part.isBlank()) names.add(part.strip());
        }
    }

    private static OffsetDateTime extractPublishedAt(Document doc) {
        List<String> candidates = new ArrayList<>();
        for (String selector : DATE_META) {
            String v = doc.select(selector).attr("content");
            if (!v.isBlank()) candidates.add(v.strip());
        }
        Element time = doc.selectFirst("time[datetime]");
        if (time != null) candidates.add(time.attr("datetime").strip());

        for (String v : candidates) {
            try {
                return OffsetDateTime.parse(v);
            } catch (DateTimeParseException e) {
                try {
                    return LocalDate.parse(v.length() >= 10 ? v.substring(0, 10) : v)
                            .atStartOfDay().atOffset(ZoneOffset.UTC);
                } catch (DateTimeParseException e2) {
                    log.debug("Unparseable publish date '{}'", v);
                }
            }
        }
        return null;
    }
}
