package com.goormthonuniv.newscheckr.scraper;

import com.goormthonuniv.newscheckr.domain.Article;

public interface ArticleScraper {
    /**
     * @throws com.goormthonuniv.newscheckr.exception.ScrapeException
     *         unreachable / paywalled / no-content / malformed-url
     */
    Article scrape(String url);
}
