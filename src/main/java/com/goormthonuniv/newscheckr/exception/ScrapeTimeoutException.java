package com.goormthonuniv.newscheckr.exception;

import java.time.Duration;

public class ScrapeTimeoutException extends AnalysisException {

    public ScrapeTimeoutException(String url, Duration timeout) {
        super(ErrorCode.SCRAPE_TIMEOUT, "scraping " + url + " exceeded " + timeout.toMillis() + " ms");
    }
}
