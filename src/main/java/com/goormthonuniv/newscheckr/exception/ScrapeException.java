package com.goormthonuniv.newscheckr.exception;

public class ScrapeException extends AnalysisException {

    private final ScrapeFailureReason failureReason;

    public ScrapeException(ScrapeFailureReason failureReason, String message) {
        super(ErrorCode.SCRAPE_ERROR, message);
        this.failureReason = failureReason;
    }

    public ScrapeException(ScrapeFailureReason failureReason, String message, Throwable cause) {
        super(ErrorCode.SCRAPE_ERROR, message, cause);
        this.failureReason = failureReason;
    }

    public ScrapeFailureReason getFailureReason() {
        return failureReason;
    }

    @Override
    public String getReason() {
        return failureReason.code();
    }
}
