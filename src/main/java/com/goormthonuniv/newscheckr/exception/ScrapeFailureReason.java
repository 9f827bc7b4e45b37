package com.goormthonuniv.newscheckr.exception;

public enum ScrapeFailureReason {
    UNREACHABLE("unreachable", true),
    PAYWALLED("paywalled", false),
    NO_CONTENT("no-content", false),
    MALFORMED_URL("malformed-url", false);

    private final String code;
    private final boolean transientFailure;

    ScrapeFailureReason(String code, boolean transientFailure) {
        this.code = code;
        this.transientFailure = transientFailure;
    }

    public String code() {
        return code;
    }

    /** 재시도로 회복될 수 있는 실패인지 */
    public boolean isTransient() {
        return transientFailure;
    }
}
