package com.goormthonuniv.newscheckr.exception;

import org.springframework.http.HttpStatus;

/**
 * 호출자에게 노출되는 안정적인 오류 코드.
 * INSUFFICIENT_CONTENT / SUMMARIZATION_ERROR 는 파이프라인 내부에서 흡수되므로 응답으로 나가지 않는다.
 */
public enum ErrorCode {
    INPUT_ERROR(HttpStatus.BAD_REQUEST),
    SCRAPE_ERROR(HttpStatus.BAD_GATEWAY),
    SCRAPE_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT),
    INSUFFICIENT_CONTENT(HttpStatus.UNPROCESSABLE_ENTITY),
    SUMMARIZATION_ERROR(HttpStatus.UNPROCESSABLE_ENTITY),
    MODEL_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
