package com.goormthonuniv.newscheckr.exception;

/**
 * 분석 파이프라인 예외 기본 클래스
 */
public class AnalysisException extends RuntimeException {

    private final ErrorCode errorCode;

    public AnalysisException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AnalysisException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /** 세부 사유 (없으면 null) */
    public String getReason() {
        return null;
    }
}
