package com.goormthonuniv.newscheckr.exception;

/**
 * 학습된 모델 파라미터를 불러오지 못함. 기동 단계에서 발생하면 애플리케이션이 뜨지 않는다.
 */
public class ModelUnavailableException extends AnalysisException {

    public ModelUnavailableException(String message) {
        super(ErrorCode.MODEL_UNAVAILABLE, message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(ErrorCode.MODEL_UNAVAILABLE, message, cause);
    }
}
