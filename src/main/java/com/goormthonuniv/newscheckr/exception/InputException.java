package com.goormthonuniv.newscheckr.exception;

/**
 * 잘못된 URL, 빈 텍스트 등 파이프라인 진입 전에 거절되는 입력
 */
public class InputException extends AnalysisException {

    public InputException(String message) {
        super(ErrorCode.INPUT_ERROR, message);
    }
}
