package com.goormthonuniv.newscheckr.exception;

public class SummarizationException extends AnalysisException {

    public SummarizationException(String message) {
        super(ErrorCode.SUMMARIZATION_ERROR, message);
    }
}
