package com.goormthonuniv.newscheckr.exception;

public class InsufficientContentException extends AnalysisException {

    private final int wordCount;
    private final int minimumWords;

    public InsufficientContentException(int wordCount, int minimumWords) {
        super(ErrorCode.INSUFFICIENT_CONTENT,
                "text has " + wordCount + " words, at least " + minimumWords + " required");
        this.wordCount = wordCount;
        this.minimumWords = minimumWords;
    }

    public int getWordCount() {
        return wordCount;
    }

    public int getMinimumWords() {
        return minimumWords;
    }
}
