package com.goormthonuniv.newscheckr.service;

import java.util.EnumSet;
import java.util.Set;

public enum PipelineState {
    RECEIVED,
    SCRAPED,
    FEATURE_EXTRACTED,   // 특징 추출이 건너뛰어진 경우에도 degraded 플래그와 함께 통과
    CLASSIFIED,
    SUMMARIZED,
    LABELED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** 정상 진행 경로의 다음 상태 + 실패 */
    public Set<PipelineState> successors() {
        return switch (this) {
            case RECEIVED -> EnumSet.of(SCRAPED, FAILED);
            case SCRAPED -> EnumSet.of(FEATURE_EXTRACTED, FAILED);
            case FEATURE_EXTRACTED -> EnumSet.of(CLASSIFIED, FAILED);
            case CLASSIFIED -> EnumSet.of(SUMMARIZED, FAILED);
            case SUMMARIZED -> EnumSet.of(LABELED, FAILED);
            case LABELED -> EnumSet.of(COMPLETED, FAILED);
            case COMPLETED, FAILED -> EnumSet.noneOf(PipelineState.class);
        };
    }
}
