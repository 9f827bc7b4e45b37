package com.goormthonuniv.newscheckr.service;

import lombok.extern.slf4j.Slf4j;

/**
 * 요청 하나의 파이프라인 상태. 요청 스레드 안에서만 쓰인다.
 */
@Slf4j
public class PipelineRun {

    private final String target;
    private final long startedAt = System.nanoTime();
    private PipelineState state = PipelineState.RECEIVED;
    private boolean degraded;
    private String failureReason;

    public PipelineRun(String target) {
        this.target = target;
    }

    public void advance(PipelineState next) {
        if (!state.successors().contains(next) || next == PipelineState.FAILED) {
            throw new IllegalStateException("illegal pipeline transition " + state + " -> " + next);
        }
        log.debug("[{}] {} -> {}", target, state, next);
        state = next;
    }

    public void fail(String reason) {
        if (state.isTerminal()) {
            throw new IllegalStateException("pipeline already finished in state " + state);
        }
        log.debug("[{}] {} -> FAILED ({})", target, state, reason);
        state = PipelineState.FAILED;
        failureReason = reason;
    }

    /** 특징 추출 실패 → 출처 기반 분석으로 계속 */
    public void markDegraded() {
        if (state != PipelineState.SCRAPED) {
            throw new IllegalStateException("degradation is only decided after scraping, state=" + state);
        }
        degraded = true;
    }

    public PipelineState state() {
        return state;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public String failureReason() {
        return failureReason;
    }

    public long elapsedMillis() {
        return (System.nanoTime() - startedAt) / 1_000_000;
    }
}
