package com.goormthonuniv.newscheckr.service;

import com.goormthonuniv.newscheckr.exception.ScrapeException;
import org.springframework.retry.RetryContext;
import org.springframework.retry.policy.SimpleRetryPolicy;

/**
 * 일시적 스크래핑 실패(unreachable)만 재시도한다. 타임아웃/페이월/본문 없음은 즉시 실패.
 */
public class TransientScrapeRetryPolicy extends SimpleRetryPolicy {

    public TransientScrapeRetryPolicy(int maxAttempts) {
        super(maxAttempts);
    }

    @Override
    public boolean canRetry(RetryContext context) {
        Throwable last = context.getLastThrowable();
        if (last == null) {
            return super.canRetry(context);
        }
        if (last instanceof ScrapeException se && se.getFailureReason().isTransient()) {
            return super.canRetry(context);
        }
        return false;
    }
}
