package com.webharvest.core.http;

import com.webharvest.core.model.FailureReason;
import com.webharvest.core.model.FetchResult;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/** 타임아웃/네트워크 오류/non-2xx에서 재시도. 지연은 고정값(polite delay), 지수 백오프 없음. */
public final class FixedDelayRetryPolicy implements RetryPolicy {

    private static final Set<FailureReason> RETRYABLE =
            EnumSet.of(FailureReason.TIMEOUT, FailureReason.NETWORK_ERROR, FailureReason.HTTP_ERROR);

    private final int retryCount;
    private final Duration delay;

    public FixedDelayRetryPolicy(int retryCount, Duration delay) {
        this.retryCount = Math.max(0, retryCount);
        this.delay = Objects.requireNonNull(delay, "delay");
    }

    @Override public boolean shouldRetry(FetchResult last, int attempt) {
        if (attempt >= maxAttempts() || last == null || last.isSuccess()) return false;
        return RETRYABLE.contains(last.getFailure());
    }

    @Override public Duration delayBeforeRetry(int attempt) {
        return delay;
    }

    @Override public int maxAttempts() { return retryCount + 1; }
}
