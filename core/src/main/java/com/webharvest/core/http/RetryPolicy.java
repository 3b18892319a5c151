package com.webharvest.core.http;

import com.webharvest.core.model.FetchResult;

import java.time.Duration;

/** fetch 1건 안에서 실패한 시도를 다시 할지, 얼마나 쉬었다 할지 결정 */
public interface RetryPolicy {
    /**
     * @param last    방금 끝난 실패 시도
     * @param attempt 그 시도 번호 (1부터)
     */
    boolean shouldRetry(FetchResult last, int attempt);

    /** attempt번째 시도 실패 후 다음 시도 전 대기 */
    Duration delayBeforeRetry(int attempt);

    /** 최초 시도 포함 최대 시도 횟수. retryCount=2면 3. */
    int maxAttempts();
}
