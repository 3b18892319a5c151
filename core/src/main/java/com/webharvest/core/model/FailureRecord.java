package com.webharvest.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 실패 기록.
 * @param attempts fetch 시도 횟수 (추출/시드 실패면 해당 fetch 시도 수 또는 0)
 * @param status   마지막 HTTP 상태 (응답이 없었으면 -1)
 */
public record FailureRecord(String url, FailureReason reason, String detail,
                            int depth, int attempts, int status, Instant timestamp) {
    public FailureRecord {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(timestamp, "timestamp");
        detail = (detail == null ? "" : detail);
    }
}
