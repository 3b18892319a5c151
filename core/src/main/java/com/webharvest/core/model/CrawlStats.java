package com.webharvest.core.model;

import java.util.concurrent.atomic.AtomicLong;

/** 실행 단위 카운터 누적기 (스레드 세이프). 실행 시작 시 새로 만든다. */
public final class CrawlStats {
    private final AtomicLong success  = new AtomicLong(0);
    private final AtomicLong failure  = new AtomicLong(0);
    private final AtomicLong blocked  = new AtomicLong(0);
    private final AtomicLong attempts = new AtomicLong(0); // HTTP 시도(재시도 포함) 총합
    private final AtomicLong retries  = new AtomicLong(0); // 재시도 횟수 총합

    public void incSuccess() { success.incrementAndGet(); }
    public void incFailure() { failure.incrementAndGet(); }
    public void incBlocked() { blocked.incrementAndGet(); }

    /** attempts = (1 + retries) for a URL */
    public void addAttempts(long n) { attempts.addAndGet(n); }
    public void addRetries(long n) { retries.addAndGet(n); }

    public Snapshot snapshot() {
        return new Snapshot(success.get(), failure.get(), blocked.get(), attempts.get(), retries.get());
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long success;
        public final long failure;
        public final long blocked;
        public final long fetchAttempts;
        public final long retries;
        public Snapshot(long s, long f, long b, long a, long r) {
            this.success = s;
            this.failure = f;
            this.blocked = b;
            this.fetchAttempts = a;
            this.retries = r;
        }
    }
}
