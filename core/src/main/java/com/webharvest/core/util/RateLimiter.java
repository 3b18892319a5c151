package com.webharvest.core.util;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * 프로세스 전역 polite delay.
 * 어떤 두 fetch 시도(재시도 포함, URL 무관) 사이에도 최소 interval 간격을 보장한다.
 * 간격은 직전 시도가 끝난 시점(complete)부터 잰다. complete가 없으면 직전 acquire부터.
 */
public final class RateLimiter {
    private final long intervalNs;
    private final Sleeper sleeper;
    private final LongSupplier nanoClock;
    private long lastNs;
    private boolean first = true;

    public RateLimiter(Duration interval) {
        this(interval, Sleeper.SYSTEM, System::nanoTime);
    }

    public RateLimiter(Duration interval, Sleeper sleeper, LongSupplier nanoClock) {
        Objects.requireNonNull(interval, "interval");
        this.intervalNs = Math.max(0, interval.toNanos());
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    /** 직전 시도 이후 interval이 지나기 전이면 남은 시간만큼 대기 */
    public synchronized void acquire() throws InterruptedException {
        if (!first && intervalNs > 0) {
            long waitNs = (lastNs + intervalNs) - nanoClock.getAsLong();
            if (waitNs > 0) sleeper.sleep(Duration.ofMillis((waitNs + 999_999) / 1_000_000)); // ms 올림
        }
        first = false;
        lastNs = nanoClock.getAsLong();
    }

    /** 시도 종료 시 호출: 느린 응답이 다음 대기를 잠식하지 않도록 기준 시각을 갱신 */
    public synchronized void complete() {
        if (!first) lastNs = nanoClock.getAsLong();
    }

    public Duration interval() { return Duration.ofNanos(intervalNs); }
}
