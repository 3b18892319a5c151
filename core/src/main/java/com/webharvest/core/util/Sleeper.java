package com.webharvest.core.util;

import java.time.Duration;

/** 대기 추상화. 테스트에서는 실제 sleep 없이 호출만 기록하는 구현으로 교체 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    /** Thread.sleep 기반 (ms 단위, 0 이하는 즉시 반환) */
    Sleeper SYSTEM = d -> {
        long ms = Math.max(0, d.toMillis());
        if (ms > 0) Thread.sleep(ms);
    };
}
