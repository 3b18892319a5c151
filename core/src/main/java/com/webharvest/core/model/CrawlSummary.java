package com.webharvest.core.model;

import java.time.Duration;
import java.util.List;

/** 실행 종료 요약: 카운터 스냅샷 + 시드별 결과 */
public record CrawlSummary(CrawlStats.Snapshot stats, List<SeedOutcome> seeds, Duration elapsed) {
    public CrawlSummary {
        seeds = (seeds == null ? List.of() : List.copyOf(seeds));
    }

    public long pagesSaved() { return stats.success; }
    public long failed() { return stats.failure; }
    public long blocked() { return stats.blocked; }
}
