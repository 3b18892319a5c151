package com.webharvest.core.model;

import java.util.Objects;

/**
 * 한 번의 실행이 소유하는 가변 상태: 방문 집합 + 카운터.
 * GLOBAL이면 모든 시드가 같은 VisitedSet을, PER_SEED면 시드마다 새 집합을 받는다.
 */
public final class CrawlState {
    private final CrawlConfig.VisitedScope scope;
    private final VisitedSet global = new VisitedSet();
    private final CrawlStats stats = new CrawlStats();

    public CrawlState(CrawlConfig.VisitedScope scope) {
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    /** 시드 실행 시작 시 호출: 이 시드가 사용할 방문 집합 */
    public VisitedSet visitedForSeed() {
        return scope == CrawlConfig.VisitedScope.GLOBAL ? global : new VisitedSet();
    }

    public CrawlStats stats() { return stats; }
}
