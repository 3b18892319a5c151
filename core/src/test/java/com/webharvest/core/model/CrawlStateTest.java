package com.webharvest.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class CrawlStateTest {

    private static final URI A = URI.create("https://example.com/a");

    @Test
    @DisplayName("GLOBAL: 모든 시드가 같은 방문 집합 공유")
    void globalSharesVisited() {
        CrawlState s = new CrawlState(CrawlConfig.VisitedScope.GLOBAL);
        assertThat(s.visitedForSeed().markVisited(A)).isTrue();
        assertThat(s.visitedForSeed().contains(A)).isTrue();
        assertThat(s.visitedForSeed().markVisited(A)).isFalse();
    }

    @Test
    @DisplayName("PER_SEED: 시드마다 새 방문 집합")
    void perSeedIsolated() {
        CrawlState s = new CrawlState(CrawlConfig.VisitedScope.PER_SEED);
        VisitedSet first = s.visitedForSeed();
        first.markVisited(A);
        assertThat(s.visitedForSeed().contains(A)).isFalse();
        assertThat(first.size()).isEqualTo(1);
    }

    @Test
    void statsSnapshotIsDetached() {
        CrawlState s = new CrawlState(CrawlConfig.VisitedScope.GLOBAL);
        s.stats().incSuccess();
        s.stats().addAttempts(3);
        s.stats().addRetries(2);
        CrawlStats.Snapshot snap = s.stats().snapshot();
        s.stats().incSuccess();

        assertThat(snap.success).isEqualTo(1);
        assertThat(snap.fetchAttempts).isEqualTo(3);
        assertThat(snap.retries).isEqualTo(2);
        assertThat(s.stats().snapshot().success).isEqualTo(2);
    }
}
