package com.webharvest.core.crawler;

import com.webharvest.core.model.BlockReason;
import com.webharvest.core.model.CrawlConfig;
import com.webharvest.core.model.CrawlSummary;
import com.webharvest.core.model.PageRecord;
import com.webharvest.core.model.SeedState;
import com.webharvest.core.service.RecordingResultSink;
import com.webharvest.core.util.ProgressListener;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Crawler: BFS 깊이/중복 제거/도메인 필터")
class CrawlerBfsTest {

    static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    //   /    -> /a, /b, other.com/x, mailto:
    //   /a   -> aa (상대 경로 → /aa), /
    //   /b   -> (없음)
    private static MapFetcher site() {
        return new MapFetcher()
                .page("https://ex.com/", "<title>Home</title><p>home</p>"
                        + "<a href=\"/a\">a</a><a href=\"/b#frag\">b</a>"
                        + "<a href=\"https://other.com/x\">o</a><a href=\"mailto:x@ex.com\">m</a>")
                .page("https://ex.com/a", "<title>A</title><p>A</p><a href=\"aa\">aa</a><a href=\"/\">home</a>")
                .page("https://ex.com/aa", "<title>AA</title><p>AA</p>")
                .page("https://ex.com/b", "<title>B</title><p>B</p>");
    }

    private static CrawlConfig cfg(int maxDepth) {
        return CrawlConfig.defaults()
                .setMaxDepth(maxDepth)
                .setAllowedDomains(List.of("ex.com"))
                .setBlockedDomains(List.of())
                .setBlockedUrlPatterns(List.of());
    }

    private static Crawler crawler(CrawlConfig cfg, MapFetcher f, RecordingResultSink sink) {
        return new Crawler(cfg, AdmissionFilter.from(cfg), f, new JsoupContentExtractor(), sink,
                ProgressListener.NONE, CLOCK);
    }

    private static List<String> urls(RecordingResultSink sink) {
        return sink.pages().stream().map(PageRecord::url).toList();
    }

    @Test
    @DisplayName("maxDepth=1: 시드의 1-hop까지만, 외부 도메인은 fetch 없이 차단")
    void depthOne() {
        MapFetcher f = site();
        RecordingResultSink sink = new RecordingResultSink();

        CrawlSummary s = crawler(cfg(1), f, sink).crawl(List.of("https://ex.com/"));

        assertThat(urls(sink)).containsExactly("https://ex.com/", "https://ex.com/a", "https://ex.com/b");
        assertThat(f.calls).containsExactly("https://ex.com/", "https://ex.com/a", "https://ex.com/b");
        assertThat(sink.blocked()).singleElement().satisfies(b -> {
            assertThat(b.url()).isEqualTo("https://other.com/x");
            assertThat(b.reason()).isEqualTo(BlockReason.NOT_ALLOWED_DOMAIN);
            assertThat(b.depth()).isEqualTo(1);
        });
        assertThat(s.pagesSaved()).isEqualTo(3);
        assertThat(s.blocked()).isEqualTo(1);
        assertThat(s.failed()).isZero();
        assertThat(sink.pages()).extracting(PageRecord::depth).containsExactly(0, 1, 1);
    }

    @Test
    void depthZeroFetchesSeedOnly() {
        MapFetcher f = site();
        RecordingResultSink sink = new RecordingResultSink();

        crawler(cfg(0), f, sink).crawl(List.of("https://ex.com/"));

        assertThat(f.calls).containsExactly("https://ex.com/");
        assertThat(sink.blocked()).isEmpty();
    }

    @Test
    @DisplayName("maxDepth=2: 2-hop 포함, 이미 방문한 시드로 돌아가는 링크는 재방문 없음")
    void depthTwoNoRevisit() {
        MapFetcher f = site();
        RecordingResultSink sink = new RecordingResultSink();

        crawler(cfg(2), f, sink).crawl(List.of("https://ex.com/"));

        assertThat(f.calls).containsExactly(
                "https://ex.com/", "https://ex.com/a", "https://ex.com/b", "https://ex.com/aa");
        assertThat(f.count("https://ex.com/")).isEqualTo(1);
        assertThat(sink.pages()).filteredOn(p -> p.url().endsWith("/aa"))
                .singleElement().extracting(PageRecord::depth).isEqualTo(2);
    }

    @Test
    @DisplayName("GLOBAL: 두 시드가 공유하는 페이지는 한 번만 fetch")
    void globalVisitedAcrossSeeds() {
        MapFetcher f = site();
        RecordingResultSink sink = new RecordingResultSink();

        CrawlSummary s = crawler(cfg(1), f, sink).crawl(List.of("https://ex.com/", "ex.com/b"));

        assertThat(f.count("https://ex.com/b")).isEqualTo(1);
        assertThat(s.seeds()).extracting(o -> o.state()).containsExactly(SeedState.DONE, SeedState.DONE);
        assertThat(s.seeds().get(0).pages()).isEqualTo(3);
        assertThat(s.seeds().get(1).pages()).isZero();
    }

    @Test
    @DisplayName("GLOBAL: 서로 다른 두 시드가 같은 제3 페이지로 링크해도 fetch/기록은 한 번")
    void twoSeedsLinkingToSameThirdPage() {
        MapFetcher f = new MapFetcher()
                .page("https://ex.com/s1", "<p>one</p><a href=\"/t\">t</a>")
                .page("https://ex.com/s2", "<p>two</p><a href=\"t#top\">t</a>")
                .page("https://ex.com/t", "<p>shared</p>");
        RecordingResultSink sink = new RecordingResultSink();

        CrawlSummary s = crawler(cfg(1), f, sink).crawl(List.of("https://ex.com/s1", "https://ex.com/s2"));

        assertThat(f.count("https://ex.com/t")).isEqualTo(1);
        assertThat(urls(sink)).containsExactly("https://ex.com/s1", "https://ex.com/t", "https://ex.com/s2");
        assertThat(s.pagesSaved()).isEqualTo(3);
        assertThat(s.seeds().get(1).pages()).isEqualTo(1);
    }

    @Test
    @DisplayName("PER_SEED: 시드마다 방문 집합을 새로 시작")
    void perSeedVisited() {
        MapFetcher f = site();
        RecordingResultSink sink = new RecordingResultSink();
        CrawlConfig cfg = cfg(1).setVisitedScope(CrawlConfig.VisitedScope.PER_SEED);

        CrawlSummary s = crawler(cfg, f, sink).crawl(List.of("https://ex.com/", "https://ex.com/b"));

        assertThat(f.count("https://ex.com/b")).isEqualTo(2);
        assertThat(s.seeds().get(1).pages()).isEqualTo(1);
    }

    @Test
    void pageRecordCarriesExtractionAndFetchData() {
        MapFetcher f = site();
        RecordingResultSink sink = new RecordingResultSink();

        crawler(cfg(0), f, sink).crawl(List.of("https://ex.com/"));

        PageRecord home = sink.pages().get(0);
        assertThat(home.title()).isEqualTo("Home");
        assertThat(home.markdown()).isEqualTo("home");
        assertThat(home.outboundLinkCount()).isEqualTo(4);
        assertThat(home.status()).isEqualTo(200);
        assertThat(home.fetchedAt()).isEqualTo(CLOCK.instant());
    }

    @Test
    void progressReportsEachSeed() {
        List<String> seen = new ArrayList<>();
        CrawlConfig cfg = cfg(0);
        new Crawler(cfg, AdmissionFilter.from(cfg), site(), new JsoupContentExtractor(),
                new RecordingResultSink(), (p, phase, done, total, detail) -> seen.add(phase + ":" + done + "/" + total + ":" + detail),
                CLOCK)
                .crawl(List.of("https://ex.com/", "https://ex.com/b"));

        assertThat(seen).containsExactly(
                "seed:0/2:https://ex.com/",
                "seed:1/2:https://ex.com/b",
                "crawl:2/2:null");
    }
}
