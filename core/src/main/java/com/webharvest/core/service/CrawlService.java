package com.webharvest.core.service;

import com.webharvest.core.api.IPageFetcher;
import com.webharvest.core.crawler.AdmissionFilter;
import com.webharvest.core.crawler.ContentExtractor;
import com.webharvest.core.crawler.Crawler;
import com.webharvest.core.crawler.DefaultTagClassifier;
import com.webharvest.core.crawler.JsoupContentExtractor;
import com.webharvest.core.http.PageFetcher;
import com.webharvest.core.model.CrawlConfig;
import com.webharvest.core.model.CrawlSummary;
import com.webharvest.core.service.export.FileResultSink;
import com.webharvest.core.util.ProgressListener;
import com.webharvest.core.util.RateLimiter;
import com.webharvest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * 크롤 오케스트레이션 진입점:
 *  - 설정 검증 → 구성요소 조립(filter/fetcher/extractor/sink) → BFS 실행 → sink.finish
 *  - 기본 생성자는 파일 sink(output 디렉터리)를 사용
 *  - DI 생성자는 테스트/플러그인 주입용
 */
public final class CrawlService {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlService.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlService.class);

    private final CrawlConfig config;
    private final AdmissionFilter filter;
    private final IPageFetcher fetcher;
    private final ContentExtractor extractor;
    private final ResultSink sink;
    private final Clock clock;

    /** 기본 구현: 전역 polite delay 리미터 + HttpClient fetcher + jsoup 추출기 + 파일 sink */
    public CrawlService(CrawlConfig config) throws IOException {
        this(validated(config),
                new PageFetcher(config, new RateLimiter(config.getPoliteDelay())),
                new JsoupContentExtractor(classifierFrom(config)),
                new FileResultSink(config.getOutputDir()),
                Clock.systemUTC());
    }

    /** DI/테스트용 */
    public CrawlService(CrawlConfig config, IPageFetcher fetcher, ContentExtractor extractor,
                        ResultSink sink, Clock clock) {
        this.config = validated(config);
        this.filter = AdmissionFilter.from(config); // 패턴 컴파일은 여기서 한 번
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CrawlSummary run(List<String> seeds) throws IOException {
        return run(seeds, ProgressListener.NONE);
    }

    /**
     * 시드 순서대로 크롤하고 sink.finish까지 수행.
     * URL 단위 오류는 모두 기록 후 계속 진행하며, 여기서 던지는 IOException은 인덱스 기록 실패뿐이다.
     */
    public CrawlSummary run(List<String> seeds, ProgressListener listener) throws IOException {
        Objects.requireNonNull(seeds, "seeds");
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;

        LOG.info("Crawl start: seeds={}, maxDepth={}, retryCount={}, politeDelayMs={}, visitedScope={}",
                seeds.size(), config.getMaxDepth(), config.getRetryCount(),
                config.getPoliteDelay().toMillis(), config.getVisitedScope());
        SLOG.info("crawl-start",
                "seeds", seeds.size(),
                "maxDepth", config.getMaxDepth(),
                "retryCount", config.getRetryCount(),
                "allowedDomains", String.join(",", config.getAllowedDomains()));

        pl.onProgress(0.0, "crawl", 0, seeds.size(), null);
        Crawler crawler = new Crawler(config, filter, fetcher, extractor, sink, pl, clock);
        CrawlSummary summary = crawler.crawl(seeds);

        pl.onProgress(1.0, "export", seeds.size(), seeds.size(), null);
        sink.finish(summary);

        LOG.info("Crawl done. saved={}, failed={}, blocked={}, attempts={}, retries={}, elapsedMs={}",
                summary.pagesSaved(), summary.failed(), summary.blocked(),
                summary.stats().fetchAttempts, summary.stats().retries, summary.elapsed().toMillis());
        SLOG.info("crawl-done",
                "saved", summary.pagesSaved(),
                "failed", summary.failed(),
                "blocked", summary.blocked(),
                "elapsedMs", summary.elapsed().toMillis());
        return summary;
    }

    public CrawlConfig config() { return config; }

    static DefaultTagClassifier classifierFrom(CrawlConfig cfg) {
        var ex = cfg.getExtraction();
        return DefaultTagClassifier.builder()
                .noiseTags(ex.getNoiseTags())
                .noiseTokens(ex.getNoiseClassTokens())
                .build();
    }

    private static CrawlConfig validated(CrawlConfig cfg) {
        Objects.requireNonNull(cfg, "config").validate();
        return cfg;
    }
}
