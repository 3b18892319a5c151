package com.webharvest.core.crawler;

import com.webharvest.core.api.ICrawler;
import com.webharvest.core.api.IPageFetcher;
import com.webharvest.core.model.Admission;
import com.webharvest.core.model.BlockedRecord;
import com.webharvest.core.model.CrawlConfig;
import com.webharvest.core.model.CrawlState;
import com.webharvest.core.model.CrawlSummary;
import com.webharvest.core.model.ExtractedPage;
import com.webharvest.core.model.FailureReason;
import com.webharvest.core.model.FailureRecord;
import com.webharvest.core.model.FetchResult;
import com.webharvest.core.model.FrontierEntry;
import com.webharvest.core.model.PageRecord;
import com.webharvest.core.model.SeedOutcome;
import com.webharvest.core.model.SeedState;
import com.webharvest.core.model.VisitedSet;
import com.webharvest.core.service.ResultSink;
import com.webharvest.core.util.InvalidUrlException;
import com.webharvest.core.util.ProgressListener;
import com.webharvest.core.util.StructuredLog;
import com.webharvest.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * BFS 기반 Crawler (단일 스레드).
 * 시드마다 PENDING → RUNNING → DONE. 시드 간에는 방문 집합(GLOBAL일 때)과 카운터를 공유한다.
 *
 * 한 URL 처리 순서: dequeue → (방문/깊이 초과면 버림) → 방문 표시 → 입장 판정 → fetch → 추출
 * → PageRecord 기록 → depth &lt; maxDepth면 자식 링크 enqueue.
 * 입장 판정은 dequeue 시점에만 한다(enqueue 때는 하지 않음).
 */
public class Crawler implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(Crawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(Crawler.class);

    private final CrawlConfig config;
    private final AdmissionFilter filter;
    private final IPageFetcher fetcher;
    private final ContentExtractor extractor;
    private final ResultSink sink;
    private final ProgressListener progress;
    private final Clock clock;

    public Crawler(CrawlConfig config, AdmissionFilter filter, IPageFetcher fetcher,
                   ContentExtractor extractor, ResultSink sink) {
        this(config, filter, fetcher, extractor, sink, ProgressListener.NONE, Clock.systemUTC());
    }

    public Crawler(CrawlConfig config, AdmissionFilter filter, IPageFetcher fetcher,
                   ContentExtractor extractor, ResultSink sink, ProgressListener progress, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.progress = (progress != null ? progress : ProgressListener.NONE);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public CrawlSummary crawl(List<String> seeds) {
        Objects.requireNonNull(seeds, "seeds");
        Instant started = clock.instant();
        CrawlState state = new CrawlState(config.getVisitedScope());

        List<SeedOutcome> outcomes = new ArrayList<>(seeds.size());
        for (String s : seeds) outcomes.add(new SeedOutcome(s, SeedState.PENDING, 0));

        boolean interrupted = false;
        for (int i = 0; i < seeds.size(); i++) {
            String raw = seeds.get(i);
            if (interrupted) break; // 남은 시드는 PENDING으로 남김
            progress.onProgress((double) i / seeds.size(), "seed", i, seeds.size(), raw);

            URI seed;
            try {
                seed = UrlUtils.normalizeSeed(raw);
            } catch (InvalidUrlException e) {
                LOG.warn("Invalid seed '{}': {}", raw, e.getMessage());
                recordFailure(state, new FailureRecord(String.valueOf(raw), FailureReason.INVALID_SEED,
                        e.getMessage(), 0, 0, -1, clock.instant()));
                outcomes.set(i, new SeedOutcome(raw, SeedState.INVALID, 0));
                continue;
            }

            outcomes.set(i, new SeedOutcome(raw, SeedState.RUNNING, 0));
            SLOG.info("seed-start", "seed", seed.toString(), "index", i + 1, "total", seeds.size());
            long before = state.stats().snapshot().success;
            try {
                crawlSeed(seed, state);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                LOG.warn("Crawl interrupted while processing seed {}", seed);
                interrupted = true;
            }
            int pages = (int) (state.stats().snapshot().success - before);
            if (interrupted) {
                // 큐를 다 비우지 못했으므로 DONE 아님
                outcomes.set(i, new SeedOutcome(raw, SeedState.RUNNING, pages));
                SLOG.warn("seed-interrupted", "seed", seed.toString(), "pages", pages);
            } else {
                outcomes.set(i, new SeedOutcome(raw, SeedState.DONE, pages));
                SLOG.info("seed-done", "seed", seed.toString(), "pages", pages);
            }
        }
        progress.onProgress(1.0, "crawl", seeds.size(), seeds.size(), null);

        return new CrawlSummary(state.stats().snapshot(), outcomes,
                Duration.between(started, clock.instant()));
    }

    /** 시드 1개의 BFS 루프. 큐가 비면 반환. */
    void crawlSeed(URI seed, CrawlState state) throws InterruptedException {
        int maxDepth = Math.max(0, config.getMaxDepth());
        VisitedSet visited = state.visitedForSeed();
        Frontier frontier = new Frontier(maxDepth, visited);
        frontier.offer(seed, 0);

        while (!frontier.isEmpty()) {
            FrontierEntry cur = frontier.poll();
            URI url = cur.url();
            int depth = cur.depth();

            if (depth > maxDepth || !visited.markVisited(url)) continue;

            Admission admission = filter.admit(url, state);
            if (admission.isBlocked()) {
                LOG.debug("Blocked {} ({}: {})", url, admission.reason().label(), admission.detail());
                SLOG.debug("url-blocked", "url", url.toString(), "reason", admission.reason().label(),
                        "detail", admission.detail(), "depth", depth);
                sink.onBlocked(new BlockedRecord(url.toString(), admission.reason(), admission.detail(),
                        depth, clock.instant()));
                continue;
            }

            LOG.info("Processing: {} (depth={})", url, depth);
            FetchResult fetched = fetcher.fetch(url);
            state.stats().addAttempts(fetched.getAttempts());
            state.stats().addRetries(fetched.getRetries());
            if (!fetched.isSuccess()) {
                recordFailure(state, new FailureRecord(url.toString(), fetched.getFailure(),
                        fetched.getFailureDetail(), depth, fetched.getAttempts(),
                        fetched.getStatusCode(), clock.instant()));
                continue;
            }

            ExtractedPage page;
            try {
                if (!fetched.isHtml()) {
                    throw new ExtractionException(FailureReason.NO_CONTENT,
                            "non-html content-type: " + fetched.getContentType());
                }
                page = extractor.extract(fetched.getBody(), url);
            } catch (ExtractionException e) {
                recordFailure(state, new FailureRecord(url.toString(), e.getReason(), e.getMessage(),
                        depth, fetched.getAttempts(), fetched.getStatusCode(), clock.instant()));
                continue;
            }

            PageRecord record = new PageRecord(url.toString(), page.title(), page.markdown(),
                    page.links().size(), clock.instant(), fetched.getStatusCode(), depth);
            if (sink.onPage(record)) {
                state.stats().incSuccess();
                SLOG.info("page-ok", "url", record.url(), "depth", depth, "status", record.status(),
                        "links", record.outboundLinkCount());
            } else {
                recordFailure(state, new FailureRecord(url.toString(), FailureReason.WRITE_ERROR,
                        "result sink rejected page", depth, fetched.getAttempts(),
                        fetched.getStatusCode(), clock.instant()));
            }

            if (depth < maxDepth) {
                enqueueChildren(frontier, visited, page, depth + 1);
            }
        }
    }

    private void enqueueChildren(Frontier frontier, VisitedSet visited, ExtractedPage page, int childDepth) {
        for (String href : page.links()) {
            URI child;
            try {
                child = UrlUtils.normalize(page.baseUrl(), href);
            } catch (InvalidUrlException ignore) {
                continue; // 정규화 실패 링크는 조용히 버림
            }
            if (!visited.contains(child)) frontier.offer(child, childDepth);
        }
    }

    private void recordFailure(CrawlState state, FailureRecord f) {
        state.stats().incFailure();
        LOG.warn("Failed: {} ({}: {})", f.url(), f.reason().label(), f.detail());
        SLOG.warn("page-failed", "url", f.url(), "reason", f.reason().label(), "attempts", f.attempts());
        sink.onFailure(f);
    }
}
