package com.webharvest.core.http;

import com.webharvest.core.model.CrawlConfig;
import com.webharvest.core.model.FailureReason;
import com.webharvest.core.model.FetchResult;
import com.webharvest.core.util.RateLimiter;
import com.webharvest.core.util.Sleeper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageFetcherRetryTest {

    private static final URI URL = URI.create("https://example.com/page");

    /** sleep(Duration) 호출 기록 */
    static class TestSleeper implements Sleeper {
        final List<Duration> sleeps = new ArrayList<>();
        @Override public void sleep(Duration d) { sleeps.add(d); }
    }

    /** 테스트용 HttpResponse<String> */
    static class Resp implements HttpResponse<String> {
        final int code; final Map<String, List<String>> headers; final String body;
        Resp(int code, Map<String, List<String>> headers, String body) {
            this.code = code; this.headers = headers; this.body = body;
        }
        @Override public int statusCode() { return code; }
        @Override public HttpRequest request() { return null; }
        @Override public Optional<HttpResponse<String>> previousResponse() { return Optional.empty(); }
        @Override public HttpHeaders headers() { return HttpHeaders.of(headers, (a, b) -> true); }
        @Override public String body() { return body; }
        @Override public Optional<javax.net.ssl.SSLSession> sslSession() { return Optional.empty(); }
        @Override public URI uri() { return URL; }
        @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
    }

    private static Resp html(int code, String body) {
        return new Resp(code, Map.of("Content-Type", List.of("text/html; charset=utf-8")), body);
    }

    private static CrawlConfig cfg(int retryCount) {
        return CrawlConfig.defaults().setRetryCount(retryCount).setPoliteDelayMs(500).setTimeoutMs(2000);
    }

    private static PageFetcher fetcher(CrawlConfig cfg, TestSleeper sleeper, PageFetcher.HttpSender sender) {
        return new PageFetcher(cfg, new RateLimiter(Duration.ZERO),
                new FixedDelayRetryPolicy(cfg.getRetryCount(), cfg.getPoliteDelay()), sleeper, sender);
    }

    @Test
    @DisplayName("RETRY_COUNT=2, 매번 타임아웃 → 정확히 3회 시도 후 TIMEOUT")
    void alwaysTimeout_exactlyThreeAttempts() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        TestSleeper sleeper = new TestSleeper();
        PageFetcher f = fetcher(cfg(2), sleeper, req -> {
            calls.incrementAndGet();
            throw new HttpTimeoutException("request timed out");
        });

        FetchResult r = f.fetch(URL);

        assertThat(calls.get()).isEqualTo(3);
        assertThat(r.isSuccess()).isFalse();
        assertThat(r.getFailure()).isEqualTo(FailureReason.TIMEOUT);
        assertThat(r.getAttempts()).isEqualTo(3);
        assertThat(r.getStatusCode()).isEqualTo(-1);
        // 재시도 사이 대기 = polite delay
        assertThat(sleeper.sleeps).containsExactly(Duration.ofMillis(500), Duration.ofMillis(500));
    }

    @Test
    void succeedsOnSecondAttempt() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        TestSleeper sleeper = new TestSleeper();
        PageFetcher f = fetcher(cfg(3), sleeper, req ->
                calls.incrementAndGet() == 1 ? html(503, "busy") : html(200, "<p>ok</p>"));

        FetchResult r = f.fetch(URL);

        assertThat(r.isSuccess()).isTrue();
        assertThat(r.getStatusCode()).isEqualTo(200);
        assertThat(r.getBody()).isEqualTo("<p>ok</p>");
        assertThat(r.getAttempts()).isEqualTo(2);
        assertThat(r.getRetries()).isEqualTo(1);
        assertThat(r.isHtml()).isTrue();
        assertThat(sleeper.sleeps).hasSize(1);
    }

    @Test
    @DisplayName("non-2xx는 재시도 소진 후 HTTP_ERROR, 마지막 상태 보존")
    void non2xxBecomesHttpError() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        PageFetcher f = fetcher(cfg(1), new TestSleeper(), req -> {
            calls.incrementAndGet();
            return html(404, "nope");
        });

        FetchResult r = f.fetch(URL);

        assertThat(calls.get()).isEqualTo(2);
        assertThat(r.getFailure()).isEqualTo(FailureReason.HTTP_ERROR);
        assertThat(r.getStatusCode()).isEqualTo(404);
        assertThat(r.getFailureDetail()).isEqualTo("HTTP 404");
    }

    @Test
    void retryCountZeroMeansSingleAttempt() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        TestSleeper sleeper = new TestSleeper();
        PageFetcher f = fetcher(cfg(0), sleeper, req -> {
            calls.incrementAndGet();
            throw new ConnectException("Connection refused");
        });

        FetchResult r = f.fetch(URL);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(r.getFailure()).isEqualTo(FailureReason.NETWORK_ERROR);
        assertThat(r.getFailureDetail()).contains("ConnectException");
        assertThat(sleeper.sleeps).isEmpty();
    }

    @Test
    void sendsUserAgentAcceptAndTimeout() throws Exception {
        List<HttpRequest> seen = new ArrayList<>();
        CrawlConfig cfg = cfg(0).setUserAgent("TestBot/1.0");
        PageFetcher f = fetcher(cfg, new TestSleeper(), req -> {
            seen.add(req);
            return html(200, "<p>x</p>");
        });

        f.fetch(URL);

        assertThat(seen).hasSize(1);
        HttpRequest req = seen.get(0);
        assertThat(req.method()).isEqualTo("GET");
        assertThat(req.headers().firstValue("User-Agent")).contains("TestBot/1.0");
        assertThat(req.headers().firstValue("Accept")).hasValueSatisfying(v -> assertThat(v).contains("text/html"));
        assertThat(req.timeout()).contains(Duration.ofMillis(2000));
    }

    @Test
    @DisplayName("재시도를 포함한 모든 시도가 공유 RateLimiter를 거친다")
    void everyAttemptGoesThroughRateLimiter() throws Exception {
        TestSleeper limiterSleeps = new TestSleeper();
        RateLimiter limiter = new RateLimiter(Duration.ofMillis(100), limiterSleeps, () -> 0L); // 시계 정지
        CrawlConfig cfg = cfg(2);
        PageFetcher f = new PageFetcher(cfg, limiter, new FixedDelayRetryPolicy(2, Duration.ZERO),
                new TestSleeper(), req -> html(500, "err"));

        f.fetch(URL);

        assertThat(limiterSleeps.sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(100));
    }

    @Test
    @DisplayName("느린 응답 뒤에도 다음 시도 전 polite delay 전체를 기다린다")
    void slowResponseDoesNotConsumePoliteDelay() throws Exception {
        AtomicLong nanos = new AtomicLong();
        TestSleeper limiterSleeps = new TestSleeper();
        RateLimiter limiter = new RateLimiter(Duration.ofMillis(300), limiterSleeps, nanos::get);
        PageFetcher f = new PageFetcher(cfg(1), limiter, new FixedDelayRetryPolicy(1, Duration.ZERO),
                new TestSleeper(), req -> {
                    nanos.addAndGet(Duration.ofSeconds(2).toNanos()); // 응답에 2초
                    return html(503, "busy");
                });

        f.fetch(URL);

        assertThat(limiterSleeps.sleeps).containsExactly(Duration.ofMillis(300));
    }

    @Test
    void interruptPropagates() {
        PageFetcher f = fetcher(cfg(3), new TestSleeper(), req -> { throw new InterruptedException("stop"); });
        assertThatThrownBy(() -> f.fetch(URL)).isInstanceOf(InterruptedException.class);
    }
}
