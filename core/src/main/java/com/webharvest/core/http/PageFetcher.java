package com.webharvest.core.http;

import com.webharvest.core.api.IPageFetcher;
import com.webharvest.core.model.CrawlConfig;
import com.webharvest.core.model.FailureReason;
import com.webharvest.core.model.FetchResult;
import com.webharvest.core.util.RateLimiter;
import com.webharvest.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.Objects;

/**
 * GET + 타임아웃 + 유한 재시도 fetcher.
 * 모든 시도(재시도 포함)는 공유 RateLimiter를 거치므로 polite delay가 프로세스 전역으로 지켜진다.
 */
public class PageFetcher implements IPageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(PageFetcher.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws Exception;
    }

    private final CrawlConfig config;
    private final RateLimiter limiter;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final HttpSender sender;

    public PageFetcher(CrawlConfig config, RateLimiter limiter) {
        this(config, limiter,
                new FixedDelayRetryPolicy(config.getRetryCount(), config.getPoliteDelay()),
                Sleeper.SYSTEM,
                clientSender(config));
    }

    /** 테스트용 생성자(송신 훅/대기 주입) */
    public PageFetcher(CrawlConfig config, RateLimiter limiter, RetryPolicy policy,
                       Sleeper sleeper, HttpSender sender) {
        this.config = Objects.requireNonNull(config, "config");
        this.limiter = Objects.requireNonNull(limiter, "limiter");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    private static HttpSender clientSender(CrawlConfig config) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        return req -> client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    /** 재시도 포함 fetch. 시도 횟수는 최대 1 + retryCount. */
    @Override
    public FetchResult fetch(URI url) throws InterruptedException {
        Objects.requireNonNull(url, "url");
        int attempt = 1;
        while (true) {
            limiter.acquire();
            FetchResult r;
            try {
                r = attemptOnce(url);
            } finally {
                limiter.complete();
            }
            if (r.isSuccess() || !policy.shouldRetry(r, attempt)) {
                return r.toBuilder().attempts(attempt).build();
            }
            LOG.warn("Retry {}/{} for {} failed: {} {}", attempt, policy.maxAttempts() - 1,
                    url, r.getFailure().label(), r.getFailureDetail());
            sleeper.sleep(policy.delayBeforeRetry(attempt));
            attempt++;
        }
    }

    /** 단일 시도. 예외는 분류된 실패로 변환 (InterruptedException만 전파). */
    FetchResult attemptOnce(URI url) throws InterruptedException {
        FetchResult.Builder b = FetchResult.builder().url(url);
        try {
            HttpRequest req = HttpRequest.newBuilder(url)
                    .timeout(config.getTimeout())
                    .header("User-Agent", config.getUserAgent())
                    .header("Accept", "text/html,application/xhtml+xml;q=0.9,*/*;q=0.5")
                    .GET()
                    .build();

            HttpResponse<String> resp = sender.send(req);
            int status = resp.statusCode();
            b.statusCode(status)
             .body(resp.body() == null ? "" : resp.body())
             .contentType(resp.headers().firstValue("Content-Type").orElse(null));
            if (status < 200 || status >= 300) {
                b.failure(FailureReason.HTTP_ERROR, "HTTP " + status);
            }
            return b.build();
        } catch (InterruptedException ie) {
            throw ie;
        } catch (HttpTimeoutException | SocketTimeoutException e) {
            return b.failure(FailureReason.TIMEOUT, describe(e)).build();
        } catch (IOException e) {
            return b.failure(FailureReason.NETWORK_ERROR, describe(e)).build();
        } catch (Exception e) {
            // 잘못된 요청 URI(IllegalArgumentException) 등
            return b.failure(FailureReason.NETWORK_ERROR, describe(e)).build();
        }
    }

    private static String describe(Exception e) {
        String m = e.getMessage();
        return e.getClass().getSimpleName() + (m == null || m.isBlank() ? "" : ": " + m);
    }
}
