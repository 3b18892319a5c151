package com.webharvest.core.model;

import com.webharvest.core.util.UrlUtils;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 크롤 설정 (crawl.yml 매핑 대상): 순수 설정 보관용.
 * 기본값은 현재 수집 대상 사이트 운영값.
 */
public final class CrawlConfig {

    /** 방문 집합 범위: 실행 전체 공유(GLOBAL) 또는 시드별 분리(PER_SEED) */
    public enum VisitedScope { GLOBAL, PER_SEED }

    /** YAML `extraction:` 섹션과 매핑: 비어 있으면 DefaultTagClassifier 기본 규칙 사용 */
    public static final class ExtractionCfg {
        private List<String> noiseTags = List.of();
        private List<String> noiseClassTokens = List.of();

        public List<String> getNoiseTags() { return noiseTags; }
        public void setNoiseTags(List<String> v) { this.noiseTags = (v == null ? List.of() : List.copyOf(v)); }

        public List<String> getNoiseClassTokens() { return noiseClassTokens; }
        public void setNoiseClassTokens(List<String> v) { this.noiseClassTokens = (v == null ? List.of() : List.copyOf(v)); }
    }

    public static final List<String> DEFAULT_ALLOWED_DOMAINS = List.of(
            "jeevee.com",
            "tranquilityspa.com",
            "tranquilityspa.com.np",
            "kiec.edu.np",
            "prettyclickcosmetics.com");

    public static final List<String> DEFAULT_BLOCKED_DOMAINS = List.of(
            "facebook.com", "tiktok.com", "youtube.com", "twitter.com", "instagram.com",
            "linkedin.com", "pinterest.com", "reddit.com", "quora.com", "whatsapp.com",
            "snapchat.com", "x.com", "netflix.com", "spotify.com");

    // fragment/mailto/tel/javascript 는 정규화 단계에서 이미 걸러진다
    public static final List<String> DEFAULT_BLOCKED_URL_PATTERNS = List.of(
            "\\.(jpg|jpeg|png|gif|svg|webp|pdf|zip|mp4|avi|mov|mp3|wav)$",
            "/wp-json/",
            "\\?utm_");

    // ---------- 기본 필드 ----------
    private int maxDepth = 1;                            // 0 = 시드 페이지만
    private Duration timeout = Duration.ofSeconds(10);   // 요청 타임아웃
    private int retryCount = 3;                          // 최초 시도 이후 재시도 횟수
    private Duration politeDelay = Duration.ofMillis(500);
    private String userAgent = "WebHarvest/0.1 (+crawler)";
    private boolean followRedirects = true;
    private List<String> allowedDomains = DEFAULT_ALLOWED_DOMAINS;
    private List<String> blockedDomains = DEFAULT_BLOCKED_DOMAINS;
    private List<String> blockedUrlPatterns = DEFAULT_BLOCKED_URL_PATTERNS;
    private VisitedScope visitedScope = VisitedScope.GLOBAL;
    private Path outputDir = Path.of("output");
    private Path seedsPath = Path.of("seeds.txt");

    private ExtractionCfg extraction = new ExtractionCfg();

    // ---------- getters ----------
    public int getMaxDepth() { return maxDepth; }
    public Duration getTimeout() { return timeout; }
    public int getRetryCount() { return retryCount; }
    public Duration getPoliteDelay() { return politeDelay; }
    public String getUserAgent() { return userAgent; }
    public boolean isFollowRedirects() { return followRedirects; }
    public List<String> getAllowedDomains() { return allowedDomains; }
    public List<String> getBlockedDomains() { return blockedDomains; }
    public List<String> getBlockedUrlPatterns() { return blockedUrlPatterns; }
    public VisitedScope getVisitedScope() { return visitedScope; }
    public Path getOutputDir() { return outputDir; }
    public Path getSeedsPath() { return seedsPath; }
    public ExtractionCfg getExtraction() { return extraction; }

    // ---------- fluent setters ----------
    public CrawlConfig setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; return this; }
    public CrawlConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CrawlConfig setRetryCount(int retryCount) { this.retryCount = retryCount; return this; }
    public CrawlConfig setPoliteDelay(Duration politeDelay) { this.politeDelay = politeDelay; return this; }
    public CrawlConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public CrawlConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public CrawlConfig setVisitedScope(VisitedScope scope) { this.visitedScope = (scope != null ? scope : VisitedScope.GLOBAL); return this; }
    public CrawlConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public CrawlConfig setSeedsPath(Path seedsPath) { this.seedsPath = seedsPath; return this; }
    public CrawlConfig setExtraction(ExtractionCfg e) { this.extraction = (e != null ? e : new ExtractionCfg()); return this; }

    /** 도메인은 소문자/trim/선행 www. 제거 후 보관 */
    public CrawlConfig setAllowedDomains(List<String> domains) {
        this.allowedDomains = cleanDomains(domains);
        return this;
    }

    public CrawlConfig setBlockedDomains(List<String> domains) {
        this.blockedDomains = cleanDomains(domains);
        return this;
    }

    public CrawlConfig setBlockedUrlPatterns(List<String> patterns) {
        this.blockedUrlPatterns = (patterns == null ? List.of() : List.copyOf(patterns));
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (retryCount < 0) throw new IllegalArgumentException("retryCount must be >= 0");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (politeDelay == null || politeDelay.isNegative())
            throw new IllegalArgumentException("politeDelay must be >= 0");
        if (userAgent == null || userAgent.isBlank())
            throw new IllegalArgumentException("userAgent must not be blank");
        Objects.requireNonNull(allowedDomains, "allowedDomains");
        Objects.requireNonNull(blockedDomains, "blockedDomains");
        Objects.requireNonNull(blockedUrlPatterns, "blockedUrlPatterns");
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(seedsPath, "seedsPath");
        Objects.requireNonNull(extraction, "extraction");
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }

    public CrawlConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    public CrawlConfig setPoliteDelayMs(long ms) {
        this.politeDelay = Duration.ofMillis(Math.max(0, ms));
        return this;
    }

    private static List<String> cleanDomains(List<String> in) {
        if (in == null) return List.of();
        List<String> out = new ArrayList<>();
        for (String d : in) {
            if (d == null || d.isBlank()) continue;
            String c = UrlUtils.stripWww(d);
            if (!out.contains(c)) out.add(c);
        }
        return List.copyOf(out);
    }
}
