package com.webharvest.core.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.webharvest.core.api.IPageFetcher;
import com.webharvest.core.crawler.JsoupContentExtractor;
import com.webharvest.core.model.CrawlConfig;
import com.webharvest.core.model.CrawlSummary;
import com.webharvest.core.model.FailureReason;
import com.webharvest.core.model.FetchResult;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlServiceTest {

    static HttpServer server;
    static String base;

    @BeforeAll
    static void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/", ex -> {
            String path = ex.getRequestURI().getPath();
            switch (path) {
                case "/" -> send(ex, 200, "<html><head><title>Local Home</title></head><body>"
                        + "<nav><a href=\"/about\">About</a></nav>"
                        + "<h1>Welcome</h1><p>Hello from the test site.</p>"
                        + "<a href=\"/about\">about</a>"
                        + "<a href=\"/files/doc.pdf\">pdf</a>"
                        + "<a href=\"/missing\">broken</a>"
                        + "<a href=\"https://www.facebook.com/page\">fb</a>"
                        + "</body></html>");
                case "/about" -> send(ex, 200, "<html><body><h1>About us</h1><p>We test crawlers.</p>"
                        + "<a href=\"/deeper\">deeper</a></body></html>");
                case "/s1" -> send(ex, 200, "<html><body><p>Seed one</p><a href=\"/t\">t</a></body></html>");
                case "/s2" -> send(ex, 200, "<html><body><p>Seed two</p><a href=\"t\">t</a></body></html>");
                case "/t" -> send(ex, 200, "<html><body><p>Shared target</p></body></html>");
                default -> send(ex, 404, "not found");
            }
        });
        server.start();
        base = "http://localhost:" + server.getAddress().getPort();
    }

    @AfterAll
    static void stop() {
        if (server != null) server.stop(0);
    }

    private static void send(HttpExchange ex, int code, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
        ex.sendResponseHeaders(code, bytes.length);
        try (OutputStream os = ex.getResponseBody()) { os.write(bytes); }
    }

    private static CrawlConfig localConfig(Path out) {
        return CrawlConfig.defaults()
                .setAllowedDomains(List.of("localhost"))
                .setMaxDepth(1)
                .setRetryCount(0)
                .setPoliteDelayMs(0)
                .setTimeoutMs(3000)
                .setOutputDir(out);
    }

    @Test
    @DisplayName("로컬 사이트 end-to-end: Markdown/인덱스/로그 파일 생성")
    void endToEndAgainstLocalServer(@TempDir Path out) throws Exception {
        CrawlService service = new CrawlService(localConfig(out));

        CrawlSummary s = service.run(List.of(base + "/"));

        assertThat(s.pagesSaved()).isEqualTo(2);
        assertThat(s.failed()).isEqualTo(1);   // /missing
        assertThat(s.blocked()).isEqualTo(2);  // pdf 패턴 + facebook

        Path home = out.resolve("MDs").resolve("localhost_index.md");
        Path about = out.resolve("MDs").resolve("localhost_about.md");
        assertThat(home).exists();
        assertThat(about).exists();
        String homeMd = Files.readString(home);
        assertThat(homeMd).startsWith("# Local Home\n\n");
        assertThat(homeMd).contains("# Welcome", "Hello from the test site.").doesNotContain("About</a>");

        JsonNode index = new ObjectMapper().readTree(out.resolve("index.json").toFile());
        assertThat(index).hasSize(2);
        assertThat(index.get(0).get("url").asText()).isEqualTo(base + "/");
        assertThat(index.get(1).get("depth").asInt()).isEqualTo(1);

        assertThat(Files.readAllLines(out.resolve("failed_urls.txt")))
                .singleElement().asString().startsWith(base + "/missing|error:http-error|");
        assertThat(Files.readAllLines(out.resolve("blocked_urls.txt")))
                .anyMatch(l -> l.startsWith(base + "/files/doc.pdf|pattern:"))
                .anyMatch(l -> l.startsWith("https://www.facebook.com/page|not-allowed-domain"));
        // depth=1 에서 멈춤
        assertThat(Files.readAllLines(out.resolve("success_urls.txt"))).doesNotContain(base + "/deeper");
    }

    @Test
    @DisplayName("두 시드가 같은 페이지를 가리켜도 index.json에는 URL당 한 항목")
    void sharedTargetListedOnceInIndex(@TempDir Path out) throws Exception {
        CrawlSummary s = new CrawlService(localConfig(out)).run(List.of(base + "/s1", base + "/s2"));

        assertThat(s.pagesSaved()).isEqualTo(3);
        JsonNode index = new ObjectMapper().readTree(out.resolve("index.json").toFile());
        List<String> urls = new ArrayList<>();
        index.forEach(e -> urls.add(e.get("url").asText()));
        assertThat(urls).containsExactly(base + "/s1", base + "/t", base + "/s2");
        assertThat(Files.readAllLines(out.resolve("success_urls.txt"))).doesNotHaveDuplicates();
    }

    @Test
    void diWiringCallsFinishAndUsesExtractionConfig() throws Exception {
        AtomicBoolean finished = new AtomicBoolean();
        RecordingResultSink sink = new RecordingResultSink() {
            @Override public void finish(CrawlSummary summary) { finished.set(true); }
        };
        IPageFetcher fetcher = url -> FetchResult.builder().url(url).statusCode(200)
                .body("<body><p>text</p></body>").build();
        CrawlConfig cfg = CrawlConfig.defaults().setAllowedDomains(List.of("ex.com")).setMaxDepth(0);

        CrawlSummary s = new CrawlService(cfg, fetcher, new JsoupContentExtractor(), sink, Clock.systemUTC())
                .run(List.of("https://ex.com/", "not a url://"), null);

        assertThat(finished).isTrue();
        assertThat(s.pagesSaved()).isEqualTo(1);
        assertThat(sink.failures()).extracting(f -> f.reason()).containsExactly(FailureReason.INVALID_SEED);
    }

    @Test
    void classifierFollowsExtractionSettings() {
        CrawlConfig cfg = CrawlConfig.defaults();
        cfg.getExtraction().setNoiseTags(List.of("table"));
        var c = CrawlService.classifierFrom(cfg);
        var doc = org.jsoup.Jsoup.parse("<nav>n</nav><table><tr><td>t</td></tr></table>");
        assertThat(c.isNoise(doc.selectFirst("table"))).isTrue();
        assertThat(c.isNoise(doc.selectFirst("nav"))).isFalse();
    }

    @Test
    void invalidConfigRejectedUpFront() {
        CrawlConfig bad = CrawlConfig.defaults().setMaxDepth(-1);
        assertThatThrownBy(() -> new CrawlService(bad, url -> null, new JsoupContentExtractor(),
                ResultSink.NONE, Clock.systemUTC()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxDepth");
    }
}
