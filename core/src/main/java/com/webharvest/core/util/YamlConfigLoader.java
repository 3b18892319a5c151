package com.webharvest.core.util;

import com.webharvest.core.model.CrawlConfig;
import com.webharvest.core.model.CrawlConfig.VisitedScope;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * crawl.yml을 읽어 CrawlConfig로 변환.
 *
 * 예상 YAML 키:
 * seeds: "seeds.txt"
 * scope:
 *   maxDepth: 1
 *   visitedScope: GLOBAL | PER_SEED
 *   allowedDomains: ["jeevee.com", "kiec.edu.np"]
 *   blockedDomains: ["facebook.com", "youtube.com"]
 *   blockedUrlPatterns: ['\.(pdf|zip)$', '/wp-json/']
 * http:
 *   timeoutMs: 10000
 *   retryCount: 3
 *   politeDelayMs: 500
 *   userAgent: "WebHarvest/0.1 (+crawler)"
 *   followRedirects: true
 * extraction:
 *   noiseTags: [script, style, nav]
 *   noiseClassTokens: [ad, banner]
 * output:
 *   dir: "output"
 *
 * 키가 없으면 CrawlConfig 기본값 유지. 상대 경로(seeds, output.dir)는 그대로 둔다(작업 디렉터리 기준).
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static CrawlConfig loadDefault() throws IOException {
        return load(Path.of("crawl.yml"));
    }

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("crawl.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return fromStream(in);
        }
    }

    public static CrawlConfig fromStream(InputStream in) {
        LoaderOptions opts = new LoaderOptions();
        Yaml yaml = new Yaml(new SafeConstructor(opts));
        Object root = yaml.load(in);

        CrawlConfig cfg = CrawlConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setPath(map, "seeds", cfg::setSeedsPath);

        // 2) scope.*
        Map<String, Object> scope = getMap(map, "scope");
        if (scope != null) {
            setInt(scope, "maxDepth", cfg::setMaxDepth);
            setEnum(scope, "visitedScope", VisitedScope.class, cfg::setVisitedScope);
            setStringList(scope, "allowedDomains", cfg::setAllowedDomains);
            setStringList(scope, "blockedDomains", cfg::setBlockedDomains);
            setStringList(scope, "blockedUrlPatterns", cfg::setBlockedUrlPatterns);
        }

        // 3) http.*
        Map<String, Object> http = getMap(map, "http");
        if (http != null) {
            setMillis(http, "timeoutMs", cfg::setTimeout);
            setInt(http, "retryCount", cfg::setRetryCount);
            setMillis(http, "politeDelayMs", cfg::setPoliteDelay);
            setString(http, "userAgent", cfg::setUserAgent);
            setBoolean(http, "followRedirects", cfg::setFollowRedirects);
        }

        // 4) extraction.*
        Map<String, Object> ex = getMap(map, "extraction");
        if (ex != null) {
            var e = cfg.getExtraction();
            setStringList(ex, "noiseTags", e::setNoiseTags);
            setStringList(ex, "noiseClassTokens", e::setNoiseClassTokens);
        }

        // 5) output.dir
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setPath(output, "dir", cfg::setOutputDir);
        }

        // 기본값/필수값 확인 + 패턴 문법 조기 검증
        cfg.validate();
        UrlPatterns.compile(cfg.getBlockedUrlPatterns());
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    /** 리스트 또는 "a,b,c" 문자열. 명시적 빈 리스트([])는 빈 목록으로 덮어쓴다. */
    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        if (!map.containsKey(key)) return;
        Object v = map.get(key);
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else if (v != null) {
            String s = String.valueOf(v).trim();
            for (String p : s.split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setMillis(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        setter.accept(Duration.ofMillis(ms)); // 음수/0 판단은 validate()에서
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }

    private static <E extends Enum<E>> void setEnum(Map<?, ?> map, String key, Class<E> type, Consumer<E> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim().replace('-', '_');
        for (E e : type.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(s)) {
                setter.accept(e);
                return;
            }
        }
        throw new IllegalArgumentException("unknown " + key + ": " + v
                + " (expected one of " + Arrays.toString(type.getEnumConstants()) + ")");
    }
}
