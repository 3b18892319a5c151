package com.webharvest.core.service.export;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Set;

/** 출력 디렉터리 레이아웃 + URL 기반 Markdown 파일명 규칙 */
public final class OutputNaming {
    private OutputNaming() {}

    public static final int MAX_NAME_LENGTH = 150;

    public static Layout layout(Path outDir) {
        return new Layout(outDir == null ? Paths.get("output") : outDir);
    }

    public record Layout(Path baseDir) {
        public Path markdownDir() { return baseDir.resolve("MDs"); }
        public Path indexJson()   { return baseDir.resolve("index.json"); }
        public Path successLog()  { return baseDir.resolve("success_urls.txt"); }
        public Path failedLog()   { return baseDir.resolve("failed_urls.txt"); }
        public Path blockedLog()  { return baseDir.resolve("blocked_urls.txt"); }
        public Path logsDir()     { return baseDir.resolve("logs"); }
    }

    /**
     * "https://www.kiec.edu.np/about/team/" → "kiec_edu_np_about_team.md"
     * 루트 경로는 "index", 안전하지 않은 문자는 '_', 확장자 제외 최대 150자.
     */
    public static String markdownFileName(String url) {
        return baseName(url) + ".md";
    }

    public static String baseName(String url) {
        String host = "unknown-host";
        String path = "";
        try {
            URI u = URI.create(url);
            if (u.getHost() != null) host = u.getHost().toLowerCase(Locale.ROOT);
            if (u.getPath() != null) path = u.getPath();
        } catch (IllegalArgumentException ignore) {
            // 정규화된 URL만 들어오므로 사실상 도달하지 않음: 기본 이름 사용
        }
        if (host.startsWith("www.")) host = host.substring(4);
        String p = path.replaceAll("^/+|/+$", "").replace('/', '_');
        if (p.isEmpty()) p = "index";
        String name = (host.replace('.', '_') + "_" + p).replaceAll("[^a-zA-Z0-9_\\-]", "_");
        return name.length() > MAX_NAME_LENGTH ? name.substring(0, MAX_NAME_LENGTH) : name;
    }

    /** 같은 실행 안에서 이름이 겹치면 "-2", "-3" ... 접미 */
    public static String withSuffix(String baseName, int n) {
        return n <= 1 ? baseName + ".md" : baseName + "-" + n + ".md";
    }

    /**
     * used에 없는 첫 파일명을 골라 used에 등록한다.
     * "/b" 두 번 뒤의 "/b-2" 처럼 원래 이름이 접미 형태여도 덮어쓰지 않음.
     */
    public static String uniqueFileName(String baseName, Set<String> used) {
        for (int n = 1; ; n++) {
            String candidate = withSuffix(baseName, n);
            if (used.add(candidate)) return candidate;
        }
    }
}
