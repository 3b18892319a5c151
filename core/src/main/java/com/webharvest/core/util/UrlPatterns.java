package com.webharvest.core.util;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 설정 로드 시점에 한 번만 컴파일되는 URL 차단 패턴 집합.
 * <ul>
 *   <li>기본: 정규식 (예: {@code \.(pdf|zip)$}, {@code \?utm_})</li>
 *   <li>{@code "glob:"} 접두: {@code '*'}, {@code '?'} 지원 (예: {@code glob:*&#47;wp-json/*})</li>
 *   <li>{@code "prefix:"} 접두: URL 전체 또는 경로 접두 (예: {@code prefix:/admin})</li>
 * </ul>
 * 매칭은 URL 전체 문자열에 대해 대소문자 무시 {@code find()}.
 */
public final class UrlPatterns {

    private final List<String> sources;
    private final List<Pattern> compiled;

    private UrlPatterns(List<String> sources, List<Pattern> compiled) {
        this.sources = sources;
        this.compiled = compiled;
    }

    public static UrlPatterns none() {
        return new UrlPatterns(List.of(), List.of());
    }

    /** @throws IllegalArgumentException 잘못된 정규식이 섞여 있으면 (설정 오류로 취급) */
    public static UrlPatterns compile(List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) return none();
        List<String> src = new ArrayList<>();
        List<Pattern> out = new ArrayList<>();
        for (String p : patterns) {
            if (p == null || p.isBlank()) continue;
            String rx;
            if (p.startsWith("glob:")) rx = globToRegex(p.substring(5));
            else if (p.startsWith("prefix:")) rx = prefixToRegex(p.substring(7));
            else rx = p;
            try {
                out.add(Pattern.compile(rx, Pattern.CASE_INSENSITIVE));
                src.add(p);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("invalid blocked url pattern '" + p + "': " + e.getDescription(), e);
            }
        }
        return new UrlPatterns(Collections.unmodifiableList(src), Collections.unmodifiableList(out));
    }

    /** 첫 번째로 매치된 패턴의 원문. 없으면 empty. */
    public Optional<String> firstMatch(URI url) {
        if (url == null || compiled.isEmpty()) return Optional.empty();
        final String s = url.toString();
        for (int i = 0; i < compiled.size(); i++) {
            if (compiled.get(i).matcher(s).find()) return Optional.of(sources.get(i));
        }
        return Optional.empty();
    }

    public boolean matches(URI url) {
        return firstMatch(url).isPresent();
    }

    private static String prefixToRegex(String prefix) {
        // "/admin" 같은 호스트 상대 접두는 경로 시작에 고정
        if (prefix.startsWith("/")) return "^[a-z][a-z0-9+.-]*://[^/]+" + Pattern.quote(prefix);
        return "^" + Pattern.quote(prefix);
    }

    private static String globToRegex(String glob){
        StringBuilder r = new StringBuilder();
        for (int i = 0; i < glob.length(); i++){
            char c = glob.charAt(i);
            switch(c){
                case '*': r.append(".*"); break;
                case '?': r.append('.'); break;
                case '.': case '\\': case '+': case '(': case ')':
                case '^': case '$': case '|': case '{': case '}':
                case '[': case ']': r.append('\\').append(c); break;
                default: r.append(c);
            }
        }
        return r.toString();
    }
}
