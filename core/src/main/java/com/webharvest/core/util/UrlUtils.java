package com.webharvest.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

/** URL 정규화 + 도메인 매칭 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /** host 없이 쓰이는 의사 프로토콜: 크롤 대상이 될 수 없음 */
    private static final Set<String> PSEUDO_SCHEMES = Set.of("mailto", "javascript", "tel", "data", "about", "sms");

    public static URI normalizeSeed(String seed) {
        return normalize(null, seed);
    }

    /**
     * 정규화 규칙:
     * - base 기준 상대 경로 해석 (base가 null이면 href 단독)
     * - scheme이 없으면 https:// 접두
     * - fragment 제거(#... 제거)
     * - scheme/host 소문자, 기본 포트 제거(http:80, https:443)
     * - "." / ".." 세그먼트 제거
     * - 빈/누락 경로를 "/"로, 중복 슬래시 축소
     *
     * @throws InvalidUrlException scheme+host+path로 해석할 수 없는 경우
     */
    public static URI normalize(String base, String href) {
        if (href == null || href.isBlank()) throw new InvalidUrlException(String.valueOf(href), "empty url");
        String raw = href.trim().replace(" ", "%20");

        String lead = leadingScheme(raw);
        if (lead != null && PSEUDO_SCHEMES.contains(lead)) {
            throw new InvalidUrlException(href, "pseudo-protocol '" + lead + "'");
        }

        boolean hasBase = base != null && !base.isBlank();
        URI u;
        try {
            if (!hasBase && !raw.contains("://")) {
                // "example.com/path", "//example.com" 형태 시드
                raw = raw.startsWith("//") ? "https:" + raw : "https://" + raw;
            }
            u = new URI(raw);
            if (hasBase && u.getScheme() == null) {
                // base도 정규화해 둬야 빈 경로 base("https://a.com")에서 resolve가 깨지지 않음
                URI b = normalize(null, base);
                if (raw.startsWith("?")) {
                    // URI.resolve는 "?q" 에서 마지막 경로 세그먼트를 버림: base 경로 유지
                    String bs = b.toString();
                    int q = bs.indexOf('?');
                    u = new URI((q >= 0 ? bs.substring(0, q) : bs) + raw);
                } else {
                    u = b.resolve(u);
                }
            }
            u = u.normalize();
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new InvalidUrlException(href, "unparseable url", e);
        }

        if (u.isOpaque()) throw new InvalidUrlException(href, "opaque url");
        String host = u.getHost();
        if (host == null || host.isBlank()) throw new InvalidUrlException(href, "missing host");

        String scheme = u.getScheme().toLowerCase(Locale.ROOT);
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1; // 기본 포트 제거
        }

        String path = (u.getRawPath() == null || u.getRawPath().isEmpty()) ? "/" : u.getRawPath();
        path = path.replaceAll("/{2,}", "/");
        // 루트 위로 올라가는 ".." 는 버림: /../a → /a
        path = path.replaceFirst("^(/\\.\\.)+(?=/|$)", "");
        if (path.isEmpty()) path = "/";

        StringBuilder sb = new StringBuilder(64)
                .append(scheme).append("://").append(host);
        if (port != -1) sb.append(':').append(port);
        sb.append(path);
        if (u.getRawQuery() != null) sb.append('?').append(u.getRawQuery());

        try {
            return new URI(sb.toString()); // fragment 제거된 상태로 재조립
        } catch (URISyntaxException e) {
            throw new InvalidUrlException(href, "unparseable url", e);
        }
    }

    /** host 소문자 + 선행 "www." 제거. host가 없으면 빈 문자열. */
    public static String registrableHost(URI u) {
        if (u == null || u.getHost() == null) return "";
        return stripWww(u.getHost());
    }

    public static String stripWww(String host) {
        String h = host.trim().toLowerCase(Locale.ROOT);
        return h.startsWith("www.") ? h.substring(4) : h;
    }

    /** host == domain 이거나 host가 domain의 서브도메인이면 true */
    public static boolean hostMatches(String host, String domain) {
        if (host == null || domain == null || domain.isEmpty()) return false;
        return host.equals(domain) || host.endsWith("." + domain);
    }

    // "mailto:x@y" → "mailto", "/a:b" → null
    private static String leadingScheme(String s) {
        int colon = s.indexOf(':');
        if (colon <= 0) return null;
        for (int i = 0; i < colon; i++) {
            char c = s.charAt(i);
            boolean ok = Character.isLetterOrDigit(c) || c == '+' || c == '-' || c == '.';
            if (!ok) return null;
        }
        return s.substring(0, colon).toLowerCase(Locale.ROOT);
    }
}
