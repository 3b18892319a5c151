package com.webharvest.core.crawler;

import com.webharvest.core.model.Admission;
import com.webharvest.core.model.BlockReason;
import com.webharvest.core.model.CrawlConfig;
import com.webharvest.core.model.CrawlState;
import com.webharvest.core.util.UrlPatterns;
import com.webharvest.core.util.UrlUtils;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * fetch 전 입장 판정. 판정 순서(먼저 걸린 규칙이 이김):
 * <ol>
 *   <li>scheme: http/https만</li>
 *   <li>allow-list: host가 목록의 도메인과 같거나 그 서브도메인</li>
 *   <li>block-list: 명시적 거부가 서브도메인 허용보다 우선</li>
 *   <li>URL 패턴: 컴파일된 정규식 중 하나라도 find 되면 거절</li>
 * </ol>
 */
public final class AdmissionFilter {

    private final List<String> allowedDomains;
    private final List<String> blockedDomains;
    private final UrlPatterns blockedPatterns;

    public AdmissionFilter(List<String> allowedDomains, List<String> blockedDomains, UrlPatterns blockedPatterns) {
        this.allowedDomains = List.copyOf(Objects.requireNonNull(allowedDomains, "allowedDomains"));
        this.blockedDomains = List.copyOf(Objects.requireNonNull(blockedDomains, "blockedDomains"));
        this.blockedPatterns = Objects.requireNonNull(blockedPatterns, "blockedPatterns");
    }

    /** 설정에서 생성: 패턴은 여기서 한 번만 컴파일 */
    public static AdmissionFilter from(CrawlConfig cfg) {
        return new AdmissionFilter(cfg.getAllowedDomains(), cfg.getBlockedDomains(),
                UrlPatterns.compile(cfg.getBlockedUrlPatterns()));
    }

    /** 순수 판정: 부수효과 없음 */
    public Admission evaluate(URI url) {
        if (url == null) return Admission.blocked(BlockReason.SCHEME, "null url");

        String scheme = url.getScheme() == null ? "" : url.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            return Admission.blocked(BlockReason.SCHEME, scheme.isEmpty() ? "no scheme" : scheme);
        }

        String host = UrlUtils.registrableHost(url);
        Optional<String> allowedBy = firstDomainMatch(host, allowedDomains);
        if (allowedBy.isEmpty()) {
            return Admission.blocked(BlockReason.NOT_ALLOWED_DOMAIN, host);
        }

        Optional<String> deniedBy = firstDomainMatch(host, blockedDomains);
        if (deniedBy.isPresent()) {
            return Admission.blocked(BlockReason.DENIED_DOMAIN, deniedBy.get());
        }

        Optional<String> pattern = blockedPatterns.firstMatch(url);
        if (pattern.isPresent()) {
            return Admission.blocked(BlockReason.PATTERN, pattern.get());
        }
        return Admission.permit();
    }

    /** 판정 + 거절 시 blocked 카운터 1 증가 */
    public Admission admit(URI url, CrawlState state) {
        Admission a = evaluate(url);
        if (a.isBlocked()) state.stats().incBlocked();
        return a;
    }

    private static Optional<String> firstDomainMatch(String host, List<String> domains) {
        for (String d : domains) {
            if (UrlUtils.hostMatches(host, d)) return Optional.of(d);
        }
        return Optional.empty();
    }
}
