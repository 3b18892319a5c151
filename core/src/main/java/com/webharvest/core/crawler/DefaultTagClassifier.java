package com.webharvest.core.crawler;

import org.jsoup.nodes.Element;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 태그/클래스 휴리스틱 기본 규칙.
 * - 노이즈 태그: script, style, nav, aside, footer, header, iframe, noscript, form, svg ...
 * - 노이즈 토큰: class/id/role을 공백·하이픈·언더스코어로 자른 조각 중 하나가 토큰과 일치
 *   (예: "ad-slot", "cookie_banner", role="navigation")
 */
public final class DefaultTagClassifier implements StructuralTagClassifier {

    public static final Set<String> DEFAULT_NOISE_TAGS = Set.of(
            "script", "style", "nav", "aside", "footer", "header",
            "iframe", "noscript", "form", "svg", "button", "template");

    public static final Set<String> DEFAULT_NOISE_TOKENS = Set.of(
            "ad", "ads", "advert", "advertisement", "banner", "cookie", "cookies",
            "popup", "modal", "share", "social", "sponsor", "sponsored",
            "newsletter", "promo", "navigation", "navbar", "breadcrumb", "breadcrumbs");

    // 토큰 휴리스틱으로 지우면 문서 전체가 사라지는 컨테이너
    private static final Set<String> NEVER_NOISE = Set.of("html", "body", "main", "article");

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[\\s_-]+");

    private final Set<String> noiseTags;
    private final Set<String> noiseTokens;
    private final Map<String, BlockKind> blocks;

    private DefaultTagClassifier(Builder b) {
        this.noiseTags = Set.copyOf(b.noiseTags);
        this.noiseTokens = Set.copyOf(b.noiseTokens);
        this.blocks = Map.copyOf(b.blocks);
    }

    public static DefaultTagClassifier defaults() {
        return builder().build();
    }

    @Override
    public boolean isNoise(Element el) {
        if (noiseTags.contains(el.normalName())) return true;
        if (NEVER_NOISE.contains(el.normalName())) return false;
        if ("true".equalsIgnoreCase(el.attr("aria-hidden"))) return true;
        return hasNoiseToken(el.className()) || hasNoiseToken(el.id()) || hasNoiseToken(el.attr("role"));
    }

    @Override
    public BlockKind classify(Element el) {
        return blocks.getOrDefault(el.normalName(), BlockKind.NONE);
    }

    /** 블록 태그 이름 목록: CSS selector 구성용 */
    public Set<String> blockTags() {
        return blocks.keySet();
    }

    private boolean hasNoiseToken(String attr) {
        if (attr == null || attr.isBlank()) return false;
        for (String t : TOKEN_SPLIT.split(attr.toLowerCase(Locale.ROOT))) {
            if (noiseTokens.contains(t)) return true;
        }
        return false;
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private final Set<String> noiseTags = new LinkedHashSet<>(DEFAULT_NOISE_TAGS);
        private final Set<String> noiseTokens = new LinkedHashSet<>(DEFAULT_NOISE_TOKENS);
        private final Map<String, BlockKind> blocks = new LinkedHashMap<>();

        private Builder() {
            for (String h : List.of("h1", "h2", "h3", "h4", "h5", "h6")) blocks.put(h, BlockKind.HEADING);
            blocks.put("p", BlockKind.PARAGRAPH);
            blocks.put("li", BlockKind.LIST_ITEM);
            blocks.put("blockquote", BlockKind.QUOTE);
            blocks.put("pre", BlockKind.CODE);
        }

        /** 기본 노이즈 태그를 지정 목록으로 교체 (빈 목록이면 기본 유지) */
        public Builder noiseTags(Collection<String> tags) {
            if (tags != null && !tags.isEmpty()) {
                noiseTags.clear();
                tags.forEach(t -> noiseTags.add(t.trim().toLowerCase(Locale.ROOT)));
            }
            return this;
        }

        public Builder noiseTokens(Collection<String> tokens) {
            if (tokens != null && !tokens.isEmpty()) {
                noiseTokens.clear();
                tokens.forEach(t -> noiseTokens.add(t.trim().toLowerCase(Locale.ROOT)));
            }
            return this;
        }

        public Builder block(String tag, BlockKind kind) {
            blocks.put(tag.toLowerCase(Locale.ROOT), kind);
            return this;
        }

        public DefaultTagClassifier build() { return new DefaultTagClassifier(this); }
    }
}
