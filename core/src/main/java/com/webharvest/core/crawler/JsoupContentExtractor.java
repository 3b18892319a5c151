package com.webharvest.core.crawler;

import com.webharvest.core.model.ExtractedPage;
import com.webharvest.core.model.FailureReason;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 기본 JSoup 기반 추출기.
 * 1) 원본 문서에서 제목/링크 수집 → 2) 노이즈 서브트리 제거 → 3) 블록 요소를 문서 순서대로 Markdown 변환
 */
public class JsoupContentExtractor implements ContentExtractor {

    private final StructuralTagClassifier classifier;

    public JsoupContentExtractor() {
        this(DefaultTagClassifier.defaults());
    }

    public JsoupContentExtractor(StructuralTagClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    @Override
    public ExtractedPage extract(String html, URI url) throws ExtractionException {
        Objects.requireNonNull(url, "url");
        if (html == null || html.isBlank()) {
            throw new ExtractionException(FailureReason.NO_CONTENT, "empty body");
        }
        if (html.indexOf('\u0000') >= 0) {
            throw new ExtractionException(FailureReason.NO_CONTENT, "binary body");
        }

        Document doc;
        try {
            doc = Jsoup.parse(html, url.toString());
        } catch (RuntimeException e) {
            throw new ExtractionException(FailureReason.PARSE_ERROR, "html parse failed: " + e.getMessage(), e);
        }

        // 제목/링크는 정리 전 원본 문서 기준
        String title = deriveTitle(doc, url);
        List<String> links = collectLinks(doc);
        String base = doc.baseUri().isBlank() ? url.toString() : doc.baseUri();

        Element body = doc.body();
        if (body == null || body.text().isBlank()) {
            throw new ExtractionException(FailureReason.NO_CONTENT, "no text content");
        }

        removeNoise(body);
        String markdown = MarkdownRenderer.render(body, classifier);
        if (markdown.isBlank()) {
            // 블록 태그 없이 div/span 만으로 된 문서: 정리 후 남은 텍스트를 한 문단으로
            markdown = body.text().trim();
        }
        if (markdown.isBlank()) {
            throw new ExtractionException(FailureReason.NO_CONTENT, "only boilerplate content");
        }
        return new ExtractedPage(title, markdown, links, base);
    }

    /** title → 첫 h1 → 첫 h2 → URL 경로(루트면 host) */
    static String deriveTitle(Document doc, URI url) {
        String t = doc.title();
        if (t != null && !t.isBlank()) return t.trim();
        for (String tag : List.of("h1", "h2")) {
            Element h = doc.selectFirst(tag);
            if (h != null && !h.text().isBlank()) return h.text().trim();
        }
        String path = url.getPath();
        if (path != null && !path.isBlank() && !path.equals("/")) return path;
        return url.getHost() == null ? url.toString() : url.getHost();
    }

    private static List<String> collectLinks(Document doc) {
        List<String> out = new ArrayList<>();
        for (Element a : doc.select("a[href]")) {
            // jsoup이 base 기준으로 절대화 (RFC 3986). 해석 불가면 원문 href
            String href = a.absUrl("href").trim();
            if (href.isEmpty()) href = a.attr("href").trim();
            if (!href.isEmpty()) out.add(href);
        }
        return out;
    }

    private void removeNoise(Element root) {
        // 스냅샷 순회: 제거된 서브트리의 자손도 돌지만 이미 분리된 트리라 무해
        Elements all = root.getAllElements();
        for (Element el : all) {
            if (el == root) continue;
            if (el.parent() == null) continue;
            if (classifier.isNoise(el)) el.remove();
        }
    }
}
