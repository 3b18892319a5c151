package com.webharvest.core.model;

import java.util.List;

/**
 * 추출 결과.
 * @param links   원본 문서의 모든 a[href] 원문 (정규화 전)
 * @param baseUrl 링크 해석 기준 URL (&lt;base href&gt; 반영)
 */
public record ExtractedPage(String title, String markdown, List<String> links, String baseUrl) {
    public ExtractedPage {
        links = (links == null ? List.of() : List.copyOf(links));
    }
}
