package com.webharvest.core.crawler;

import com.webharvest.core.model.ExtractedPage;

import java.net.URI;

/** HTML 본문에서 제목/Markdown/외부 링크 후보를 뽑아내는 전략 인터페이스. */
public interface ContentExtractor {
    /**
     * @param html 응답 본문
     * @param url  페이지 URL (상대 링크 해석 기준, 제목 fallback)
     * @throws ExtractionException 추출 가능한 텍스트가 전혀 없거나 파싱 실패
     */
    ExtractedPage extract(String html, URI url) throws ExtractionException;
}
