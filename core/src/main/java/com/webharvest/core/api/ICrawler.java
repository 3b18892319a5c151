// ICrawler.java
package com.webharvest.core.api;

import com.webharvest.core.model.CrawlSummary;

import java.util.List;

/** 크롤러 최소 계약: 시드 목록을 순서대로 BFS 크롤하고 요약을 돌려준다. */
public interface ICrawler extends AutoCloseable {
    CrawlSummary crawl(List<String> seeds);
    @Override default void close() throws Exception {}
}
