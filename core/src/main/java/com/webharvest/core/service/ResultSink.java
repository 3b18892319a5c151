package com.webharvest.core.service;

import com.webharvest.core.model.BlockedRecord;
import com.webharvest.core.model.CrawlSummary;
import com.webharvest.core.model.FailureRecord;
import com.webharvest.core.model.PageRecord;

import java.io.IOException;

/**
 * 크롤 이벤트 수신자. 코어는 레코드만 만들고, 실제 저장(파일 append 등)은 구현체 책임.
 */
public interface ResultSink extends AutoCloseable {

    /** @return 페이지를 받아들였으면 true (저장 실패 시 false → 크롤러가 WRITE_ERROR 실패로 기록) */
    boolean onPage(PageRecord page);

    void onFailure(FailureRecord failure);

    void onBlocked(BlockedRecord blocked);

    /** 실행 종료 시 1회 호출 (메타데이터 인덱스 직렬화 등) */
    default void finish(CrawlSummary summary) throws IOException {}

    @Override default void close() throws Exception {}

    ResultSink NONE = new ResultSink() {
        @Override public boolean onPage(PageRecord page) { return true; }
        @Override public void onFailure(FailureRecord failure) {}
        @Override public void onBlocked(BlockedRecord blocked) {}
    };
}
