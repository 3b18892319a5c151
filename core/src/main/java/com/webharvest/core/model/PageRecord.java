package com.webharvest.core.model;

import java.time.Instant;
import java.util.Objects;

/** 성공적으로 가져와 추출한 페이지 1건. 생성 후 불변. */
public record PageRecord(String url, String title, String markdown, int outboundLinkCount,
                         Instant fetchedAt, int status, int depth) {
    public PageRecord {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(fetchedAt, "fetchedAt");
        title = (title == null ? "" : title);
        markdown = (markdown == null ? "" : markdown);
    }
}
