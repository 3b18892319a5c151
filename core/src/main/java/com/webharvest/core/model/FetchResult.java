package com.webharvest.core.model;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/** fetch 결과 캡처: 성공 시 본문/상태, 실패 시 분류된 사유 (본문은 텍스트 기준) */
public final class FetchResult {
    private final URI url;
    private final int statusCode;
    private final String body;
    private final String contentType;
    private final int attempts;
    private final FailureReason failure;
    private final String failureDetail;

    private FetchResult(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.body = (b.body == null) ? "" : b.body;
        this.contentType = b.contentType;
        this.attempts = b.attempts;
        this.failure = b.failure;
        this.failureDetail = b.failureDetail;
    }

    /** 최종 HTTP 상태. 응답 자체를 못 받았으면 -1 */
    public int getStatusCode() { return statusCode; }
    public String getBody() { return body; }
    public String getContentType() { return contentType; }
    public int getAttempts() { return attempts; }
    public int getRetries() { return Math.max(0, attempts - 1); }
    public FailureReason getFailure() { return failure; }
    public String getFailureDetail() { return failureDetail; }

    public boolean isSuccess() { return failure == null; }

    /** Content-Type이 없으면 HTML로 간주 (서버가 헤더를 빠뜨리는 경우가 많음) */
    public boolean isHtml() {
        if (contentType == null || contentType.isBlank()) return true;
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.contains("text/html") || ct.contains("application/xhtml+xml");
    }

    public Builder toBuilder() {
        return builder().url(url).statusCode(statusCode).body(body).contentType(contentType)
                .attempts(attempts).failure(failure, failureDetail);
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private int statusCode = -1;
        private String body;
        private String contentType;
        private int attempts = 1;
        private FailureReason failure;
        private String failureDetail;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder attempts(int attempts) { this.attempts = attempts; return this; }
        public Builder failure(FailureReason reason, String detail) {
            this.failure = reason;
            this.failureDetail = detail;
            return this;
        }

        public FetchResult build() {
            Objects.requireNonNull(url, "url");
            return new FetchResult(this);
        }
    }
}
