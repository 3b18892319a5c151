package com.webharvest.core.crawler;

import com.webharvest.core.model.FailureReason;

/** 본문을 만들 수 없는 문서 (빈 본문, 바이너리, 파싱 실패) */
public class ExtractionException extends Exception {

    private final FailureReason reason;

    public ExtractionException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ExtractionException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /** NO_CONTENT 또는 PARSE_ERROR */
    public FailureReason getReason() { return reason; }
}
