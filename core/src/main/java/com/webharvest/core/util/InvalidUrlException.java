package com.webharvest.core.util;

/** 정규화할 수 없는 URL (빈 문자열, mailto:/javascript: 등 의사 프로토콜, host 없음). */
public class InvalidUrlException extends IllegalArgumentException {

    private final String raw;

    public InvalidUrlException(String raw, String message) {
        super(message + ": " + raw);
        this.raw = raw;
    }

    public InvalidUrlException(String raw, String message, Throwable cause) {
        super(message + ": " + raw, cause);
        this.raw = raw;
    }

    /** 입력으로 들어온 원본 문자열 */
    public String getRaw() { return raw; }
}
