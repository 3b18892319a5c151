package com.webharvest.core.model;

import java.util.Locale;

/** URL 단위 실패 분류. 로그/인덱스에는 kebab-case 라벨로 남는다. */
public enum FailureReason {
    INVALID_SEED,
    TIMEOUT,
    HTTP_ERROR,
    NETWORK_ERROR,
    NO_CONTENT,
    PARSE_ERROR,
    WRITE_ERROR;

    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
