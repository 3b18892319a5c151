package com.webharvest.core.model;

import java.net.URI;
import java.util.Objects;

/** 프런티어 큐 원소: 정규화된 URL + 발견 깊이(시드 = 0) */
public record FrontierEntry(URI url, int depth) {
    public FrontierEntry {
        Objects.requireNonNull(url, "url");
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
    }
}
