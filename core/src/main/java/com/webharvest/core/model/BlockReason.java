package com.webharvest.core.model;

/** 입장 거절 사유: 판정 순서대로 선언 */
public enum BlockReason {
    SCHEME("scheme"),
    NOT_ALLOWED_DOMAIN("not-allowed-domain"),
    DENIED_DOMAIN("denied-domain"),
    PATTERN("pattern");

    private final String label;

    BlockReason(String label) { this.label = label; }

    public String label() { return label; }
}
