package com.webharvest.core.crawler;

/** Markdown 변환 시 블록 요소 분류 */
public enum BlockKind {
    HEADING,
    PARAGRAPH,
    LIST_ITEM,
    QUOTE,
    CODE,
    /** 블록으로 취급하지 않음 (텍스트는 조상 블록이 가져감) */
    NONE
}
