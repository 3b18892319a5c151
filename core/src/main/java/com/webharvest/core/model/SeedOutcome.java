package com.webharvest.core.model;

/** 시드별 결과: 최종 상태 + 이 시드 실행 중 저장된 페이지 수 */
public record SeedOutcome(String seed, SeedState state, int pages) {}
