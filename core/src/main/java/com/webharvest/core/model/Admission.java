package com.webharvest.core.model;

/** 입장 판정 결과. allowed면 reason/detail은 null. */
public record Admission(boolean allowed, BlockReason reason, String detail) {

    private static final Admission ALLOWED = new Admission(true, null, null);

    public static Admission permit() { return ALLOWED; }

    public static Admission blocked(BlockReason reason, String detail) {
        return new Admission(false, reason, detail);
    }

    public boolean isBlocked() { return !allowed; }
}
