package com.webharvest.core.util;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param progress 0.0~1.0 (모르면 0.0)
     * @param phase    "crawl" | "seed" | "export"
     * @param done     처리된 시드 수(모르면 -1)
     * @param total    전체 시드 수(모르면 -1)
     * @param detail   현재 시드 URL 등 보조 정보 (null 가능)
     */
    void onProgress(double progress, String phase, long done, long total, String detail);

    ProgressListener NONE = (p, phase, d, t, detail) -> {};
}
