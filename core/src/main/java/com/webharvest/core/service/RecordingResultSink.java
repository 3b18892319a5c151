package com.webharvest.core.service;

import com.webharvest.core.model.BlockedRecord;
import com.webharvest.core.model.FailureRecord;
import com.webharvest.core.model.PageRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** 메모리 누적 sink. 파일을 남기지 않는 실행이나 테스트 관찰용. */
public class RecordingResultSink implements ResultSink {

    private final List<PageRecord> pages = Collections.synchronizedList(new ArrayList<>());
    private final List<FailureRecord> failures = Collections.synchronizedList(new ArrayList<>());
    private final List<BlockedRecord> blocked = Collections.synchronizedList(new ArrayList<>());

    @Override
    public boolean onPage(PageRecord page) {
        if (page == null) return false;
        pages.add(page);
        return true;
    }

    @Override
    public void onFailure(FailureRecord failure) {
        if (failure != null) failures.add(failure);
    }

    @Override
    public void onBlocked(BlockedRecord b) {
        if (b != null) blocked.add(b);
    }

    public List<PageRecord> pages() { return snapshot(pages); }
    public List<FailureRecord> failures() { return snapshot(failures); }
    public List<BlockedRecord> blocked() { return snapshot(blocked); }

    private static <T> List<T> snapshot(List<T> src) {
        synchronized (src) {
            return List.copyOf(src);
        }
    }
}
