package com.webharvest.core.model;

import java.net.URI;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** 방문(처리 또는 거절) 완료 URL 집합. 늘어나기만 하고 줄지 않는다. */
public final class VisitedSet {
    private final Set<String> urls = ConcurrentHashMap.newKeySet();

    /** 원자적 check-then-insert. 처음 방문이면 true. */
    public boolean markVisited(URI url) {
        return urls.add(url.toString());
    }

    public boolean contains(URI url) {
        return urls.contains(url.toString());
    }

    public int size() { return urls.size(); }
}
