package com.webharvest.core.crawler;

import com.webharvest.core.model.FrontierEntry;
import com.webharvest.core.model.VisitedSet;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 시드 1개의 BFS 큐. (URL, depth) FIFO.
 * - depth &gt; maxDepth 인 원소는 만들지 않는다
 * - 같은 URL이 큐에 동시에 두 번 있을 수 없다
 * - 이미 방문한 URL은 다시 넣지 않는다
 */
public final class Frontier {

    private final int maxDepth;
    private final VisitedSet visited;
    private final Deque<FrontierEntry> queue = new ArrayDeque<>();
    private final Set<String> queued = new HashSet<>();

    public Frontier(int maxDepth, VisitedSet visited) {
        this.maxDepth = Math.max(0, maxDepth);
        this.visited = Objects.requireNonNull(visited, "visited");
    }

    /** @return 실제로 큐에 들어갔으면 true */
    public boolean offer(URI url, int depth) {
        if (url == null || depth < 0 || depth > maxDepth) return false;
        if (visited.contains(url)) return false;
        if (!queued.add(url.toString())) return false;
        queue.addLast(new FrontierEntry(url, depth));
        return true;
    }

    /** 비어 있으면 null */
    public FrontierEntry poll() {
        FrontierEntry e = queue.pollFirst();
        if (e != null) queued.remove(e.url().toString());
        return e;
    }

    public boolean isEmpty() { return queue.isEmpty(); }
}
