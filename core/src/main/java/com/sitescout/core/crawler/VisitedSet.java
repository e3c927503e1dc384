package com.sitescout.core.crawler;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/** 이미 디큐된 URL 집합. 커지기만 한다. markVisited는 원자적 test-and-add. */
public final class VisitedSet {
    private final Set<String> seen = ConcurrentHashMap.newKeySet();
    private final Queue<String> order = new ConcurrentLinkedQueue<>();

    /** 처음이면 true(호출자가 처리 담당), 이미 방문했으면 false */
    public boolean markVisited(String url) {
        if (!seen.add(url)) return false;
        order.add(url);
        return true;
    }

    public boolean contains(String url) { return seen.contains(url); }
    public int size() { return seen.size(); }

    /** 방문 순서 스냅샷 */
    public List<String> snapshot() { return new ArrayList<>(order); }
}
