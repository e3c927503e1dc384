package com.sitescout.core.crawler;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 시드 하나의 대기 URL FIFO 큐. 삽입 시 중복 제거 없음(디큐 시 VisitedSet이 판정).
 * 코디네이터 스레드 전용이라 동기화하지 않는다.
 */
public final class Frontier {
    private final Deque<String> queue = new ArrayDeque<>();
    private long enqueued = 0;

    public Frontier(String seed) {
        offer(seed);
    }

    public void offer(String url) {
        if (url == null) return;
        queue.addLast(url);
        enqueued++;
    }

    /** 비어 있으면 null */
    public String poll() {
        return queue.pollFirst();
    }

    public boolean isEmpty() { return queue.isEmpty(); }
    public int size() { return queue.size(); }

    /** 누적 삽입 수(중복 포함) */
    public long totalEnqueued() { return enqueued; }
}
