package com.sitescout.core.util;

@FunctionalInterface
public interface ProgressListener {
    /**
     * 페이지 하나가 방문 처리(디큐 + visited 표시)될 때마다 호출.
     * @param phase   "seed" | "crawl"
     * @param url     시드 또는 방문 URL
     * @param visited 지금까지 방문 수(시드 시작 시점에는 현재 값)
     */
    void onProgress(String phase, String url, long visited);

    ProgressListener NONE = (phase, url, visited) -> {};
}
