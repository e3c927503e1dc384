package com.sitescout.core.model;

import java.util.List;
import java.util.Objects;

/**
 * 한 번의 실행 결과.
 * @param visited   방문(디큐) 순서대로의 URL. SEED 범위에서는 시드별로 같은 URL이 다시 나올 수 있다.
 * @param cancelled 취소로 중단됐으면 true (부분 결과)
 */
public record CrawlReport(List<PageResult> pages,
                          List<BrokenLink> brokenLinks,
                          List<String> visited,
                          CrawlStats.Snapshot stats,
                          boolean cancelled) {
    public CrawlReport {
        pages = List.copyOf(pages);
        brokenLinks = List.copyOf(brokenLinks);
        visited = List.copyOf(visited);
        Objects.requireNonNull(stats, "stats");
    }

    public int visitedCount() { return visited.size(); }

    public static CrawlReport empty() {
        return new CrawlReport(List.of(), List.of(), List.of(), new CrawlStats().snapshot(), false);
    }
}
