package com.sitescout.core.model;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 크롤 런타임 카운터 (스레드 세이프). */
public final class CrawlStats {
    private final AtomicLong pageRequests       = new AtomicLong(0); // 방문 페치
    private final AtomicLong validationRequests = new AtomicLong(0); // 링크 검증 페치
    private final AtomicLong pagesVisited       = new AtomicLong(0);
    private final AtomicLong pagesMatched       = new AtomicLong(0);
    private final AtomicLong brokenLinks        = new AtomicLong(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);
    private final Map<FetchOutcome.FailureKind, AtomicLong> failures = new EnumMap<>(FetchOutcome.FailureKind.class);

    public CrawlStats() {
        for (FetchOutcome.FailureKind k : FetchOutcome.FailureKind.values()) {
            failures.put(k, new AtomicLong(0));
        }
    }

    public void addPageRequest()       { pageRequests.incrementAndGet(); }
    public void addValidationRequest() { validationRequests.incrementAndGet(); }
    public void addVisited()           { pagesVisited.incrementAndGet(); }
    public void addMatched()           { pagesMatched.incrementAndGet(); }
    public void addBrokenLink()        { brokenLinks.incrementAndGet(); }
    public void addFailure(FetchOutcome.FailureKind kind) { failures.get(kind).incrementAndGet(); }

    /** 현재 in-flight 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        Map<FetchOutcome.FailureKind, Long> f = new EnumMap<>(FetchOutcome.FailureKind.class);
        failures.forEach((k, v) -> f.put(k, v.get()));
        return new Snapshot(pageRequests.get(), validationRequests.get(), pagesVisited.get(),
                pagesMatched.get(), brokenLinks.get(), maxObservedConcurrency.get(), Map.copyOf(f));
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long pageRequests;
        public final long validationRequests;
        public final long pagesVisited;
        public final long pagesMatched;
        public final long brokenLinks;
        public final int  maxObservedConcurrency;
        public final Map<FetchOutcome.FailureKind, Long> failures;

        public Snapshot(long pageRequests, long validationRequests, long pagesVisited, long pagesMatched,
                        long brokenLinks, int maxObservedConcurrency, Map<FetchOutcome.FailureKind, Long> failures) {
            this.pageRequests = pageRequests;
            this.validationRequests = validationRequests;
            this.pagesVisited = pagesVisited;
            this.pagesMatched = pagesMatched;
            this.brokenLinks = brokenLinks;
            this.maxObservedConcurrency = maxObservedConcurrency;
            this.failures = failures;
        }

        public long failureCount() {
            return failures.values().stream().mapToLong(Long::longValue).sum();
        }
    }
}
