package com.sitescout.core.crawler;

import com.sitescout.core.api.DiagnosticsSink;
import com.sitescout.core.api.ICrawler;
import com.sitescout.core.api.IFetcher;
import com.sitescout.core.model.BrokenLink;
import com.sitescout.core.model.CrawlConfig;
import com.sitescout.core.model.CrawlReport;
import com.sitescout.core.model.CrawlStats;
import com.sitescout.core.model.FetchOutcome;
import com.sitescout.core.model.PageResult;
import com.sitescout.core.scanner.KeywordMatcher;
import com.sitescout.core.util.ProgressListener;
import com.sitescout.core.util.StructuredLog;
import com.sitescout.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 시드별 BFS 크롤 엔진.
 * <pre>
 * Pending → Fetching → {Matched | Unmatched | FetchFailed} → Visited
 * </pre>
 * - 코디네이터 스레드가 Frontier를 소유: 디큐 → markVisited(페치 전) → 워커에 배정
 * - 워커: 페치 → 키워드 매칭 → 링크 추출 → (옵션) 검증 페치 → 후보 반환
 * - 코디네이터가 완료 순으로 결과를 병합하고 후보를 Frontier 뒤에 붙인다
 * - concurrency=1 이면 완전한 순차 FIFO
 * - 실행 중 어떤 페치 실패도 크롤 전체를 중단시키지 않는다
 */
public final class CrawlEngine implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlEngine.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlEngine.class);

    /** 취소 플래그 확인 주기 */
    private static final long POLL_MS = 50;

    private final IFetcher fetcher;
    private final LinkExtractor extractor;
    private final KeywordMatcher matcher;
    private final DiagnosticsSink diagnostics;

    private final List<String> keywords;
    private final int concurrency;
    private final boolean validateLinks;
    private final CrawlConfig.VisitedScope visitedScope;

    public CrawlEngine(CrawlConfig config, IFetcher fetcher, DiagnosticsSink diagnostics) {
        this(config, fetcher, new JsoupLinkExtractor(), new KeywordMatcher(), diagnostics);
    }

    public CrawlEngine(CrawlConfig config,
                       IFetcher fetcher,
                       LinkExtractor extractor,
                       KeywordMatcher matcher,
                       DiagnosticsSink diagnostics) {
        Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.diagnostics = (diagnostics != null ? diagnostics : DiagnosticsSink.NONE);
        this.keywords = List.copyOf(config.getKeywords());
        this.concurrency = Math.max(1, config.getConcurrency());
        this.validateLinks = config.isValidateLinks();
        this.visitedScope = config.getVisitedScope();
    }

    @Override
    public CrawlReport crawl(List<String> seeds, ProgressListener listener, AtomicBoolean cancelFlag) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final RunState run = new RunState();
        final VisitedSet shared = new VisitedSet();

        for (String raw : seeds) {
            if (isCancelled(cancelFlag)) {
                run.cancelled = true;
                break;
            }

            String seed = UrlUtils.normalizeSeed(raw);
            if (seed == null) {
                FetchOutcome.Failure bad = FetchOutcome.invalidUrl(String.valueOf(raw), "seed is not an absolute http(s) URL");
                run.stats.addFailure(bad.kind());
                diagnostics.fetchFailed(bad, null);
                LOG.warn("Skipping invalid seed: {}", raw);
                continue;
            }

            VisitedSet visited = (visitedScope == CrawlConfig.VisitedScope.RUN) ? shared : new VisitedSet();
            LOG.debug("Starting crawl at: {}", seed);
            SLOG.info("seed-start", "seed", seed, "scope", visitedScope.name(), "cc", concurrency);
            pl.onProgress("seed", seed, run.visited.size());

            crawlSeed(seed, visited, run, pl, cancelFlag);
            if (run.cancelled) break;
        }

        CrawlReport report = new CrawlReport(run.pages, run.brokenLinks, run.visited, run.stats.snapshot(), run.cancelled);
        SLOG.info("crawl-done",
                "visited", report.visitedCount(),
                "pages", report.pages().size(),
                "brokenLinks", report.brokenLinks().size(),
                "cancelled", report.cancelled());
        return report;
    }

    /** 시드 하나의 BFS. 결과는 run에 병합. */
    void crawlSeed(String seed, VisitedSet visited, RunState run, ProgressListener pl, AtomicBoolean cancelFlag) {
        final Frontier frontier = new Frontier(seed);

        ExecutorService exec = Executors.newFixedThreadPool(concurrency, new NamedThreadFactory("crawl-worker"));
        ExecutorCompletionService<PageTask> completion = new ExecutorCompletionService<>(exec);
        int inFlight = 0;

        try {
            loop:
            while (!frontier.isEmpty() || inFlight > 0) {
                if (isCancelled(cancelFlag)) {
                    run.cancelled = true;
                    break;
                }

                // 1) 배정: in-flight < concurrency 동안 디큐
                while (inFlight < concurrency && !frontier.isEmpty()) {
                    String url = frontier.poll();
                    if (!visited.markVisited(url)) continue; // 이미 방문: 페치/로그 없음

                    run.visited.add(url);
                    run.stats.addVisited();
                    LOG.debug("Crawling: {}", url);
                    pl.onProgress("crawl", url, run.visited.size());

                    completion.submit(() -> processPage(url, seed, visited, run.stats, cancelFlag));
                    inFlight++;
                    run.stats.observeConcurrency(inFlight);
                }
                if (inFlight == 0) continue;

                // 2) 완료 하나 수거(취소 확인하며 대기)
                Future<PageTask> done = null;
                while (done == null) {
                    if (isCancelled(cancelFlag)) {
                        run.cancelled = true;
                        break loop;
                    }
                    done = completion.poll(POLL_MS, TimeUnit.MILLISECONDS);
                }
                inFlight--;

                // 3) 병합 + 후보 enqueue
                try {
                    PageTask task = done.get();
                    merge(task, run);
                    for (String c : task.candidates()) frontier.offer(c);
                } catch (ExecutionException e) {
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    if (cause instanceof CancellationException) {
                        run.cancelled = true;
                        break;
                    }
                    LOG.warn("Page task failed: {}", cause.toString());
                    SLOG.error("page-task-failed", cause, "seed", seed);
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            run.cancelled = true;
        } finally {
            // 진행 중 작업은 버린다(병합 전이므로 결과 목록은 온전)
            exec.shutdownNow();
            try {
                exec.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }

        SLOG.info("seed-done", "seed", seed, "visited", visited.size(),
                "enqueued", frontier.totalEnqueued(), "cancelled", run.cancelled);
    }

    /** 워커: 한 페이지 처리. 결과는 코디네이터가 병합한다. */
    PageTask processPage(String url, String seed, VisitedSet visited, CrawlStats stats, AtomicBoolean cancelFlag) {
        checkCancel(cancelFlag);
        stats.addPageRequest();
        FetchOutcome outcome = fetcher.fetch(url);

        if (outcome instanceof FetchOutcome.Failure failure) {
            checkCancel(cancelFlag);
            stats.addFailure(failure.kind());
            diagnostics.fetchFailed(failure, null);
            return PageTask.failed(url);
        }
        FetchOutcome.Success ok = (FetchOutcome.Success) outcome;

        List<String> found = matcher.match(ok.body(), keywords);
        PageResult result = found.isEmpty() ? null : new PageResult(url, found);

        List<String> candidates = new ArrayList<>();
        List<BrokenLink> broken = new ArrayList<>();
        for (String link : extractor.candidates(ok.body(), seed)) {
            if (visited.contains(link)) continue;

            if (validateLinks) {
                checkCancel(cancelFlag);
                stats.addValidationRequest();
                FetchOutcome check = fetcher.fetch(link);
                if (check instanceof FetchOutcome.Failure f) {
                    checkCancel(cancelFlag);
                    stats.addFailure(f.kind());
                    diagnostics.fetchFailed(f, url);
                    broken.add(new BrokenLink(link, url));
                }
            }
            // 검증 결과와 무관하게 enqueue
            candidates.add(link);
        }
        return new PageTask(url, result, broken, candidates);
    }

    private void merge(PageTask task, RunState run) {
        if (task.result() != null) {
            run.pages.add(task.result());
            run.stats.addMatched();
            SLOG.info("page-matched", "url", task.url(), "keywords", String.join(",", task.result().keywords()));
        }
        for (BrokenLink b : task.brokenLinks()) {
            run.brokenLinks.add(b);
            run.stats.addBrokenLink();
            LOG.debug("Broken link found: {}. Referring page: {}", b.href(), b.referrer());
            diagnostics.brokenLink(b);
        }
    }

    /* ========================= 내부 타입/유틸 ========================= */

    /** 워커 → 코디네이터 전달값 */
    record PageTask(String url, PageResult result, List<BrokenLink> brokenLinks, List<String> candidates) {
        static PageTask failed(String url) {
            return new PageTask(url, null, List.of(), List.of());
        }
    }

    /** 실행 전체 누적 상태. 목록은 코디네이터 스레드만 변경한다(stats는 워커도 갱신). */
    static final class RunState {
        final CrawlStats stats = new CrawlStats();
        final List<PageResult> pages = new ArrayList<>();
        final List<BrokenLink> brokenLinks = new ArrayList<>();
        final List<String> visited = new ArrayList<>();
        boolean cancelled = false;
    }

    private static boolean isCancelled(AtomicBoolean flag) {
        return Thread.currentThread().isInterrupted() || (flag != null && flag.get());
    }

    private static void checkCancel(AtomicBoolean flag) {
        if (isCancelled(flag)) throw new CancellationException();
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
