package com.sitescout.core.service;

import com.sitescout.core.api.DiagnosticsSink;
import com.sitescout.core.api.ICrawler;
import com.sitescout.core.api.ResultSink;
import com.sitescout.core.crawler.CrawlEngine;
import com.sitescout.core.http.HttpFetcher;
import com.sitescout.core.model.CrawlConfig;
import com.sitescout.core.model.CrawlReport;
import com.sitescout.core.service.export.CsvResultSink;
import com.sitescout.core.service.export.JsonReportExporter;
import com.sitescout.core.util.ProgressListener;
import com.sitescout.core.util.StructuredDiagnosticsSink;
import com.sitescout.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 크롤 오케스트레이터:
 *  - crawl → 결과 집계 → 내보내기(CSV, 옵션 JSON)
 *  - 기본 구현체(CrawlEngine/HttpFetcher/StructuredDiagnosticsSink)
 *  - DI 생성자는 테스트 주입용
 *
 * 실행은 반복 가능하며 실행마다 새 상태로 시작한다.
 */
public final class CrawlService {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlService.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlService.class);

    private final CrawlConfig config;
    private final ICrawler crawler;
    private final List<ResultSink> sinks;

    /** 기본 구현 */
    public CrawlService(CrawlConfig config) {
        this(config, defaultCrawler(config), defaultSinks(config));
    }

    /** DI/테스트용 */
    public CrawlService(CrawlConfig config, ICrawler crawler, List<ResultSink> sinks) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.crawler = Objects.requireNonNull(crawler, "crawler");
        this.sinks = List.copyOf(Objects.requireNonNull(sinks, "sinks"));
    }

    private static ICrawler defaultCrawler(CrawlConfig config) {
        DiagnosticsSink diagnostics = new StructuredDiagnosticsSink();
        return new CrawlEngine(config, new HttpFetcher(config), diagnostics);
    }

    public static List<ResultSink> defaultSinks(CrawlConfig config) {
        List<ResultSink> out = new ArrayList<>();
        out.add(new CsvResultSink(config.getOutputDir()));
        if (config.isJsonReport()) {
            out.add(new JsonReportExporter(config.getOutputDir(), config));
        }
        return out;
    }

    public CrawlReport run() {
        return run(ProgressListener.NONE, null);
    }

    /** 진행률 + 취소 플래그(옵션) */
    public CrawlReport run(ProgressListener listener, AtomicBoolean cancelFlag) {
        LOG.info("Crawl start: seeds={}, keywords={}, cc={}, scope={}",
                config.getSeeds().size(), config.getKeywords().size(),
                config.getConcurrency(), config.getVisitedScope());
        SLOG.info("run-start",
                "seeds", config.getSeeds().size(),
                "keywords", String.join(",", config.getKeywords()),
                "cc", config.getConcurrency(),
                "timeoutMs", config.getTimeoutMs(),
                "validateLinks", config.isValidateLinks());

        CrawlReport report = crawler.crawl(config.getSeeds(), listener, cancelFlag);

        var s = report.stats();
        LOG.info("Crawl done. visited={}, matched={}, brokenLinks={}, failures={}, maxObservedCC={}",
                report.visitedCount(), report.pages().size(), report.brokenLinks().size(),
                s.failureCount(), s.maxObservedConcurrency);
        if (report.cancelled()) {
            LOG.warn("Crawl was cancelled; results are partial.");
        }
        return report;
    }

    /**
     * 모든 sink에 결과를 쓴다. 취소된 부분 결과도 그대로 쓴다.
     * @return 생성된 파일 경로(sink 순서)
     */
    public List<Path> export(CrawlReport report) throws IOException {
        Objects.requireNonNull(report, "report");
        List<Path> written = new ArrayList<>(sinks.size());
        for (ResultSink sink : sinks) {
            Path p = sink.write(report);
            LOG.info("Wrote {}", p);
            SLOG.info("export-written", "sink", sink.getClass().getSimpleName(), "path", p.toString());
            written.add(p);
        }
        return written;
    }
}
