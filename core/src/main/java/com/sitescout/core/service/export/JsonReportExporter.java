package com.sitescout.core.service.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sitescout.core.api.ResultSink;
import com.sitescout.core.model.BrokenLink;
import com.sitescout.core.model.CrawlConfig;
import com.sitescout.core.model.CrawlReport;
import com.sitescout.core.model.CrawlStats;
import com.sitescout.core.model.PageResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 실행 요약 JSON(crawl-report.json). output.json=true 일 때만 쓴다.
 * 구조: meta / counts / pages / brokenLinks / stats
 */
public final class JsonReportExporter implements ResultSink {

    public static final String FILE_NAME = "crawl-report.json";
    static final String REPORT_VERSION = "1.0";

    private final Path outputDir;
    private final CrawlConfig config;
    private final Clock clock;
    private final ObjectMapper mapper;

    public JsonReportExporter(Path outputDir, CrawlConfig config) {
        this(outputDir, config, Clock.systemUTC());
    }

    JsonReportExporter(Path outputDir, CrawlConfig config, Clock clock) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Path write(CrawlReport report) throws IOException {
        Files.createDirectories(outputDir);
        Path out = outputDir.resolve(FILE_NAME);
        String json = mapper.writeValueAsString(toTree(report));
        Files.writeString(out, json, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return out;
    }

    Map<String, Object> toTree(CrawlReport report) {
        Map<String, Object> root = new LinkedHashMap<>();

        // meta
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("reportVersion", REPORT_VERSION);
        meta.put("generatedAt", Instant.now(clock));
        meta.put("seeds", config.getSeeds());
        meta.put("keywords", config.getKeywords());
        meta.put("visitedScope", config.getVisitedScope().name());
        meta.put("concurrency", config.getConcurrency());
        meta.put("timeoutMs", config.getTimeoutMs());
        meta.put("validateLinks", config.isValidateLinks());
        meta.put("cancelled", report.cancelled());
        root.put("meta", meta);

        // counts
        Map<String, Object> counts = new LinkedHashMap<>();
        counts.put("visited", report.visitedCount());
        counts.put("pages", report.pages().size());
        counts.put("brokenLinks", report.brokenLinks().size());
        root.put("counts", counts);

        // pages
        List<Map<String, Object>> pages = new ArrayList<>();
        for (PageResult p : report.pages()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("url", p.url());
            m.put("keywords", p.keywords());
            pages.add(m);
        }
        root.put("pages", pages);

        // brokenLinks
        List<Map<String, Object>> broken = new ArrayList<>();
        for (BrokenLink b : report.brokenLinks()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("href", b.href());
            m.put("referrer", b.referrer());
            broken.add(m);
        }
        root.put("brokenLinks", broken);

        // stats
        CrawlStats.Snapshot s = report.stats();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("pageRequests", s.pageRequests);
        stats.put("validationRequests", s.validationRequests);
        stats.put("pagesVisited", s.pagesVisited);
        stats.put("pagesMatched", s.pagesMatched);
        stats.put("brokenLinks", s.brokenLinks);
        stats.put("maxObservedConcurrency", s.maxObservedConcurrency);
        Map<String, Object> failures = new LinkedHashMap<>();
        s.failures.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> failures.put(e.getKey().name(), e.getValue()));
        stats.put("failures", failures);
        root.put("stats", stats);

        return root;
    }
}
