package com.sitescout.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 크롤 설정 (설정 파일 + CLI 병합 대상). 순수 설정 보관용.
 * 파일 로딩은 {@link com.sitescout.core.config.CrawlConfigLoader}, 병합은
 * {@link com.sitescout.core.config.ConfigMerger} 담당.
 */
public final class CrawlConfig {

    /** VisitedSet 범위: 실행 전체 공유(RUN) 또는 시드마다 새로(SEED) */
    public enum VisitedScope { RUN, SEED }

    /** 고정 브라우저 식별 헤더 */
    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36";

    // ---------- 입력 ----------
    private final List<String> seeds = new ArrayList<>();
    private final List<String> keywords = new ArrayList<>();

    // ---------- 튜닝 ----------
    private Duration timeout = Duration.ofSeconds(10); // 연결/요청 타임아웃
    private int concurrency = 1;                        // 1 = 순차 FIFO
    private VisitedScope visitedScope = VisitedScope.RUN;
    private boolean validateLinks = true;               // 발견 링크 즉시 검증(이중 페치)
    private String userAgent = DEFAULT_USER_AGENT;

    // ---------- 출력 ----------
    private Path outputDir = Path.of(".");
    private boolean jsonReport = false;

    // ---------- getters ----------
    public List<String> getSeeds() { return Collections.unmodifiableList(seeds); }
    public List<String> getKeywords() { return Collections.unmodifiableList(keywords); }
    public Duration getTimeout() { return timeout; }
    public long getTimeoutMs() { return timeout.toMillis(); }
    public int getConcurrency() { return concurrency; }
    public VisitedScope getVisitedScope() { return visitedScope; }
    public boolean isValidateLinks() { return validateLinks; }
    public String getUserAgent() { return userAgent; }
    public Path getOutputDir() { return outputDir; }
    public boolean isJsonReport() { return jsonReport; }

    // ---------- fluent setters ----------
    /** 뒤에 덧붙인다(교체 아님) */
    public CrawlConfig addSeeds(List<String> more) {
        if (more != null) for (String s : more) if (s != null && !s.isBlank()) seeds.add(s.trim());
        return this;
    }

    /** 뒤에 덧붙인다(교체 아님) */
    public CrawlConfig addKeywords(List<String> more) {
        if (more != null) for (String k : more) if (k != null && !k.isBlank()) keywords.add(k.trim());
        return this;
    }

    public CrawlConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }

    public CrawlConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    public CrawlConfig setConcurrency(int concurrency) { this.concurrency = Math.max(1, concurrency); return this; }

    public CrawlConfig setVisitedScope(VisitedScope scope) {
        this.visitedScope = (scope != null ? scope : VisitedScope.RUN);
        return this;
    }

    public CrawlConfig setValidateLinks(boolean v) { this.validateLinks = v; return this; }

    public CrawlConfig setUserAgent(String ua) {
        this.userAgent = (ua == null || ua.isBlank()) ? DEFAULT_USER_AGENT : ua;
        return this;
    }

    public CrawlConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public CrawlConfig setJsonReport(boolean v) { this.jsonReport = v; return this; }

    // ---------- validate ----------
    public void validate() {
        if (seeds.isEmpty()) throw new IllegalArgumentException("seeds must not be empty");
        if (keywords.isEmpty()) throw new IllegalArgumentException("keywords must not be empty");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        Objects.requireNonNull(visitedScope, "visitedScope");
        Objects.requireNonNull(outputDir, "outputDir");
    }

    public static CrawlConfig defaults() { return new CrawlConfig(); }
}
