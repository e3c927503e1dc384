package com.sitescout.app.cli;

import com.sitescout.app.logging.LogSetup;
import com.sitescout.core.api.DiagnosticsSink;
import com.sitescout.core.config.ConfigException;
import com.sitescout.core.config.ConfigMerger;
import com.sitescout.core.config.CrawlConfigLoader;
import com.sitescout.core.config.StartupException;
import com.sitescout.core.model.CrawlConfig;
import com.sitescout.core.model.CrawlReport;
import com.sitescout.core.service.CrawlService;
import com.sitescout.core.util.ProgressListener;
import com.sitescout.core.util.StructuredDiagnosticsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CLI 진입점.
 * 종료 코드: 0 정상, 1 시작 실패/결과 저장 실패, 2 인자 오류, 130 취소(부분 결과 저장됨)
 */
public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_CANCELLED = 130;

    private final PrintStream out;
    private final PrintStream err;
    private final DiagnosticsSink diagnostics;

    Main(PrintStream out, PrintStream err, DiagnosticsSink diagnostics) {
        this.out = out;
        this.err = err;
        this.diagnostics = diagnostics;
    }

    public static void main(String[] args) {
        LogSetup.init(Path.of("."));

        AtomicBoolean cancel = new AtomicBoolean(false);
        CountDownLatch finished = new CountDownLatch(1);

        // Ctrl+C: 새 페치 중단 → 부분 결과 저장까지 잠시 대기
        Thread hook = new Thread(() -> {
            cancel.set(true);
            try {
                finished.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "sitescout-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        int code;
        try {
            code = new Main(System.out, System.err, new StructuredDiagnosticsSink()).run(args, cancel);
        } finally {
            finished.countDown();
            LogSetup.flush();
        }
        if (code != EXIT_OK) System.exit(code);
    }

    int run(String[] args, AtomicBoolean cancelFlag) {
        // 1) 인자
        CliArgs cli;
        try {
            cli = CliArgs.parse(args);
        } catch (CliArgs.UsageException e) {
            err.println(CliArgs.usage());
            err.println("sitescout: error: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (cli.help()) {
            out.println(CliArgs.usage());
            return EXIT_OK;
        }

        // 2) 설정(파일 + 인자)
        CrawlConfig cfg;
        try {
            cfg = resolveConfig(cli);
        } catch (StartupException e) {
            String source = (e instanceof ConfigException ce && ce.getSource() != null)
                    ? ce.getSource().toString() : "arguments";
            diagnostics.configFailed(source, e.getMessage());
            LOG.error("Startup failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage() + " Check errors.log for details.");
            return EXIT_FAILURE;
        }

        // 3) 크롤
        CrawlService service = new CrawlService(cfg);
        CrawlReport report = service.run(consoleProgress(out), cancelFlag);

        // 4) 결과 저장(취소된 부분 결과 포함)
        List<Path> written;
        try {
            written = service.export(report);
        } catch (IOException e) {
            LOG.error("Failed to write results: {}", e.toString(), e);
            err.println("Error: could not write results: " + e.getMessage());
            return EXIT_FAILURE;
        }

        String saved = written.isEmpty() ? "(none)" : written.get(0).toString();
        if (report.cancelled()) {
            out.println("Crawling cancelled. Partial results saved to " + saved);
            return EXIT_CANCELLED;
        }
        out.println("Crawling complete. Results saved to " + saved);
        return EXIT_OK;
    }

    /**
     * 설정 파일(-c) → 튜닝 인자 덮어쓰기 → 시드/키워드 병합.
     * @throws StartupException 파일 오류 또는 시드/키워드 없음
     */
    static CrawlConfig resolveConfig(CliArgs cli) throws StartupException {
        CrawlConfig base = (cli.configFile() != null)
                ? CrawlConfigLoader.load(cli.configFile())
                : CrawlConfig.defaults();

        if (cli.outputDir() != null) base.setOutputDir(cli.outputDir());
        if (cli.concurrency() != null) base.setConcurrency(cli.concurrency());
        if (cli.timeoutMs() != null) base.setTimeoutMs(cli.timeoutMs());
        if (cli.visitedScope() != null) base.setVisitedScope(cli.visitedScope());
        if (cli.noValidateLinks()) base.setValidateLinks(false);
        if (cli.json()) base.setJsonReport(true);

        return ConfigMerger.merge(base, cli.seeds(), cli.keywords());
    }

    static ProgressListener consoleProgress(PrintStream out) {
        return (phase, url, visited) -> {
            if ("seed".equals(phase)) out.println("Starting crawl at: " + url);
            else out.println("Crawling: " + url);
        };
    }
}
