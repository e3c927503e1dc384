package com.sitescout.app.cli;

import com.sitescout.core.config.ConfigMerger;
import com.sitescout.core.model.CrawlConfig.VisitedScope;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 명령행 인자(picocli).
 * 지정되지 않은 튜닝 값은 null(= 파일/기본값 유지).
 */
@Command(name = "sitescout",
        description = "Crawl websites and list pages containing specific keywords.",
        sortOptions = false)
public final class CliArgs {

    /** 잘못된 인자(종료 코드 2) */
    public static final class UsageException extends Exception {
        public UsageException(String message) { super(message); }
    }

    @Parameters(paramLabel = "base_urls", arity = "0..*",
            description = "Base URLs to start crawling from.")
    private List<String> seeds = new ArrayList<>();

    @Option(names = {"-k", "--keywords"}, paramLabel = "KEYWORDS",
            description = "Comma-separated list of keywords to search for. Repeatable.")
    private List<String> rawKeywords = new ArrayList<>();

    @Option(names = {"-c", "--config"}, paramLabel = "CONFIG",
            description = "Path to a JSON or YAML config file with base URLs and keywords.")
    private Path configFile;

    @Option(names = {"-o", "--out"}, paramLabel = "DIR",
            description = "Output directory (default: current directory).")
    private Path outputDir;

    @Option(names = "--concurrency", paramLabel = "N",
            description = "Pages fetched at once (default: 1, sequential).")
    private Integer concurrency;

    @Option(names = "--timeout-ms", paramLabel = "MS",
            description = "Per-request timeout in milliseconds (default: 10000).")
    private Long timeoutMs;

    @Option(names = "--visited-scope", paramLabel = "SCOPE",
            description = "RUN (shared across base URLs, default) or SEED.")
    private VisitedScope visitedScope;

    @Option(names = "--no-validate-links",
            description = "Do not fetch discovered links before queueing them.")
    private boolean noValidateLinks;

    @Option(names = "--json", description = "Also write crawl-report.json.")
    private boolean json;

    @Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help and exit.")
    private boolean help;

    private CliArgs() {}

    public static CliArgs parse(String... args) throws UsageException {
        CliArgs a = new CliArgs();
        try {
            commandLine(a).parseArgs(args);
        } catch (CommandLine.ParameterException e) {
            throw new UsageException(e.getMessage());
        }
        if (a.concurrency != null && a.concurrency < 1) {
            throw new UsageException("Invalid value for option '--concurrency': must be >= 1 but was " + a.concurrency);
        }
        if (a.timeoutMs != null && a.timeoutMs < 1) {
            throw new UsageException("Invalid value for option '--timeout-ms': must be >= 1 but was " + a.timeoutMs);
        }
        return a;
    }

    /** picocli가 만든 도움말 텍스트 */
    public static String usage() {
        return commandLine(new CliArgs()).getUsageMessage(CommandLine.Help.Ansi.OFF);
    }

    private static CommandLine commandLine(CliArgs target) {
        return new CommandLine(target).setCaseInsensitiveEnumValuesAllowed(true);
    }

    public List<String> seeds() { return Collections.unmodifiableList(seeds); }

    /** -k 값마다 쉼표 분리 + trim, 빈 항목 제거 */
    public List<String> keywords() {
        List<String> out = new ArrayList<>();
        for (String raw : rawKeywords) out.addAll(ConfigMerger.splitKeywords(raw));
        return Collections.unmodifiableList(out);
    }

    public Path configFile() { return configFile; }
    public Path outputDir() { return outputDir; }
    public Integer concurrency() { return concurrency; }
    public Long timeoutMs() { return timeoutMs; }
    public VisitedScope visitedScope() { return visitedScope; }
    public boolean noValidateLinks() { return noValidateLinks; }
    public boolean json() { return json; }
    public boolean help() { return help; }
}
