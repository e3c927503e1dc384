package com.sitescout.core.service.export;

import com.sitescout.core.api.ResultSink;
import com.sitescout.core.model.CrawlReport;
import com.sitescout.core.model.PageResult;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * 키워드가 발견된 페이지 목록 CSV.
 * <pre>
 * url,keywords
 * https://example.com/about,"hiring, careers"
 * </pre>
 * - 매 실행마다 덮어쓴다(추가 아님)
 * - 행 순서 = 결과 발견 순서
 * - 쉼표/따옴표/개행이 있는 필드만 따옴표로 감싼다
 */
public final class CsvResultSink implements ResultSink {

    public static final String FILE_NAME = "pages_with_keywords.csv";
    static final String HEADER = "url,keywords";
    static final String KEYWORD_SEPARATOR = ", ";

    private final Path outputDir;

    public CsvResultSink(Path outputDir) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
    }

    @Override
    public Path write(CrawlReport report) throws IOException {
        Files.createDirectories(outputDir);
        Path out = outputDir.resolve(FILE_NAME);

        try (BufferedWriter w = Files.newBufferedWriter(out, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            w.write(HEADER);
            w.write("\r\n");
            for (PageResult p : report.pages()) {
                w.write(field(p.url()));
                w.write(',');
                w.write(field(String.join(KEYWORD_SEPARATOR, p.keywords())));
                w.write("\r\n");
            }
        }
        return out;
    }

    static String field(String v) {
        if (v == null) return "";
        boolean quote = v.indexOf(',') >= 0 || v.indexOf('"') >= 0
                || v.indexOf('\n') >= 0 || v.indexOf('\r') >= 0;
        if (!quote) return v;
        return '"' + v.replace("\"", "\"\"") + '"';
    }
}
