package com.sitescout.app.cli;

import com.sitescout.core.api.DiagnosticsSink;
import com.sitescout.core.config.InputException;
import com.sitescout.core.model.BrokenLink;
import com.sitescout.core.model.CrawlConfig;
import com.sitescout.core.model.FetchOutcome;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MainTest {

    @TempDir Path dir;

    private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();
    private final List<String> configErrors = new ArrayList<>();

    private Main main() {
        DiagnosticsSink recording = new DiagnosticsSink() {
            @Override public void fetchFailed(FetchOutcome.Failure failure, String referrer) {}
            @Override public void brokenLink(BrokenLink link) {}
            @Override public void configFailed(String source, String reason) { configErrors.add(source + ": " + reason); }
        };
        return new Main(new PrintStream(outBuf, true, StandardCharsets.UTF_8),
                new PrintStream(errBuf, true, StandardCharsets.UTF_8), recording);
    }

    private String out() { return outBuf.toString(StandardCharsets.UTF_8); }
    private String err() { return errBuf.toString(StandardCharsets.UTF_8); }

    @Nested
    @DisplayName("시작 실패")
    class Startup {

        @Test
        void noSeedsOrKeywordsExitsWithOneAndPointsToErrorsLog() {
            int code = main().run(new String[0], new AtomicBoolean());

            assertThat(code).isEqualTo(Main.EXIT_FAILURE);
            assertThat(err()).contains("Error: No base URLs or keywords provided. Check errors.log for details.");
            assertThat(configErrors).containsExactly("arguments: No base URLs or keywords provided.");
        }

        @Test
        void missingConfigFileIsTerminal() {
            Path missing = dir.resolve("missing.json");

            int code = main().run(new String[]{"-c", missing.toString(), "http://a.com", "-k", "x"}, new AtomicBoolean());

            assertThat(code).isEqualTo(Main.EXIT_FAILURE);
            assertThat(configErrors).hasSize(1);
            assertThat(configErrors.get(0)).startsWith(missing.toString());
        }

        @Test
        void usageErrorExitsWithTwo() {
            int code = main().run(new String[]{"--nope"}, new AtomicBoolean());

            assertThat(code).isEqualTo(Main.EXIT_USAGE);
            assertThat(err()).contains("Usage: sitescout").contains("Unknown option: '--nope'");
        }

        @Test
        void helpPrintsUsage() {
            assertThat(main().run(new String[]{"--help"}, new AtomicBoolean())).isEqualTo(Main.EXIT_OK);
            assertThat(out()).contains("Usage: sitescout").contains("--visited-scope");
        }
    }

    @Nested
    @DisplayName("resolveConfig")
    class Resolve {

        @Test
        void fileValuesComeFirstThenCliOverrides() throws Exception {
            Path cfgFile = dir.resolve("crawl.json");
            Files.writeString(cfgFile, "{\"base_urls\": [\"http://file.com\"], \"keywords\": [\"jobs\"], \"concurrency\": 2}");

            CrawlConfig cfg = Main.resolveConfig(CliArgs.parse(
                    "-c", cfgFile.toString(), "http://cli.com", "-k", "hiring", "--concurrency", "5", "--json"));

            assertThat(cfg.getSeeds()).containsExactly("http://file.com", "http://cli.com");
            assertThat(cfg.getKeywords()).containsExactly("jobs", "hiring");
            assertThat(cfg.getConcurrency()).isEqualTo(5);
            assertThat(cfg.isJsonReport()).isTrue();
        }

        @Test
        void keywordsOnlyIsInputError() {
            assertThatThrownBy(() -> Main.resolveConfig(CliArgs.parse("-k", "x")))
                    .isInstanceOf(InputException.class);
        }
    }

    @Nested
    @DisplayName("크롤 실행")
    class Crawl {

        private HttpServer server;
        private String origin;

        @BeforeEach
        void start() throws IOException {
            server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
            server.createContext("/", ex -> {
                String path = ex.getRequestURI().getPath();
                int code = 200;
                String body;
                if ("/".equals(path)) body = "<a href=\"/about\">About</a>";
                else if ("/about".equals(path)) body = "<p>Careers and hiring</p>";
                else { code = 404; body = "missing"; }
                byte[] b = body.getBytes(StandardCharsets.UTF_8);
                ex.sendResponseHeaders(code, b.length);
                try (OutputStream os = ex.getResponseBody()) { os.write(b); }
            });
            server.start();
            origin = "http://127.0.0.1:" + server.getAddress().getPort();
        }

        @AfterEach
        void stop() {
            server.stop(0);
        }

        @Test
        void crawlWritesCsvAndReportsCompletion() throws Exception {
            int code = main().run(new String[]{origin, "-k", "hiring,careers", "-o", dir.toString()}, new AtomicBoolean());

            assertThat(code).isEqualTo(Main.EXIT_OK);
            assertThat(out())
                    .contains("Starting crawl at: " + origin + "/")
                    .contains("Crawling: " + origin + "/about")
                    .contains("Crawling complete. Results saved to " + dir.resolve("pages_with_keywords.csv"));
            assertThat(Files.readAllLines(dir.resolve("pages_with_keywords.csv")))
                    .containsExactly("url,keywords", origin + "/about,\"hiring, careers\"");
        }

        @Test
        void cancelledRunStillWritesPartialResults() throws Exception {
            int code = main().run(new String[]{origin, "-k", "hiring", "-o", dir.toString()}, new AtomicBoolean(true));

            assertThat(code).isEqualTo(Main.EXIT_CANCELLED);
            assertThat(out()).contains("Crawling cancelled. Partial results saved to");
            assertThat(Files.readAllLines(dir.resolve("pages_with_keywords.csv"))).containsExactly("url,keywords");
        }
    }
}
