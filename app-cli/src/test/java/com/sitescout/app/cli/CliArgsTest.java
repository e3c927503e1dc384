package com.sitescout.app.cli;

import com.sitescout.core.model.CrawlConfig.VisitedScope;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CliArgsTest {

    @Test
    void positionalSeedsAndCommaSeparatedKeywords() throws Exception {
        CliArgs a = CliArgs.parse("http://a.com", "-k", "hiring, careers", "http://b.com");

        assertThat(a.seeds()).containsExactly("http://a.com", "http://b.com");
        assertThat(a.keywords()).containsExactly("hiring", "careers");
        assertThat(a.configFile()).isNull();
        assertThat(a.concurrency()).isNull();
        assertThat(a.noValidateLinks()).isFalse();
    }

    @Test
    void allOptions() throws Exception {
        CliArgs a = CliArgs.parse(
                "--config", "crawl.yml",
                "-o", "reports",
                "--concurrency", "4",
                "--timeout-ms", "1500",
                "--visited-scope", "seed",
                "--no-validate-links",
                "--json",
                "--keywords", "x");

        assertThat(a.configFile()).isEqualTo(Path.of("crawl.yml"));
        assertThat(a.outputDir()).isEqualTo(Path.of("reports"));
        assertThat(a.concurrency()).isEqualTo(4);
        assertThat(a.timeoutMs()).isEqualTo(1500L);
        assertThat(a.visitedScope()).isEqualTo(VisitedScope.SEED);
        assertThat(a.noValidateLinks()).isTrue();
        assertThat(a.json()).isTrue();
        assertThat(a.keywords()).containsExactly("x");
    }

    @Test
    void repeatedKeywordFlagsAccumulate() throws Exception {
        CliArgs a = CliArgs.parse("-k", "a", "-k", "b,c");

        assertThat(a.keywords()).containsExactly("a", "b", "c");
    }

    @Test
    void doubleDashEndsOptions() throws Exception {
        CliArgs a = CliArgs.parse("--", "-weird-seed");

        assertThat(a.seeds()).containsExactly("-weird-seed");
    }

    @Test
    void usageErrors() {
        assertThatThrownBy(() -> CliArgs.parse("-k"))
                .isInstanceOf(CliArgs.UsageException.class)
                .hasMessageContaining("Missing required parameter");
        assertThatThrownBy(() -> CliArgs.parse("--bogus"))
                .isInstanceOf(CliArgs.UsageException.class)
                .hasMessageContaining("Unknown option");
        assertThatThrownBy(() -> CliArgs.parse("--concurrency", "zero"))
                .isInstanceOf(CliArgs.UsageException.class);
        assertThatThrownBy(() -> CliArgs.parse("--concurrency", "0"))
                .isInstanceOf(CliArgs.UsageException.class)
                .hasMessageContaining("--concurrency");
        assertThatThrownBy(() -> CliArgs.parse("--timeout-ms", "0"))
                .isInstanceOf(CliArgs.UsageException.class)
                .hasMessageContaining("--timeout-ms");
        assertThatThrownBy(() -> CliArgs.parse("--visited-scope", "global"))
                .isInstanceOf(CliArgs.UsageException.class)
                .hasMessageContaining("RUN, SEED");
    }

    @Test
    void help() throws Exception {
        assertThat(CliArgs.parse("-h").help()).isTrue();
        assertThat(CliArgs.parse("-h").seeds()).isEmpty();
        assertThat(CliArgs.usage())
                .startsWith("Usage: sitescout")
                .contains("--keywords")
                .contains("--config")
                .contains("base_urls");
    }
}
