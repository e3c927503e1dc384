package com.sitescout.core.model;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;

class CrawlConfigTest {

    private static CrawlConfig valid() {
        return CrawlConfig.defaults()
                .addSeeds(List.of("http://example.com"))
                .addKeywords(List.of("hiring"));
    }

    @Test
    void defaultsAreValid() {
        CrawlConfig cfg = valid();
        cfg.validate();

        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(cfg.getTimeoutMs()).isEqualTo(10_000L);
        assertThat(cfg.getConcurrency()).isEqualTo(1);
        assertThat(cfg.getVisitedScope()).isEqualTo(CrawlConfig.VisitedScope.RUN);
        assertThat(cfg.isValidateLinks()).isTrue();
        assertThat(cfg.getUserAgent()).contains("Chrome/91.0.4472.124");
        assertThat(cfg.getOutputDir()).isEqualTo(Path.of("."));
        assertThat(cfg.isJsonReport()).isFalse();
    }

    @Test
    void setTimeoutMsClampsToPositive() {
        CrawlConfig cfg = valid().setTimeoutMs(0);
        assertThat(cfg.getTimeoutMs()).isEqualTo(1L);

        cfg.setTimeoutMs(-5);
        assertThat(cfg.getTimeoutMs()).isEqualTo(1L);
        cfg.validate();
    }

    @Test
    void setConcurrencyHasLowerBoundOne() {
        CrawlConfig cfg = valid().setConcurrency(0);

        assertThat(cfg.getConcurrency()).isEqualTo(1);
        cfg.validate();
    }

    @Test
    void addSkipsBlankAndTrims() {
        CrawlConfig cfg = CrawlConfig.defaults()
                .addSeeds(List.of(" http://a.com ", ""))
                .addKeywords(List.of("  ", " x "));

        assertThat(cfg.getSeeds()).containsExactly("http://a.com");
        assertThat(cfg.getKeywords()).containsExactly("x");
    }

    @Test
    void validateRequiresSeedsAndKeywords() {
        assertThatThrownBy(() -> CrawlConfig.defaults().addKeywords(List.of("x")).validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("seeds");
        assertThatThrownBy(() -> CrawlConfig.defaults().addSeeds(List.of("http://a.com")).validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("keywords");
    }

    @Test
    void nullsFallBackToDefaults() {
        CrawlConfig cfg = valid().setVisitedScope(null).setUserAgent(" ");

        assertThat(cfg.getVisitedScope()).isEqualTo(CrawlConfig.VisitedScope.RUN);
        assertThat(cfg.getUserAgent()).isEqualTo(CrawlConfig.DEFAULT_USER_AGENT);

        assertThatThrownBy(() -> valid().setOutputDir(null).validate())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void pageResultRequiresKeywords() {
        assertThatThrownBy(() -> new PageResult("http://a.com", List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
