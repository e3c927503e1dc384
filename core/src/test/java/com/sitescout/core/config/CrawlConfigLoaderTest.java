package com.sitescout.core.config;

import com.sitescout.core.model.CrawlConfig;
import com.sitescout.core.model.CrawlConfig.VisitedScope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlConfigLoaderTest {

    @TempDir Path dir;

    private Path write(String name, String content) throws Exception {
        Path p = dir.resolve(name);
        Files.writeString(p, content);
        return p;
    }

    @Nested
    @DisplayName("JSON")
    class Json {

        @Test
        void readsBaseUrlsAndKeywords() throws Exception {
            Path p = write("config.json",
                    "{\"base_urls\": [\"http://a.com\", \"http://b.com\"], \"keywords\": [\"hiring\", \" careers \"]}");

            CrawlConfig cfg = CrawlConfigLoader.load(p);

            assertThat(cfg.getSeeds()).containsExactly("http://a.com", "http://b.com");
            assertThat(cfg.getKeywords()).containsExactly("hiring", "careers");
            assertThat(cfg.getConcurrency()).isEqualTo(1);
            assertThat(cfg.isValidateLinks()).isTrue();
        }

        @Test
        void readsTuningAndOutputKeys() throws Exception {
            Path p = write("config.json", "{"
                    + "\"seeds\": \"http://a.com\","
                    + "\"keywords\": \"x, y\","
                    + "\"timeoutMs\": 2500,"
                    + "\"concurrency\": \"3\","
                    + "\"visitedScope\": \"seed\","
                    + "\"validateLinks\": false,"
                    + "\"userAgent\": \"probe/1.0\","
                    + "\"output\": {\"dir\": \"reports\", \"json\": true}"
                    + "}");

            CrawlConfig cfg = CrawlConfigLoader.load(p);

            assertThat(cfg.getSeeds()).containsExactly("http://a.com");
            assertThat(cfg.getKeywords()).containsExactly("x", "y");
            assertThat(cfg.getTimeoutMs()).isEqualTo(2500);
            assertThat(cfg.getConcurrency()).isEqualTo(3);
            assertThat(cfg.getVisitedScope()).isEqualTo(VisitedScope.SEED);
            assertThat(cfg.isValidateLinks()).isFalse();
            assertThat(cfg.getUserAgent()).isEqualTo("probe/1.0");
            assertThat(cfg.getOutputDir()).isEqualTo(Path.of("reports"));
            assertThat(cfg.isJsonReport()).isTrue();
        }

        @Test
        void emptyFileKeepsDefaults() throws Exception {
            CrawlConfig cfg = CrawlConfigLoader.load(write("empty.json", ""));

            assertThat(cfg.getSeeds()).isEmpty();
            assertThat(cfg.getKeywords()).isEmpty();
        }

        @Test
        void malformedJsonIsConfigException() throws Exception {
            Path p = write("bad.json", "{\"base_urls\": [");

            assertThatThrownBy(() -> CrawlConfigLoader.load(p))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("malformed JSON")
                    .satisfies(e -> assertThat(((ConfigException) e).getSource()).isEqualTo(p));
        }

        @Test
        void nonObjectRootIsConfigException() throws Exception {
            Path p = write("list.json", "[\"http://a.com\"]");

            assertThatThrownBy(() -> CrawlConfigLoader.load(p)).isInstanceOf(ConfigException.class);
        }
    }

    @Nested
    @DisplayName("YAML")
    class Yaml {

        @Test
        void readsYamlByExtension() throws Exception {
            Path p = write("crawl.yml", String.join("\n",
                    "base_urls:",
                    "  - http://a.com",
                    "keywords: [hiring, careers]",
                    "concurrency: 2",
                    "output:",
                    "  dir: out",
                    ""));

            CrawlConfig cfg = CrawlConfigLoader.load(p);

            assertThat(cfg.getSeeds()).containsExactly("http://a.com");
            assertThat(cfg.getKeywords()).containsExactly("hiring", "careers");
            assertThat(cfg.getConcurrency()).isEqualTo(2);
            assertThat(cfg.getOutputDir()).isEqualTo(Path.of("out"));
        }

        @Test
        void malformedYamlIsConfigException() throws Exception {
            Path p = write("bad.yaml", "base_urls: [http://a.com\nkeywords: : :\n");

            assertThatThrownBy(() -> CrawlConfigLoader.load(p))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("malformed YAML");
        }

        @Test
        void unsafeTagsAreRejected() throws Exception {
            Path p = write("evil.yml", "base_urls: !!javax.script.ScriptEngineManager [x]\n");

            assertThatThrownBy(() -> CrawlConfigLoader.load(p)).isInstanceOf(ConfigException.class);
        }
    }

    @Test
    void missingFileIsConfigException() {
        Path p = dir.resolve("nope.json");

        assertThatThrownBy(() -> CrawlConfigLoader.load(p))
                .isInstanceOf(ConfigException.class)
                .isInstanceOf(StartupException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void badValuesAreConfigException() throws Exception {
        Path p1 = write("c1.json", "{\"concurrency\": \"many\"}");
        Path p2 = write("c2.json", "{\"visitedScope\": \"GLOBAL\"}");

        assertThatThrownBy(() -> CrawlConfigLoader.load(p1))
                .isInstanceOf(ConfigException.class).hasMessageContaining("invalid config value");
        assertThatThrownBy(() -> CrawlConfigLoader.load(p2))
                .isInstanceOf(ConfigException.class).hasMessageContaining("invalid config value");
    }
}
