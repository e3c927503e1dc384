package com.sitescout.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitescout.core.model.CrawlConfig;
import com.sitescout.core.model.CrawlConfig.VisitedScope;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * 설정 파일을 읽어 CrawlConfig로 변환. 확장자가 .yml/.yaml 이면 YAML, 그 외는 JSON.
 *
 * 예상 키(JSON 기준):
 * <pre>
 * {
 *   "base_urls": ["https://example.com"],     // 별칭: "seeds"
 *   "keywords": ["hiring", "careers"],        // 리스트 또는 "a,b" 문자열
 *   "timeoutMs": 10000,
 *   "concurrency": 1,
 *   "visitedScope": "RUN",                    // RUN | SEED
 *   "validateLinks": true,
 *   "userAgent": "...",
 *   "output": { "dir": ".", "json": false }
 * }
 * </pre>
 */
public final class CrawlConfigLoader {

    private static final ObjectMapper JSON = new ObjectMapper();

    private CrawlConfigLoader() {}

    public static CrawlConfig load(Path path) throws ConfigException {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new ConfigException(path, "config file not found: " + path.toAbsolutePath());
        }

        Object root = isYaml(path) ? readYaml(path) : readJson(path);
        CrawlConfig cfg = CrawlConfig.defaults();
        if (root == null) {
            return cfg; // 빈 파일: 기본값 유지
        }
        if (!(root instanceof Map<?, ?> map)) {
            throw new ConfigException(path, "config root must be an object/mapping");
        }

        try {
            // 1) 입력
            Object seeds = map.containsKey("base_urls") ? map.get("base_urls") : map.get("seeds");
            cfg.addSeeds(toStringList(seeds));
            cfg.addKeywords(toStringList(map.get("keywords")));

            // 2) 튜닝
            setLong(map, "timeoutMs", cfg::setTimeoutMs);
            setInt(map, "concurrency", cfg::setConcurrency);
            setBoolean(map, "validateLinks", cfg::setValidateLinks);
            setString(map, "userAgent", cfg::setUserAgent);
            setString(map, "visitedScope", s -> cfg.setVisitedScope(VisitedScope.valueOf(s.trim().toUpperCase(Locale.ROOT))));

            // 3) output.dir / output.json
            Map<?, ?> output = getMap(map, "output");
            if (output != null) {
                setString(output, "dir", s -> cfg.setOutputDir(Path.of(s)));
                setBoolean(output, "json", cfg::setJsonReport);
            }
        } catch (IllegalArgumentException e) {
            // NumberFormatException 포함: 잘못된 값 타입
            throw new ConfigException(path, "invalid config value: " + e.getMessage(), e);
        }
        return cfg;
    }

    static boolean isYaml(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yml") || name.endsWith(".yaml");
    }

    private static Object readJson(Path path) throws ConfigException {
        try {
            if (Files.size(path) == 0) return null;
            return JSON.readValue(path.toFile(), Object.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException(path, "malformed JSON config: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigException(path, "cannot read config file: " + e.getMessage(), e);
        }
    }

    private static Object readYaml(Path path) throws ConfigException {
        try (InputStream in = Files.newInputStream(path)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            return yaml.load(in);
        } catch (YAMLException e) {
            throw new ConfigException(path, "malformed YAML config: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigException(path, "cannot read config file: " + e.getMessage(), e);
        }
    }

    // ------------ helpers ------------
    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        return (v instanceof Map<?, ?> m) ? m : null;
    }

    /** 리스트 또는 "a,b,c" 문자열 허용 */
    static List<String> toStringList(Object v) {
        List<String> out = new ArrayList<>();
        if (v == null) return out;
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
            return out;
        }
        return ConfigMerger.splitKeywords(String.valueOf(v));
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }
}
