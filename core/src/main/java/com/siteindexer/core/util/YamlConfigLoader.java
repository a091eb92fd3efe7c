package com.siteindexer.core.util;

import com.siteindexer.core.model.CrawlConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * siteindexer.yml을 읽어 CrawlConfig로 변환. 모든 키는 선택.
 *
 * 예상 YAML 키:
 * seed: "https://example.com/docs/index.html"
 * flushEvery: 50
 * timeoutMs: 10000
 * concurrency: 1
 * followRedirects: true
 * userAgent: "SiteIndexer/0.1"
 * maxPages: 0
 * scope:
 *   prefixMode: false
 * output:
 *   dir: "."
 *   file: "search_index.json"
 *   pretty: false
 *
 * seed 필수 여부는 CLI 인자와 합친 뒤 호출자가 validate()로 확인한다.
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "siteindexer.yml";

    private YamlConfigLoader() {}

    /** 작업 디렉터리의 siteindexer.yml. 없으면 기본값. */
    public static CrawlConfig loadDefault() throws IOException {
        Path p = Path.of(DEFAULT_FILE);
        return Files.exists(p) ? load(p) : CrawlConfig.defaults();
    }

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("config not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object root = yaml.load(in);
            return fromMap(root);
        } catch (YAMLException | IllegalArgumentException e) {
            throw new IOException("invalid config " + yamlPath + ": " + e.getMessage(), e);
        }
    }

    static CrawlConfig fromMap(Object root) {
        CrawlConfig cfg = CrawlConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            return cfg;
        }

        // 1) 평면 키
        setString(map, "seed", cfg::setSeed);
        setInt(map, "flushEvery", cfg::setFlushEvery);
        setLong(map, "timeoutMs", ms -> { if (ms > 0) cfg.setTimeoutMs(ms); });
        setInt(map, "concurrency", cfg::setConcurrency);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setString(map, "userAgent", cfg::setUserAgent);
        setInt(map, "maxPages", cfg::setMaxPages);

        // 2) scope.*
        Map<?, ?> scope = getMap(map, "scope");
        if (scope != null) {
            setBoolean(scope, "prefixMode", cfg::setPrefixMode);
        }

        // 3) output.*
        Map<?, ?> output = getMap(map, "output");
        if (output != null) {
            setString(output, "dir", s -> cfg.setOutputDir(Path.of(s)));
            setString(output, "file", cfg::setOutputFile);
            setBoolean(output, "pretty", cfg::setPrettyJson);
        }
        return cfg;
    }

    // ------------ helpers ------------
    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        return (v instanceof Map<?, ?> m) ? m : null;
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

    private static void setLong(Map<?, ?> map, String key, Consumer<Long> setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }
}
