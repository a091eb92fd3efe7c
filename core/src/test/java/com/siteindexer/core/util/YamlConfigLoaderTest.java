package com.siteindexer.core.util;

import com.siteindexer.core.model.CrawlConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigLoaderTest {

    @TempDir Path tmp;

    @Test
    @DisplayName("평면 키 + scope/output 섹션 매핑")
    void loadsAllSections() throws Exception {
        Path yml = tmp.resolve("siteindexer.yml");
        Files.writeString(yml, String.join("\n",
                "seed: https://ex.com/docs/index.html",
                "flushEvery: 10",
                "timeoutMs: 2500",
                "concurrency: 4",
                "followRedirects: false",
                "userAgent: TestBot/1.0",
                "maxPages: 100",
                "scope:",
                "  prefixMode: true",
                "output:",
                "  dir: out",
                "  file: docs.json",
                "  pretty: false",
                ""), StandardCharsets.UTF_8);

        CrawlConfig cfg = YamlConfigLoader.load(yml);

        assertThat(cfg.getSeed()).isEqualTo("https://ex.com/docs/index.html");
        assertThat(cfg.getFlushEvery()).isEqualTo(10);
        assertThat(cfg.getTimeoutMs()).isEqualTo(2500);
        assertThat(cfg.getConcurrency()).isEqualTo(4);
        assertThat(cfg.isFollowRedirects()).isFalse();
        assertThat(cfg.getUserAgent()).isEqualTo("TestBot/1.0");
        assertThat(cfg.getMaxPages()).isEqualTo(100);
        assertThat(cfg.isPrefixMode()).isTrue();
        assertThat(cfg.getOutputDir()).isEqualTo(Path.of("out"));
        assertThat(cfg.getOutputFile()).isEqualTo("docs.json");
        assertThat(cfg.isPrettyJson()).isFalse(); // 명시값이 prefix 기본을 이김
    }

    @Test
    @DisplayName("빈 파일은 기본값")
    void emptyFileGivesDefaults() throws Exception {
        Path yml = tmp.resolve("empty.yml");
        Files.writeString(yml, "");

        CrawlConfig cfg = YamlConfigLoader.load(yml);
        assertThat(cfg.getFlushEvery()).isEqualTo(CrawlConfig.DEFAULT_FLUSH_EVERY);
        assertThat(cfg.getTimeoutMs()).isEqualTo(10_000);
        assertThat(cfg.getConcurrency()).isEqualTo(1);
        assertThat(cfg.isPrettyJson()).isFalse();
    }

    @Test
    void missingFileIsIOException() {
        assertThatThrownBy(() -> YamlConfigLoader.load(tmp.resolve("nope.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("config not found");
    }

    @Test
    @DisplayName("숫자 자리에 문자열, 깨진 YAML은 IOException")
    void invalidContent() throws Exception {
        Path bad = tmp.resolve("bad.yml");
        Files.writeString(bad, "flushEvery: lots\n");
        assertThatThrownBy(() -> YamlConfigLoader.load(bad)).isInstanceOf(IOException.class);

        Path broken = tmp.resolve("broken.yml");
        Files.writeString(broken, "scope: [unclosed\n");
        assertThatThrownBy(() -> YamlConfigLoader.load(broken)).isInstanceOf(IOException.class);
    }
}
