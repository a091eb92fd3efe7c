package com.siteindexer.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * 크롤 설정 (siteindexer.yml / CLI 매핑 대상). 순수 설정 보관용.
 * 실행 중에는 변경하지 않는다.
 */
public final class CrawlConfig {

    public static final int DEFAULT_FLUSH_EVERY = 50;
    public static final String DEFAULT_USER_AGENT = "SiteIndexer/0.1 (+crawler)";

    // ---------- 기본 필드 ----------
    private String seed;                 // 시작 URL (필수)
    private boolean prefixMode = false;  // seed 디렉터리 하위로 범위 제한
    private int flushEvery = DEFAULT_FLUSH_EVERY;
    private Duration timeout = Duration.ofSeconds(10); // 요청 타임아웃
    private int concurrency = 1;         // fetch 워커 수 (1이면 순차 BFS)
    private boolean followRedirects = true;
    private String userAgent = DEFAULT_USER_AGENT;
    private int maxPages = 0;            // 0 = 무제한

    // ---------- 출력 ----------
    private Path outputDir = Path.of(".");
    private String outputFile;           // null이면 OutputNaming 규칙으로 결정
    private Boolean prettyJson;          // null이면 prefixMode 따라감

    // ---------- getters ----------
    public String getSeed() { return seed; }
    public boolean isPrefixMode() { return prefixMode; }
    public int getFlushEvery() { return flushEvery; }
    public Duration getTimeout() { return timeout; }
    public int getConcurrency() { return concurrency; }
    public boolean isFollowRedirects() { return followRedirects; }
    public String getUserAgent() { return userAgent; }
    public int getMaxPages() { return maxPages; }
    public Path getOutputDir() { return outputDir; }
    public String getOutputFile() { return outputFile; }

    /** 명시값 우선, 없으면 prefix 모드일 때만 pretty */
    public boolean isPrettyJson() { return prettyJson != null ? prettyJson : prefixMode; }

    // ---------- fluent setters ----------
    public CrawlConfig setSeed(String seed) { this.seed = seed; return this; }
    public CrawlConfig setPrefixMode(boolean v) { this.prefixMode = v; return this; }
    public CrawlConfig setFlushEvery(int flushEvery) { this.flushEvery = flushEvery; return this; }
    public CrawlConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CrawlConfig setConcurrency(int concurrency) { this.concurrency = Math.max(1, concurrency); return this; }
    public CrawlConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public CrawlConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public CrawlConfig setMaxPages(int maxPages) { this.maxPages = maxPages; return this; }
    public CrawlConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public CrawlConfig setOutputFile(String outputFile) { this.outputFile = outputFile; return this; }
    public CrawlConfig setPrettyJson(Boolean prettyJson) { this.prettyJson = prettyJson; return this; }

    public CrawlConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    public long getTimeoutMs() { return timeout.toMillis(); }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(seed, "seed");
        if (seed.isBlank()) throw new IllegalArgumentException("seed must not be blank");
        if (flushEvery < 1) throw new IllegalArgumentException("flushEvery must be >= 1");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (maxPages < 0) throw new IllegalArgumentException("maxPages must be >= 0");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        Objects.requireNonNull(outputDir, "outputDir");
        if (userAgent == null || userAgent.isBlank()) userAgent = DEFAULT_USER_AGENT;
    }

    public static CrawlConfig defaults() { return new CrawlConfig(); }
}
