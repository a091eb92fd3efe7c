package com.siteindexer.core.crawler;

import com.siteindexer.core.util.UrlUtils;

import java.util.Objects;
import java.util.Optional;

/**
 * 크롤 범위: 도메인(authority 정확 일치) + 선택적 prefix 디렉터리.
 * seed에서 한 번만 도출하고 실행 중 바뀌지 않는다.
 */
public final class CrawlScope {

    private final String domain;
    private final String prefixDir; // null이면 prefix 제한 없음

    private CrawlScope(String domain, String prefixDir) {
        this.domain = Objects.requireNonNull(domain, "domain");
        this.prefixDir = prefixDir;
    }

    public static CrawlScope of(String domain, String prefixDir) {
        return new CrawlScope(domain, prefixDir);
    }

    /**
     * seed URL에서 범위 도출.
     * @param prefixMode true면 seed의 디렉터리를 prefix로 사용
     * @throws IllegalArgumentException 절대 URL이 아니거나 host가 없을 때
     */
    public static CrawlScope fromSeed(String seed, boolean prefixMode) {
        if (seed == null || !UrlUtils.isAbsolute(seed)) {
            throw new IllegalArgumentException("seed must be an absolute URL: " + seed);
        }
        String domain = UrlUtils.authority(seed);
        if (domain.isEmpty()) {
            throw new IllegalArgumentException("seed has no host: " + seed);
        }
        return new CrawlScope(domain, prefixMode ? prefixDirOf(UrlUtils.path(seed)) : null);
    }

    /**
     * "/html/sp/sp50.html" → "/html/sp/", "/html/sp/" → 그대로, "" → "/"
     */
    public static String prefixDirOf(String path) {
        if (path == null || path.isEmpty()) return "/";
        if (path.endsWith("/")) return path;
        return path.substring(0, path.lastIndexOf('/') + 1);
    }

    public String domain() { return domain; }

    public Optional<String> prefixDir() { return Optional.ofNullable(prefixDir); }

    public boolean isPrefixScoped() { return prefixDir != null; }

    /** prefix 마지막 세그먼트 이름. prefix가 없거나 "/"면 "root" */
    public String prefixName() {
        if (prefixDir == null) return "root";
        String trimmed = prefixDir.replaceAll("^/+|/+$", "");
        if (trimmed.isEmpty()) return "root";
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }

    @Override public String toString() {
        return domain + (prefixDir == null ? "" : prefixDir);
    }
}
