package com.siteindexer.core.store;

import com.siteindexer.core.crawler.CrawlScope;
import com.siteindexer.core.model.CrawlConfig;

import java.nio.file.Path;

/** 인덱스 출력 파일 이름 규칙 */
public final class OutputNaming {
    private OutputNaming() {}

    public static final String DEFAULT_FILE = "search_index.json";

    /** prefix 범위면 search_index_&lt;prefix 이름&gt;.json, 아니면 search_index.json */
    public static String fileName(CrawlScope scope) {
        if (scope == null || !scope.isPrefixScoped()) return DEFAULT_FILE;
        return "search_index_" + sanitize(scope.prefixName()) + ".json";
    }

    /** 설정에 파일명이 있으면 그대로, 없으면 규칙 적용. outputDir 기준으로 해석. */
    public static Path indexPath(CrawlConfig cfg, CrawlScope scope) {
        String file = cfg.getOutputFile();
        if (file == null || file.isBlank()) file = fileName(scope);
        return cfg.getOutputDir().resolve(file);
    }

    // 세그먼트에 파일명으로 못 쓰는 문자가 섞인 경우만 치환
    private static String sanitize(String s) {
        return s.replaceAll("[\\\\/:*?\"<>|]", "-");
    }
}
