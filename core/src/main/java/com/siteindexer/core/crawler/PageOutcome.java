package com.siteindexer.core.crawler;

import com.siteindexer.core.model.SkipReason;

import java.util.List;

/**
 * fetch 워커 → 인덱싱 스레드로 넘기는 페이지 처리 결과.
 * skip == null 이면 색인 대상(tokens/links 유효).
 */
record PageOutcome(String url, SkipReason skip, String detail, List<String> tokens, List<String> links) {

    static PageOutcome indexed(String url, List<String> tokens, List<String> links) {
        return new PageOutcome(url, null, null, List.copyOf(tokens), List.copyOf(links));
    }

    static PageOutcome skipped(String url, SkipReason reason, String detail) {
        return new PageOutcome(url, reason, detail, List.of(), List.of());
    }

    boolean isIndexed() { return skip == null; }
}
