package com.siteindexer.core.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 크롤 1회 실행 요약.
 *
 * @param indexedUrls     인덱싱된 URL(처리 순서)
 * @param skipped         사유별 스킵 건수
 * @param termCount       최종 인덱스의 고유 term 수
 * @param flushCount      성공한 flush 횟수(최종 flush 포함)
 * @param finalFlushOk    최종 flush 성공 여부
 * @param output          인덱스 파일 경로(싱크가 파일이 아니면 null)
 * @param elapsedMs       전체 소요 시간
 */
public record CrawlResult(List<String> indexedUrls,
                          Map<SkipReason, Integer> skipped,
                          int termCount,
                          int flushCount,
                          boolean finalFlushOk,
                          Path output,
                          long elapsedMs) {

    public CrawlResult {
        indexedUrls = List.copyOf(indexedUrls);
        Map<SkipReason, Integer> copy = new EnumMap<>(SkipReason.class);
        for (SkipReason r : SkipReason.values()) copy.put(r, skipped.getOrDefault(r, 0));
        skipped = Collections.unmodifiableMap(copy);
    }

    public int pagesIndexed() { return indexedUrls.size(); }

    public int skippedCount(SkipReason reason) { return skipped.getOrDefault(reason, 0); }
}
