package com.siteindexer.core.model;

/** 크롤 루프 상태. RUNNING → DRAINING(큐 소진, 최종 flush 중) → DONE */
public enum CrawlState {
    IDLE,
    RUNNING,
    DRAINING,
    DONE
}
