// ICrawler.java
package com.siteindexer.core.api;

import com.siteindexer.core.model.CrawlResult;

/** 크롤러 최소 계약: seed부터 끝까지 크롤+인덱싱하고 요약을 돌려준다. */
public interface ICrawler extends AutoCloseable {
    CrawlResult crawl();
    @Override default void close() throws Exception {}
}
