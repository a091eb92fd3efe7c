// IPageFetcher.java
package com.siteindexer.core.api;

import com.siteindexer.core.model.FetchedPage;

/**
 * fetch 최소 계약: URL을 받아 응답 모델을 돌려준다.
 * 전송 실패는 예외 대신 status -1 + error로 표현한다.
 */
public interface IPageFetcher extends AutoCloseable {
    FetchedPage fetch(String url);
    @Override default void close() throws Exception {}
}
