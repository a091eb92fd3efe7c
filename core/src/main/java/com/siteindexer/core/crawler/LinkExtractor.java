package com.siteindexer.core.crawler;

import org.jsoup.nodes.Document;

import java.util.List;

/** 파싱된 페이지에서 앵커 href 원문을 추출하는 전략 인터페이스. */
public interface LinkExtractor {
    /**
     * 문서 순서대로(중복 허용) 비어있지 않은 href 값 목록.
     * 해석(절대 URL화)은 호출자 몫. 파싱 예외는 호출자가 정책적으로 처리.
     */
    List<String> extract(Document doc) throws Exception;
}
