package com.siteindexer.core.crawler;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/** 기본 JSoup 기반 링크 추출기: a[href] → href 원문 수집 */
public class JsoupLinkExtractor implements LinkExtractor {

    @Override
    public List<String> extract(Document doc) {
        List<String> out = new ArrayList<>();
        if (doc == null) return out;

        // 속성명은 파서가 소문자로 정규화, 중복 속성은 첫 번째만 남는다
        for (Element a : doc.select("a[href]")) {
            String href = a.attr("href");
            if (href.isEmpty()) continue;
            out.add(href);
        }
        return out;
    }
}
