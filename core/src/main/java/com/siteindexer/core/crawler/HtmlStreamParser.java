package com.siteindexer.core.crawler;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.ParseSettings;
import org.jsoup.parser.Parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 태그가 나온 순서 그대로 트리를 만드는 파서.
 * HTML5 트리 빌더와 달리 body/head를 만들어 넣거나 body 밖 텍스트를 body 안으로 옮기지 않는다.
 * 노드 순회(head=시작 태그, tail=종료 태그)가 원문 태그 스트림과 같은 순서가 된다.
 * <ul>
 *   <li>태그/속성명은 소문자로 정규화, 중복 속성은 첫 번째만</li>
 *   <li>짝 없는 종료 태그는 무시, 조상 종료 태그는 사이의 열린 요소를 함께 닫음</li>
 *   <li>script/style 내용은 raw text: 내용을 비우고 태그만 남긴다(어차피 색인되지 않음)</li>
 * </ul>
 */
public final class HtmlStreamParser {
    private HtmlStreamParser() {}

    // 자기 닫힘(<script .../>)은 raw text 구간을 열지 않는다
    private static final Pattern RAW_TEXT = Pattern.compile(
            "(<(script|style)\\b[^>]*(?<!/)>)(.*?)(</\\2\\s*>)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    /** Parser 인스턴스는 상태를 가지므로 호출마다 새로 만든다(워커 스레드 동시 호출). */
    public static Document parse(String html, String baseUri) {
        Parser parser = Parser.xmlParser().settings(ParseSettings.htmlDefault);
        return Jsoup.parse(stripRawText(html == null ? "" : html), baseUri == null ? "" : baseUri, parser);
    }

    static String stripRawText(String html) {
        Matcher m = RAW_TEXT.matcher(html);
        if (!m.find()) return html;
        StringBuilder sb = new StringBuilder(html.length());
        do {
            m.appendReplacement(sb, "");
            sb.append(m.group(1)).append(m.group(4));
        } while (m.find());
        m.appendTail(sb);
        return sb.toString();
    }
}
