package com.siteindexer.core.crawler;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * body 시작과 body 종료 사이의 보이는 텍스트만 추출.
 * 노드 순회(head=시작 태그, tail=종료 태그)를 이벤트 스트림처럼 쓰고
 * inBody / suppressed 두 플래그로 script·style·head 내용을 걸러낸다.
 * 문서는 {@link HtmlStreamParser}로 파싱한 것이어야 순서가 원문 태그 스트림과 같다.
 * body 태그가 없는 문서는 빈 텍스트, body 종료 뒤 텍스트는 버린다.
 */
public class VisibleTextExtractor {

    private static final Set<String> SUPPRESSED_TAGS = Set.of("script", "style", "head");

    public String extract(Document doc) {
        if (doc == null) return "";
        Visitor v = new Visitor();
        NodeTraversor.traverse(v, doc);
        return String.join(" ", v.chunks);
    }

    private static final class Visitor implements NodeVisitor {
        private boolean inBody;
        private boolean suppressed;
        private final List<String> chunks = new ArrayList<>();

        @Override
        public void head(Node node, int depth) {
            if (node instanceof Element el) {
                String tag = tagOf(el);
                if (tag.equals("body")) {
                    inBody = true;
                } else if (inBody && SUPPRESSED_TAGS.contains(tag)) {
                    suppressed = true;
                }
            } else if (node instanceof TextNode tn) {
                if (inBody && !suppressed) chunks.add(tn.getWholeText());
            }
        }

        @Override
        public void tail(Node node, int depth) {
            if (!(node instanceof Element el)) return;
            String tag = tagOf(el);
            if (tag.equals("body")) {
                inBody = false;
            } else if (SUPPRESSED_TAGS.contains(tag)) {
                suppressed = false;
            }
        }

        // normalName()은 소문자 태그명
        private static String tagOf(Element el) {
            return el.normalName();
        }
    }
}
