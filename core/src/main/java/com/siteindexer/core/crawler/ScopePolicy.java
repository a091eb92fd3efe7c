package com.siteindexer.core.crawler;

import com.siteindexer.core.util.UrlUtils;

import java.util.Objects;
import java.util.Set;

/**
 * fetch 대상 판정(순수 함수). 이미 절대 URL로 해석된 값만 받는다.
 * <ul>
 *   <li>HTML 추정: 확장자가 없음/.html/.htm 이거나 '/'로 끝나는 경로</li>
 *   <li>도메인: authority 정확 일치(서브도메인 불허)</li>
 *   <li>prefix: 설정된 경우 경로가 prefix 디렉터리로 시작</li>
 * </ul>
 */
public final class ScopePolicy {

    private static final Set<String> HTML_EXTENSIONS = Set.of("", ".html", ".htm");

    private final CrawlScope scope;

    public ScopePolicy(CrawlScope scope) {
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    public CrawlScope scope() { return scope; }

    public boolean isEligible(String url) {
        if (url == null || !UrlUtils.isAbsolute(url)) return false;
        if (!scope.domain().equals(UrlUtils.authority(url))) return false;

        String path = UrlUtils.path(url);
        if (scope.isPrefixScoped() && !path.startsWith(scope.prefixDir().get())) return false;

        return isLikelyHtml(path);
    }

    /** 경로만 보고 HTML 페이지일 가능성 판정 */
    public static boolean isLikelyHtml(String path) {
        if (path == null) return false;
        if (path.endsWith("/")) return true;
        return HTML_EXTENSIONS.contains(UrlUtils.extension(path));
    }
}
