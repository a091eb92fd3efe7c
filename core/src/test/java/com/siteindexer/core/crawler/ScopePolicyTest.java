package com.siteindexer.core.crawler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ScopePolicy: HTML 추정 / 도메인 / prefix")
class ScopePolicyTest {

    @Nested
    @DisplayName("HTML 추정(확장자)")
    class LikelyHtml {
        private final ScopePolicy policy = new ScopePolicy(CrawlScope.fromSeed("https://ex.com/", false));

        @Test
        @DisplayName("디렉터리, .htm, 확장자 없음은 허용 / .pdf는 제외")
        void extensions() {
            assertThat(policy.isEligible("https://ex.com/dir/")).isTrue();
            assertThat(policy.isEligible("https://ex.com/page.htm")).isTrue();
            assertThat(policy.isEligible("https://ex.com/page.html")).isTrue();
            assertThat(policy.isEligible("https://ex.com/page")).isTrue();
            assertThat(policy.isEligible("https://ex.com")).isTrue();

            assertThat(policy.isEligible("https://ex.com/file.pdf")).isFalse();
            assertThat(policy.isEligible("https://ex.com/img/logo.jpg")).isFalse();
            assertThat(policy.isEligible("https://ex.com/a.tar.gz")).isFalse();
        }

        @Test
        @DisplayName("쿼리는 확장자 판정에 영향 없음, 점으로 시작하는 세그먼트는 확장자 없음")
        void queryAndDotSegments() {
            assertThat(policy.isEligible("https://ex.com/search?q=report.pdf")).isTrue();
            assertThat(policy.isEligible("https://ex.com/file.pdf?download=1")).isFalse();
            assertThat(policy.isEligible("https://ex.com/.well-known")).isTrue();
            assertThat(policy.isEligible("https://ex.com/v1.2/page")).isTrue();
        }

        @Test
        @DisplayName("확장자 비교는 대소문자 구분(.HTML 제외)")
        void extensionIsCaseSensitive() {
            assertThat(policy.isEligible("https://ex.com/PAGE.HTML")).isFalse();
        }

        @Test
        @DisplayName(";params 가 붙은 경로도 확장자로 판정")
        void pathParameters() {
            assertThat(policy.isEligible("https://ex.com/a/b.html;jsessionid=1")).isTrue();
            assertThat(policy.isEligible("https://ex.com/a/b.pdf;jsessionid=1")).isFalse();
        }
    }

    @Nested
    @DisplayName("도메인(authority 정확 일치)")
    class Domain {
        private final ScopePolicy policy = new ScopePolicy(CrawlScope.fromSeed("https://ex.com/start.html", false));

        @Test
        void exactAuthorityOnly() {
            assertThat(policy.isEligible("https://ex.com/a.html")).isTrue();
            assertThat(policy.isEligible("http://ex.com/a.html")).isTrue(); // 스킴은 보지 않음

            assertThat(policy.isEligible("https://www.ex.com/a.html")).isFalse(); // 서브도메인 불허
            assertThat(policy.isEligible("https://ex.com:8443/a.html")).isFalse();
            assertThat(policy.isEligible("https://other.com/a.html")).isFalse();
        }

        @Test
        void relativeOrOpaqueUrlsAreIneligible() {
            assertThat(policy.isEligible("/a.html")).isFalse();
            assertThat(policy.isEligible("mailto:someone@ex.com")).isFalse();
            assertThat(policy.isEligible(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("prefix 모드")
    class Prefix {

        @Test
        @DisplayName("seed /html/sp/sp50.html → prefix /html/sp/")
        void prefixDerivedFromSeedDirectory() {
            CrawlScope scope = CrawlScope.fromSeed("https://ex.com/html/sp/sp50.html", true);
            assertThat(scope.prefixDir()).contains("/html/sp/");
            assertThat(scope.prefixName()).isEqualTo("sp");

            ScopePolicy policy = new ScopePolicy(scope);
            assertThat(policy.isEligible("https://ex.com/html/sp/x.html")).isTrue();
            assertThat(policy.isEligible("https://ex.com/html/sp/deeper/y.html")).isTrue();
            assertThat(policy.isEligible("https://ex.com/html/other/x.html")).isFalse();
            assertThat(policy.isEligible("https://ex.com/html/spx/x.html")).isFalse();
        }

        @Test
        @DisplayName("seed가 '/'로 끝나면 경로 그대로, 빈 경로면 '/'")
        void prefixDirOf() {
            assertThat(CrawlScope.prefixDirOf("/docs/")).isEqualTo("/docs/");
            assertThat(CrawlScope.prefixDirOf("/docs/index.html")).isEqualTo("/docs/");
            assertThat(CrawlScope.prefixDirOf("/index.html")).isEqualTo("/");
            assertThat(CrawlScope.prefixDirOf("")).isEqualTo("/");
        }

        @Test
        @DisplayName("루트 prefix 이름은 root")
        void rootPrefixName() {
            assertThat(CrawlScope.fromSeed("https://ex.com/index.html", true).prefixName()).isEqualTo("root");
            assertThat(CrawlScope.fromSeed("https://ex.com/", false).prefixDir()).isEmpty();
        }
    }

    @Test
    @DisplayName("상대 URL/호스트 없는 seed는 거부")
    void invalidSeed() {
        assertThatThrownBy(() -> CrawlScope.fromSeed("ex.com/page", false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CrawlScope.fromSeed("file:///tmp/x.html", false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
