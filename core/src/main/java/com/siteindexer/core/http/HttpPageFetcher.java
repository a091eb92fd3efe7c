package com.siteindexer.core.http;

import com.siteindexer.core.api.IPageFetcher;
import com.siteindexer.core.model.CrawlConfig;
import com.siteindexer.core.model.FetchedPage;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/** GET 요청을 보내고 FetchedPage로 매핑. 전송 실패는 status -1 로 반환(재시도 없음). */
public class HttpPageFetcher implements IPageFetcher {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws Exception;
    }

    private final CrawlConfig config;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)

    public HttpPageFetcher(CrawlConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        this.sender = null;
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpPageFetcher(CrawlConfig config, HttpSender testSender) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public FetchedPage fetch(String url) {
        Objects.requireNonNull(url, "url");
        long start = System.nanoTime();
        try {
            Duration timeout = config.getTimeout();
            HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                    .timeout(timeout)
                    .header("User-Agent", config.getUserAgent())
                    .GET()
                    .build();

            HttpResponse<String> resp = (sender != null) ? sender.send(req) : sendWithDeadline(req, timeout);

            HttpHeaders hh = resp.headers();
            Map<String, List<String>> headers = hh.map();
            String contentType = hh.firstValue("Content-Type").orElse(null);

            return FetchedPage.builder()
                    .url(url)
                    .statusCode(resp.statusCode())
                    .headers(headers)
                    .body(resp.body() == null ? "" : resp.body())
                    .contentType(contentType)
                    .responseTimeMs(elapsedMs(start))
                    .build();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return FetchedPage.failure(url, "interrupted", elapsedMs(start));
        } catch (Exception e) {
            return FetchedPage.failure(url, describe(e), elapsedMs(start));
        }
    }

    /**
     * request timeout은 헤더 수신까지만 보장하므로 본문 포함 전체에 deadline을 한 번 더 건다.
     * 초과 시 요청을 취소하고 워커를 돌려준다.
     */
    private HttpResponse<String> sendWithDeadline(HttpRequest req, Duration timeout) throws Exception {
        CompletableFuture<HttpResponse<String>> f = client.sendAsync(req, HttpResponse.BodyHandlers.ofString());
        try {
            return f.get(timeout.toMillis() * 2, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            f.cancel(true);
            throw new TimeoutException("fetch exceeded " + timeout.toMillis() * 2 + "ms");
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof Exception ex) throw ex;
            throw ee;
        }
    }

    private static String describe(Exception e) {
        String msg = e.getMessage();
        return e.getClass().getSimpleName() + (msg == null || msg.isBlank() ? "" : ": " + msg);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
