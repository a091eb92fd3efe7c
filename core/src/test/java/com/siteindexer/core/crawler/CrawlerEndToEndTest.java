package com.siteindexer.core.crawler;

import com.siteindexer.core.model.CrawlConfig;
import com.siteindexer.core.model.CrawlResult;
import com.siteindexer.core.model.SkipReason;
import com.siteindexer.core.store.JsonIndexStore;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/** 로컬 HttpServer를 상대로 기본 구성(HttpClient + JSON 파일) 전체 경로 확인 */
class CrawlerEndToEndTest {

    @TempDir Path tmp;

    private HttpServer server;
    private String base;
    private final Map<String, AtomicInteger> hits = new ConcurrentHashMap<>();

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", ex -> {
            String path = ex.getRequestURI().getPath();
            hits.computeIfAbsent(path, k -> new AtomicInteger()).incrementAndGet();
            switch (path) {
                case "/" -> respond(ex, 200, "text/html; charset=utf-8",
                        "<html><head><title>ignored</title></head><body><h1>Welcome</h1>"
                                + "<a href=\"docs/intro.html\">intro</a>"
                                + "<a href=\"/notes.txt\">notes</a>"
                                + "<a href=\"/report.pdf\">pdf</a>"
                                + "<a href=\"/gone.html\">gone</a>"
                                + "<a href=\"http://external.invalid/\">ext</a></body></html>");
                case "/docs/intro.html" -> respond(ex, 200, "text/html",
                        "<body>Intro text <script>ignored()</script><a href=\"../about\">about</a></body>");
                case "/about" -> respond(ex, 200, "TEXT/HTML", "<body>About us <a href=\"/#top\">home</a></body>");
                case "/notes.txt" -> respond(ex, 200, "text/plain", "plain notes");
                default -> respond(ex, 404, "text/html", "<body>not found</body>");
            }
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    private static void respond(com.sun.net.httpserver.HttpExchange ex, int status, String type, String body)
            throws IOException {
        byte[] b = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", type);
        ex.sendResponseHeaders(status, b.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(b);
        }
    }

    @Test
    @DisplayName("도메인 크롤 → search_index.json 기록")
    void crawlsSiteAndWritesIndex() throws Exception {
        CrawlConfig cfg = CrawlConfig.defaults()
                .setSeed(base + "/")
                .setTimeoutMs(2_000)
                .setOutputDir(tmp);

        try (Crawler crawler = new Crawler(cfg)) {
            CrawlResult r = crawler.crawl();

            assertThat(r.indexedUrls()).containsExactly(base + "/", base + "/docs/intro.html", base + "/about");
            assertThat(r.skippedCount(SkipReason.NOT_HTML)).isEqualTo(1);     // notes.txt
            assertThat(r.skippedCount(SkipReason.FETCH_FAILED)).isEqualTo(1); // gone.html
            assertThat(hits).doesNotContainKey("/report.pdf");
            assertThat(hits.get("/").get()).isEqualTo(1);

            Path out = tmp.resolve("search_index.json");
            assertThat(r.output()).isEqualTo(out);
            assertThat(Files.readString(out)).doesNotContain("\n"); // 도메인 모드는 compact

            Map<String, Map<String, List<Integer>>> saved = JsonIndexStore.read(out);
            assertThat(saved).isEqualTo(crawler.index().snapshot());
            assertThat(saved).containsKeys("welcome", "intro", "about").doesNotContainKeys("ignored", "title");
            assertThat(saved.get("welcome").get(base + "/")).containsExactly(0);
        }
    }

    @Test
    @DisplayName("prefix 크롤 → search_index_<prefix>.json, pretty 출력")
    void prefixCrawlUsesPrefixedPrettyFile() throws Exception {
        CrawlConfig cfg = CrawlConfig.defaults()
                .setSeed(base + "/docs/intro.html")
                .setPrefixMode(true)
                .setTimeoutMs(2_000)
                .setOutputDir(tmp);

        try (Crawler crawler = new Crawler(cfg)) {
            CrawlResult r = crawler.crawl();

            assertThat(r.indexedUrls()).containsExactly(base + "/docs/intro.html");
            assertThat(hits).doesNotContainKey("/about");

            Path out = tmp.resolve("search_index_docs.json");
            assertThat(r.output()).isEqualTo(out);
            assertThat(Files.readString(out)).contains("\n");
        }
    }
}
