package com.siteindexer.app;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class AppTest {

    @TempDir Path tmp;

    private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();

    private int run(String... args) {
        return App.run(args,
                new PrintStream(outBuf, true, StandardCharsets.UTF_8),
                new PrintStream(errBuf, true, StandardCharsets.UTF_8));
    }

    private String err() { return errBuf.toString(StandardCharsets.UTF_8); }
    private String out() { return outBuf.toString(StandardCharsets.UTF_8); }

    @Test
    @DisplayName("seed 없으면 사용법 출력 + 종료 코드 2")
    void missingSeed() {
        assertThat(run()).isEqualTo(App.EXIT_USAGE);
        assertThat(err()).contains("Usage: siteindexer");
    }

    @Test
    void unknownOptionAndRelativeSeed() {
        assertThat(run("--nope", "https://ex.com/")).isEqualTo(App.EXIT_USAGE);
        assertThat(err()).contains("Unknown option: --nope");

        assertThat(run("ex.com/page")).isEqualTo(App.EXIT_USAGE);
        assertThat(err()).contains("absolute URL");
    }

    @Test
    void helpExitsZero() {
        assertThat(run("--help")).isEqualTo(App.EXIT_OK);
        assertThat(out()).contains("--prefix");
    }

    @Test
    @DisplayName("설정 파일이 없으면 종료 코드 2")
    void missingConfigFile() {
        assertThat(run("--config", tmp.resolve("none.yml").toString(), "https://ex.com/")).isEqualTo(App.EXIT_USAGE);
        assertThat(err()).contains("Cannot read config");
    }

    @Test
    @DisplayName("로컬 사이트 크롤 → 인덱스 파일 + 요약, 종료 코드 0")
    void crawlsLocalSite() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", ex -> {
            String body = "/".equals(ex.getRequestURI().getPath())
                    ? "<body>Hello <a href=\"/next.html\">next</a></body>"
                    : "<body>Next page</body>";
            byte[] b = body.getBytes(StandardCharsets.UTF_8);
            ex.getResponseHeaders().add("Content-Type", "text/html");
            ex.sendResponseHeaders(200, b.length);
            try (OutputStream os = ex.getResponseBody()) {
                os.write(b);
            }
        });
        server.start();
        try {
            String seed = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
            int code = run("--out-dir", tmp.toString(), "--timeout-ms", "2000", seed);

            assertThat(code).isEqualTo(App.EXIT_OK);
            assertThat(out()).contains("Indexed 2 page(s)");
            Path index = tmp.resolve("search_index.json");
            assertThat(index).exists();
            assertThat(Files.readString(index)).contains("\"hello\"", "\"next\"");
        } finally {
            server.stop(0);
        }
    }
}
