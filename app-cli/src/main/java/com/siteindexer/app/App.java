package com.siteindexer.app;

import com.siteindexer.app.logging.LogSetup;
import com.siteindexer.core.crawler.CrawlScope;
import com.siteindexer.core.crawler.Crawler;
import com.siteindexer.core.model.CrawlConfig;
import com.siteindexer.core.model.CrawlResult;
import com.siteindexer.core.model.SkipReason;
import com.siteindexer.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.util.concurrent.TimeUnit;

/**
 * CLI 진입점: siteindexer [options] &lt;seed-url&gt;
 * 종료 코드: 0 = 완료 + 최종 flush 성공, 1 = 최종 flush 실패, 2 = 사용법/설정 오류
 */
public final class App {

    static final int EXIT_OK = 0;
    static final int EXIT_FLUSH_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private App() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        // ---- 1) 인자/설정 ----
        CliArgs cli;
        try {
            cli = CliArgs.parse(args);
        } catch (CliArgs.UsageException e) {
            err.println(e.getMessage());
            err.println(CliArgs.USAGE);
            return EXIT_USAGE;
        }
        if (cli.help()) {
            out.println(CliArgs.USAGE);
            return EXIT_OK;
        }

        CrawlConfig cfg;
        try {
            cfg = (cli.configFile() != null)
                    ? YamlConfigLoader.load(cli.configFile())
                    : YamlConfigLoader.loadDefault();
        } catch (IOException e) {
            err.println("Cannot read config: " + e.getMessage());
            return EXIT_USAGE;
        }
        cli.applyTo(cfg);

        if (cfg.getSeed() == null || cfg.getSeed().isBlank()) {
            err.println(CliArgs.USAGE);
            return EXIT_USAGE;
        }
        try {
            cfg.validate();
            CrawlScope.fromSeed(cfg.getSeed(), cfg.isPrefixMode());
        } catch (IllegalArgumentException e) {
            err.println("Invalid arguments: " + e.getMessage());
            err.println(CliArgs.USAGE);
            return EXIT_USAGE;
        }

        // ---- 2) 로그 ----
        LogSetup.init(cfg.getOutputDir().resolve("logs"));
        Logger log = LoggerFactory.getLogger(App.class);

        // ---- 3) 크롤 ----
        Crawler crawler = new Crawler(cfg);
        Thread drainHook = new Thread(() -> {
            crawler.requestStop();
            try {
                crawler.awaitFinished(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }, "shutdown-drain");
        Runtime.getRuntime().addShutdownHook(drainHook);

        CrawlResult result;
        try {
            result = crawler.crawl();
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(drainHook);
            } catch (IllegalStateException alreadyShuttingDown) {
                log.debug("JVM shutting down; drain hook stays registered");
            }
            try {
                crawler.close();
            } catch (Exception e) {
                log.warn("Fetcher close failed: {}", e.toString());
            }
        }

        // ---- 4) 요약 ----
        out.printf("Indexed %d page(s), %d term(s) -> %s%n",
                result.pagesIndexed(), result.termCount(), result.output());
        out.printf("Skipped: fetch=%d, non-html=%d, parse=%d, out-of-scope=%d (%d ms)%n",
                result.skippedCount(SkipReason.FETCH_FAILED),
                result.skippedCount(SkipReason.NOT_HTML),
                result.skippedCount(SkipReason.PARSE_FAILED),
                result.skippedCount(SkipReason.OUT_OF_SCOPE),
                result.elapsedMs());

        if (!result.finalFlushOk()) {
            err.println("Final index flush failed: " + result.output());
            return EXIT_FLUSH_FAILED;
        }
        return EXIT_OK;
    }
}
