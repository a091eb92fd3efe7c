package com.siteindexer.app;

import com.siteindexer.core.model.CrawlConfig;

import java.nio.file.Path;

/**
 * 명령행 인자. 지정한 값만 CrawlConfig(YAML/기본값)에 덮어쓴다.
 */
public final class CliArgs {

    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: siteindexer [options] <seed-url>",
            "",
            "Options:",
            "  --prefix             limit the crawl to the seed URL's directory",
            "  --flush-every N      write the index every N pages (default 50)",
            "  --timeout-ms N       per-request timeout in milliseconds (default 10000)",
            "  --concurrency N      parallel fetch workers (default 1)",
            "  --max-pages N        stop after N indexed pages (default 0 = no limit)",
            "  --out FILE           index file name (default search_index[_<prefix>].json)",
            "  --out-dir DIR        output directory for the index and logs (default .)",
            "  --pretty             pretty-print the JSON index",
            "  --config FILE        YAML config (default ./siteindexer.yml if present)",
            "  -h, --help           show this help");

    /** 잘못된 인자. 메시지는 사용자에게 그대로 보여준다. */
    public static final class UsageException extends IllegalArgumentException {
        public UsageException(String message) { super(message); }
    }

    String seed;
    boolean prefix;
    Integer flushEvery;
    Long timeoutMs;
    Integer concurrency;
    Integer maxPages;
    String outFile;
    Path outDir;
    boolean pretty;
    Path configFile;
    boolean help;

    private CliArgs() {}

    public static CliArgs parse(String[] args) {
        CliArgs c = new CliArgs();
        if (args == null) return c;
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-h", "--help" -> c.help = true;
                case "--prefix" -> c.prefix = true;
                case "--pretty" -> c.pretty = true;
                case "--flush-every" -> c.flushEvery = positiveInt(a, value(args, ++i, a));
                case "--timeout-ms" -> c.timeoutMs = (long) positiveInt(a, value(args, ++i, a));
                case "--concurrency" -> c.concurrency = positiveInt(a, value(args, ++i, a));
                case "--max-pages" -> c.maxPages = nonNegativeInt(a, value(args, ++i, a));
                case "--out" -> c.outFile = value(args, ++i, a);
                case "--out-dir" -> c.outDir = Path.of(value(args, ++i, a));
                case "--config" -> c.configFile = Path.of(value(args, ++i, a));
                default -> {
                    if (a.startsWith("-")) throw new UsageException("Unknown option: " + a);
                    if (c.seed != null) throw new UsageException("Only one seed URL is allowed: " + a);
                    c.seed = a;
                }
            }
        }
        return c;
    }

    /** 지정된 값만 반영 */
    public CrawlConfig applyTo(CrawlConfig cfg) {
        if (seed != null) cfg.setSeed(seed);
        if (prefix) cfg.setPrefixMode(true);
        if (flushEvery != null) cfg.setFlushEvery(flushEvery);
        if (timeoutMs != null) cfg.setTimeoutMs(timeoutMs);
        if (concurrency != null) cfg.setConcurrency(concurrency);
        if (maxPages != null) cfg.setMaxPages(maxPages);
        if (outFile != null) cfg.setOutputFile(outFile);
        if (outDir != null) cfg.setOutputDir(outDir);
        if (pretty) cfg.setPrettyJson(true);
        return cfg;
    }

    public String seed() { return seed; }
    public boolean help() { return help; }
    public Path configFile() { return configFile; }

    private static String value(String[] args, int i, String opt) {
        if (i >= args.length) throw new UsageException("Missing value for " + opt);
        return args[i];
    }

    private static int positiveInt(String opt, String v) {
        int n = parseInt(opt, v);
        if (n < 1) throw new UsageException(opt + " must be >= 1: " + v);
        return n;
    }

    private static int nonNegativeInt(String opt, String v) {
        int n = parseInt(opt, v);
        if (n < 0) throw new UsageException(opt + " must be >= 0: " + v);
        return n;
    }

    private static int parseInt(String opt, String v) {
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new UsageException(opt + " expects a number: " + v);
        }
    }
}
