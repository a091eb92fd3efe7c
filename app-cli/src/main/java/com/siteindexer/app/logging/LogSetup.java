package com.siteindexer.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정 + 사이즈 롤링(기본 2MB x 5).
 * SLF4J는 slf4j-jdk14 바인딩으로 여기 설정된 핸들러를 탄다.
 * System props:
 *  -Dsi.log.level=FINE|INFO|WARNING|SEVERE
 *  -Dsi.log.sizeMb=2
 *  -Dsi.log.files=5
 *  -Dsi.log.console=true|false (기본 true)
 *  -Dsi.log.events=true|false (JSON 이벤트 로그, 기본 false → 파일에만)
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    /** logs 디렉터리를 직접 넘겨 초기화 */
    public static synchronized void init(Path logDir) {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(System.getProperty("si.log.level", "INFO"));
        int sizeMb   = parseInt(System.getProperty("si.log.sizeMb"), 2);
        int fileCnt  = parseInt(System.getProperty("si.log.files"), 5);
        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("si.log.console", "true"));
        boolean eventsOnConsole = "true".equalsIgnoreCase(System.getProperty("si.log.events", "false"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");

        if (toConsole) {
            ConsoleHandler console = new ConsoleHandler();
            console.setLevel(level);
            console.setFormatter(LINE_FORMATTER);
            // 구조화 이벤트(*.events)는 콘솔에서 빼고 파일에만
            if (!eventsOnConsole) console.setFilter(r -> r.getLoggerName() == null || !r.getLoggerName().endsWith(".events"));
            root.addHandler(console);
        }

        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve("siteindexer-%g.log").toString();
            FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
            file.setLevel(level);
            file.setFormatter(LINE_FORMATTER);
            root.addHandler(file);
        } catch (IOException e) {
            // 파일 로그 없이 콘솔만으로 진행
            Logger.getLogger(LogSetup.class.getName()).log(Level.WARNING, "File log disabled: " + e.getMessage(), e);
        }

        root.setLevel(level);
        Logger.getLogger(LogSetup.class.getName()).log(Level.FINE,
                () -> "Log initialized. dir=" + logDir.toAbsolutePath() + ", level=" + level.getName());
    }

    /** 런타임에 로그 레벨 변경 (콘솔/파일 모두) */
    public static void setLevel(Level level) {
        if (level == null) level = Level.INFO;
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler h : root.getHandlers()) {
            h.setLevel(level);
        }
    }

    /** 문자열을 Level로(실패 시 INFO) */
    public static Level levelOf(String s) {
        try { return Level.parse(String.valueOf(s).trim().toUpperCase(Locale.ROOT)); }
        catch (Exception e) { return Level.INFO; }
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException ignored) { return def; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    private static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    shortName(r.getLoggerName()), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }

        private static String shortName(String name) {
            if (name == null) return "";
            int i = name.lastIndexOf('.', name.endsWith(".events") ? name.length() - ".events".length() - 1 : name.length());
            return i < 0 ? name : name.substring(i + 1);
        }
    }
}
