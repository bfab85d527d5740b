package com.webharvester.app.logging;

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
 * 코어의 SLF4J 로그는 slf4j-jdk14 를 거쳐 여기 핸들러로 온다.
 * - init(logDir, level): logDir/crawl-%g.log + 콘솔
 * - setLevel(level): 루트/핸들러 레벨 즉시 변경
 *
 * System props:
 *  -Dcrawl.log.sizeMb=2
 *  -Dcrawl.log.files=5
 *  -Dcrawl.log.console=true|false (기본 true)
 */
public final class LogSetup {
    private LogSetup() {}

    public static final String FILE_PATTERN = "crawl-%g.log";

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    public static synchronized void init(Path logDir, Level level) {
        if (initialized) {
            setLevel(level);
            return;
        }
        initialized = true;
        final Level lvl = (level == null) ? Level.INFO : level;

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");

        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("crawl.log.console", "true"));
        if (toConsole) {
            ConsoleHandler console = new ConsoleHandler();
            console.setLevel(lvl);
            console.setFormatter(LINE_FORMATTER);
            root.addHandler(console);
        }
        root.setLevel(lvl);

        try {
            Files.createDirectories(logDir);
            int sizeMb  = parseInt(System.getProperty("crawl.log.sizeMb"), 2);
            int fileCnt = parseInt(System.getProperty("crawl.log.files"), 5);

            String pattern = logDir.resolve(FILE_PATTERN).toString();
            FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
            file.setLevel(lvl);
            file.setFormatter(LINE_FORMATTER);
            root.addHandler(file);

            Logger.getLogger(LogSetup.class.getName()).log(Level.FINE,
                    () -> "Log initialized. dir=" + logDir.toAbsolutePath() + ", level=" + lvl.getName());
        } catch (IOException e) {
            // 파일 로그 없이 콘솔만으로 진행
            Logger.getLogger(LogSetup.class.getName())
                    .log(Level.WARNING, "File log setup failed: " + e.getMessage(), e);
        }
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

    private static int parseInt(String s, int def) {
        if (s == null || s.isBlank()) return def;
        try {
            int n = Integer.parseInt(s.trim());
            return (n > 0) ? n : def;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}
