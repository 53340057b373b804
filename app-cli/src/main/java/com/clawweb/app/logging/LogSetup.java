package com.clawweb.app.logging;

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
 * java.util.logging 전역 설정 (SLF4J 는 slf4j-jdk14 로 여기에 합류).
 * 콘솔(stderr) + 선택적 파일 롤링. System props:
 *  -Dcw.log.level=FINE|INFO|WARNING|SEVERE (기본 WARNING: 평소 출력은 배너/요약만)
 *  -Dcw.log.dir=logs   (지정 시에만 파일 로그)
 *  -Dcw.log.sizeMb=2
 *  -Dcw.log.files=5
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    public static synchronized void init() {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(System.getProperty("cw.log.level", "WARNING"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");

        ConsoleHandler console = new ConsoleHandler(); // System.err
        console.setLevel(level);
        console.setFormatter(LINE_FORMATTER);
        root.addHandler(console);

        String dir = System.getProperty("cw.log.dir");
        if (dir != null && !dir.isBlank()) {
            addFileHandler(root, Path.of(dir), level);
        }
        root.setLevel(level);
    }

    private static void addFileHandler(Logger root, Path logDir, Level level) {
        int sizeMb  = parseInt(System.getProperty("cw.log.sizeMb"), 2);
        int fileCnt = parseInt(System.getProperty("cw.log.files"), 5);
        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve("clawweb-%g.log").toString();
            FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
            file.setLevel(level);
            file.setFormatter(LINE_FORMATTER);
            root.addHandler(file);
        } catch (IOException e) {
            // 파일 로그 실패는 콘솔에만 알리고 진행
            Logger.getLogger(LogSetup.class.getName())
                    .log(Level.WARNING, "File log setup failed: " + e.getMessage(), e);
        }
    }

    /** 런타임 레벨 변경 (루트 + 모든 핸들러) */
    public static void setLevel(Level level) {
        if (level == null) level = Level.INFO;
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler h : root.getHandlers()) h.setLevel(level);
    }

    /** 문자열을 Level로(실패 시 INFO) */
    public static Level levelOf(String name) {
        try { return Level.parse(String.valueOf(name).trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException ignored) { return def; }
    }

    /** 한 줄 포맷 + 예외 스택 */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] %3$s - %4$s%n",
                    r.getMillis(), r.getLevel().getName(), r.getLoggerName(), formatMessage(r));

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw;
        }
    }
}
