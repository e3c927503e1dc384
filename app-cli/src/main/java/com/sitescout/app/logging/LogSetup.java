package com.sitescout.app.logging;

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
 * java.util.logging 전역 설정.
 * - 콘솔: -Dss.log.level (기본 INFO)
 * - errors.log: WARNING 이상만, 실행마다 이어쓰기
 *
 * System props:
 *  -Dss.log.level=FINE|INFO|WARNING|SEVERE
 *  -Dss.log.console=true|false (기본 true)
 */
public final class LogSetup {
    private LogSetup() {}

    public static final String ERRORS_FILE = "errors.log";

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    /** workDir/errors.log 로 초기화 */
    public static synchronized void init(Path workDir) {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(System.getProperty("ss.log.level", "INFO"));
        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("ss.log.console", "true"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        root.setLevel(level.intValue() < Level.WARNING.intValue() ? level : Level.WARNING);

        if (toConsole) {
            ConsoleHandler console = new ConsoleHandler();
            console.setLevel(level);
            console.setFormatter(LINE_FORMATTER);
            root.addHandler(console);
        }

        try {
            Files.createDirectories(workDir);
            FileHandler errors = new FileHandler(workDir.resolve(ERRORS_FILE).toString(), true);
            errors.setLevel(Level.WARNING);
            errors.setFormatter(LINE_FORMATTER);
            errors.setEncoding("UTF-8");
            root.addHandler(errors);
        } catch (IOException e) {
            // 파일을 못 열면 콘솔만으로 진행
            Logger.getLogger(LogSetup.class.getName()).log(Level.WARNING,
                    "Cannot open " + ERRORS_FILE + ": " + e.getMessage(), e);
        }

        Logger.getLogger(LogSetup.class.getName()).log(Level.FINE,
                () -> "Log initialized. dir=" + workDir.toAbsolutePath() + ", level=" + level.getName());
    }

    /** 핸들러 버퍼 비우기(종료 시) */
    public static synchronized void flush() {
        for (Handler h : Logger.getLogger("").getHandlers()) {
            h.flush();
        }
    }

    /** 문자열을 Level로(실패 시 INFO) */
    public static Level levelOf(String s) {
        try { return Level.parse(String.valueOf(s).trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return Level.INFO; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL - %2$s - (%3$s) %4$s - %5$s%n",
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
