package com.webchunker.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.*;
import java.util.Locale;
import java.util.logging.*;

/**
 * java.util.logging 전역 설정 + 사이즈 롤링(기본 2MB x 5).
 * SLF4J 호출은 slf4j-jdk14 바인딩을 통해 여기로 모인다.
 * - init(logDir): logs 디렉터리를 직접 넘겨 초기화
 * - setLevel(Level): 루트/핸들러 레벨 즉시 변경
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    /** logDir/app-%g.log 로 저장. System props:
     *  -Dwc.log.level=FINE|INFO|WARNING|SEVERE
     *  -Dwc.log.sizeMb=2
     *  -Dwc.log.files=5
     *  -Dwc.log.console=true|false (기본 true)
     */
    public static synchronized void init(Path logDir) {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(System.getProperty("wc.log.level", "INFO"));
        int sizeMb  = parseInt(System.getProperty("wc.log.sizeMb"), 2);
        int fileCnt = parseInt(System.getProperty("wc.log.files"), 5);
        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("wc.log.console", "true"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");

        // 콘솔은 stderr(ConsoleHandler 기본) → stdout의 결과 출력과 섞이지 않음
        if (toConsole) {
            ConsoleHandler console = new ConsoleHandler();
            console.setLevel(level);
            console.setFormatter(LINE_FORMATTER);
            root.addHandler(console);
        }
        root.setLevel(level);

        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve("app-%g.log").toString();
            FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
            file.setLevel(level);
            file.setFormatter(LINE_FORMATTER);
            root.addHandler(file);

            Logger.getLogger(LogSetup.class.getName()).log(Level.CONFIG,
                    () -> "Log initialized. dir=" + logDir.toAbsolutePath() + ", level=" + level.getName());
        } catch (IOException e) {
            // 파일 핸들러 없이 콘솔만으로 진행
            Logger.getLogger(LogSetup.class.getName()).log(Level.WARNING, "Log file setup failed: " + e.getMessage(), e);
        }
    }

    /** 런타임에 로그 레벨 변경 (콘솔/파일 모두) */
    public static void setLevel(Level level) {
        Level lv = (level == null) ? Level.INFO : level;
        Logger root = Logger.getLogger("");
        root.setLevel(lv);
        for (Handler h : root.getHandlers()) h.setLevel(lv);
    }

    /** 문자열을 Level로(실패 시 INFO). "DEBUG"/"WARN"도 허용 */
    public static Level levelOf(String name) {
        String s = String.valueOf(name).trim().toUpperCase(Locale.ROOT);
        if (s.equals("DEBUG")) return Level.FINE;
        if (s.equals("WARN")) return Level.WARNING;
        if (s.equals("ERROR")) return Level.SEVERE;
        try { return Level.parse(s); }
        catch (IllegalArgumentException e) { return Level.INFO; }
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
                    r.getLoggerName(), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}
