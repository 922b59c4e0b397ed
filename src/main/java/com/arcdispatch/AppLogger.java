package com.arcdispatch;

import com.arcdispatch.providers.CredentialSanitizer;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Service log written to the console and to the log file.
 *
 * Lines look like {@code [time] [LEVEL] [thread] [Component] message}. Provider errors and
 * payload fragments flow into these lines, so every message and stack trace is passed through
 * {@link CredentialSanitizer} before it is written. Debug lines appear only in verbose mode.
 * Before {@link #initialize} runs (tests, embedded use) a console-only logger is handed out.
 */
public class AppLogger {

    public enum Level {
        DEBUG, INFO, WARN, ERROR
    }

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    private static volatile AppLogger instance;
    private static final AppLogger CONSOLE_ONLY = new AppLogger(System.out, null, Level.INFO);

    private final PrintStream console;
    private final PrintStream file;
    private final Level threshold;

    AppLogger(PrintStream console, PrintStream file, Level threshold) {
        this.console = console;
        this.file = file;
        this.threshold = threshold;
    }

    /**
     * Open the log file in append mode and make it the process-wide logger.
     *
     * @param verbose also write {@link Level#DEBUG} lines
     */
    public static synchronized void initialize(Path logFile, boolean verbose) throws IOException {
        if (instance != null) {
            return;
        }
        PrintStream file = new PrintStream(new FileOutputStream(logFile.toFile(), true), true, StandardCharsets.UTF_8);
        file.println();
        file.println("=".repeat(60));
        file.println(AppConfig.APP_NAME + " started at " + LocalDateTime.now().format(TIME_FORMAT));
        file.println("=".repeat(60));
        instance = new AppLogger(System.out, file, verbose ? Level.DEBUG : Level.INFO);
    }

    public static AppLogger get() {
        AppLogger current = instance;
        return current != null ? current : CONSOLE_ONLY;
    }

    public boolean isDebugEnabled() {
        return threshold == Level.DEBUG;
    }

    public void debug(String message) {
        log(Level.DEBUG, message, null);
    }

    public void info(String message) {
        log(Level.INFO, message, null);
    }

    public void warn(String message) {
        log(Level.WARN, message, null);
    }

    public void error(String message) {
        log(Level.ERROR, message, null);
    }

    public void error(String message, Throwable t) {
        log(Level.ERROR, message, t);
    }

    /**
     * Unformatted line for startup banners. Not filtered by level.
     */
    public void console(String message) {
        write(message);
    }

    public void close() {
        if (file != null) {
            file.close();
        }
    }

    private void log(Level level, String message, Throwable t) {
        if (level.compareTo(threshold) < 0) {
            return;
        }
        String line = String.format("[%s] [%s] [%s] %s", LocalDateTime.now().format(TIME_FORMAT), level,
            Thread.currentThread().getName(), CredentialSanitizer.sanitize(message));
        if (t != null) {
            StringWriter trace = new StringWriter();
            t.printStackTrace(new PrintWriter(trace));
            line = line + System.lineSeparator() + CredentialSanitizer.sanitize(trace.toString().stripTrailing());
        }
        write(line);
    }

    private synchronized void write(String line) {
        if (console != null) {
            console.println(line);
        }
        if (file != null) {
            file.println(line);
        }
    }
}
