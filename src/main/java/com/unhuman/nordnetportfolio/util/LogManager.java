package com.unhuman.nordnetportfolio.util;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.function.Consumer;

/**
 * Utility class for managing logs in the application.
 * Maintains a buffer of recent log messages and forwards new entries to an optional listener
 * (the console log view, for example). DEBUG entries are dropped unless verbose mode is on.
 */
public class LogManager {
    private static LogManager instance;
    private static final int MAX_LOG_LINES = 2000;
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");
    private static final String LEVEL_DEBUG = "DEBUG";
    private static final String LEVEL_INFO = "INFO";
    private static final String LEVEL_WARN = "WARN";
    private static final String LEVEL_ERROR = "ERROR";
    private final ConcurrentLinkedDeque<LogEntry> logBuffer = new ConcurrentLinkedDeque<>();
    private final Set<LogCategory> activeFilters = EnumSet.allOf(LogCategory.class);
    private volatile String textFilter = "";
    private volatile boolean verbose = false;
    private volatile boolean echoToConsole = true;
    private volatile Consumer<LogEntry> logListener = null;

    private LogManager() {}

    public static synchronized LogManager getInstance() {
        if (instance == null) {
            instance = new LogManager();
        }
        return instance;
    }

    public void debug(LogCategory category, String message) {
        if (verbose) {
            log(LEVEL_DEBUG, message, category);
        }
    }

    public void info(String message) {
        log(LEVEL_INFO, message, LogCategory.GENERAL);
    }

    public void info(LogCategory category, String message) {
        log(LEVEL_INFO, message, category);
    }

    public void warn(String message) {
        log(LEVEL_WARN, message, LogCategory.GENERAL);
    }

    public void warn(LogCategory category, String message) {
        log(LEVEL_WARN, message, category);
    }

    public void error(String message) {
        log(LEVEL_ERROR, message, LogCategory.GENERAL);
    }

    public void error(LogCategory category, String message) {
        log(LEVEL_ERROR, message, category);
    }

    public void error(String message, Throwable e) {
        error(LogCategory.GENERAL, message, e);
    }

    public void error(LogCategory category, String message, Throwable e) {
        StringBuilder sb = new StringBuilder(message);
        sb.append(": ").append(e.getMessage());
        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        e.printStackTrace(pw);
        sb.append("\n").append(sw.toString());
        log(LEVEL_ERROR, sb.toString(), category);
    }

    private static final ThreadLocal<Boolean> isLogging = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private void log(String level, String message, LogCategory category) {
        if (Boolean.TRUE.equals(isLogging.get())) {
            return;
        }
        isLogging.set(Boolean.TRUE);
        try {
            String timestamp = DATE_FORMAT.format(LocalDateTime.now());
            LogEntry entry = new LogEntry(timestamp, level, message, category, Thread.currentThread().getName());

            if (echoToConsole) {
                PrintStream outputStream = (LEVEL_ERROR.equals(level))
                    ? System.err
                    : System.out;

                if (outputStream != null) {
                    outputStream.println(entry.getFormattedMessage());
                }
            }

            addToBuffer(entry);
            notifyListener(entry);
        } finally {
            isLogging.set(Boolean.FALSE);
        }
    }

    private synchronized void addToBuffer(LogEntry entry) {
        logBuffer.add(entry);
        while (logBuffer.size() > MAX_LOG_LINES) {
            logBuffer.removeFirst();
        }
    }

    /**
     * Verbose mode enables DEBUG output. It only changes what gets logged.
     */
    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Echo entries to stdout/stderr. The console front end echoes only in verbose mode.
     */
    public void setEchoToConsole(boolean echoToConsole) {
        this.echoToConsole = echoToConsole;
    }

    public void setFilterEnabled(LogCategory category, boolean enabled) {
        synchronized (activeFilters) {
            if (enabled) {
                activeFilters.add(category);
            } else {
                activeFilters.remove(category);
            }
        }
    }

    public boolean isFilterEnabled(LogCategory category) {
        synchronized (activeFilters) {
            return activeFilters.contains(category);
        }
    }

    public static LogCategory[] getCategories() {
        return LogCategory.values();
    }

    /**
     * Set the text filter string. When non-empty, only log lines containing
     * this string (case-insensitive) are returned.
     */
    public void setTextFilter(String filter) {
        this.textFilter = (filter == null) ? "" : filter;
    }

    public String getTextFilter() {
        return textFilter;
    }

    private boolean matchesTextFilter(LogEntry entry) {
        String filter = textFilter;
        if (filter.isEmpty()) {
            return true;
        }
        return entry.getFormattedMessage().toLowerCase().contains(filter.toLowerCase());
    }

    private boolean isVisible(LogEntry entry) {
        return isFilterEnabled(entry.getCategory()) && matchesTextFilter(entry);
    }

    /**
     * Register a listener that receives each new visible entry on the logging thread.
     * Pass null to remove it.
     */
    public void setLogListener(Consumer<LogEntry> listener) {
        this.logListener = listener;
    }

    private void notifyListener(LogEntry entry) {
        Consumer<LogEntry> listener = logListener;
        if (listener == null || !isVisible(entry)) {
            return;
        }
        try {
            listener.accept(entry);
        } catch (RuntimeException e) {
            PrintStream err = System.err;
            if (err != null) {
                err.println("Error delivering log entry: " + e.getMessage());
            }
        }
    }

    public String getLogsAsString() {
        StringBuilder sb = new StringBuilder();
        for (LogEntry entry : logBuffer) {
            if (isVisible(entry)) {
                sb.append(entry.getFormattedMessage()).append("\n");
            }
        }
        return sb.toString();
    }

    public void clearLogs() {
        logBuffer.clear();
    }
}
