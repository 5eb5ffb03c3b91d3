package com.orion.para;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Simple logging utility that writes to a log file and optionally the console.
 * Falls back to a console-only logger until {@link #initialize} is called.
 */
public class AppLogger {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final PrintStream fileOutput;
    private final PrintStream consoleOutput;
    private final boolean consoleEnabled;

    private static AppLogger instance;
    private static AppLogger fallback;

    private AppLogger(Path logFile, boolean consoleEnabled) throws IOException {
        this.consoleOutput = System.err;
        this.consoleEnabled = consoleEnabled;

        Path parent = logFile.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        FileOutputStream fos = new FileOutputStream(logFile.toFile(), true);
        this.fileOutput = new PrintStream(fos, true, "UTF-8");

        String separator = "=".repeat(60);
        fileOutput.println();
        fileOutput.println(separator);
        fileOutput.println("Orion PARA store opened at " + LocalDateTime.now().format(TIME_FORMAT));
        fileOutput.println(separator);
    }

    private AppLogger(boolean consoleEnabled) {
        this.consoleOutput = System.err;
        this.consoleEnabled = consoleEnabled;
        this.fileOutput = null;
    }

    public static synchronized void initialize(Path logFile, boolean consoleEnabled) throws IOException {
        if (instance == null) {
            instance = new AppLogger(logFile, consoleEnabled);
        }
    }

    public static synchronized AppLogger get() {
        if (instance != null) {
            return instance;
        }
        if (fallback == null) {
            fallback = new AppLogger(Boolean.getBoolean("orion.para.log.console"));
        }
        return fallback;
    }

    public void info(String message) {
        log("INFO", message);
    }

    public void warn(String message) {
        log("WARN", message);
    }

    public void warn(String message, Throwable t) {
        log("WARN", message + " (" + describe(t) + ")");
    }

    public void error(String message) {
        log("ERROR", message);
    }

    public void error(String message, Throwable t) {
        log("ERROR", message);
        if (fileOutput != null) {
            t.printStackTrace(fileOutput);
        }
        if (consoleEnabled) {
            t.printStackTrace(consoleOutput);
        }
    }

    private void log(String level, String message) {
        String timestamp = LocalDateTime.now().format(TIME_FORMAT);
        String line = String.format("[%s] [%s] %s", timestamp, level, message);

        if (fileOutput != null) {
            fileOutput.println(line);
        }

        if (consoleEnabled) {
            consoleOutput.println(line);
        }
    }

    /**
     * Message for a throwable, or its class name when it carries none.
     */
    public static String describe(Throwable t) {
        if (t == null) {
            return "unknown error";
        }
        String message = t.getMessage();
        return message != null && !message.isBlank() ? message : t.getClass().getName();
    }

    public void close() {
        if (fileOutput != null) {
            fileOutput.close();
        }
    }
}
