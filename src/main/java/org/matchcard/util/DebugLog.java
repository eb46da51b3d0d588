package org.matchcard.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

public final class DebugLog {
    private static final boolean ENABLED = Boolean.parseBoolean(
            System.getProperty("matchcard.debugLog",
                    System.getenv().getOrDefault("MATCHCARD_DEBUG_LOG", "false"))
    );
    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");
    private static final Path LOG_FILE = ENABLED ? initLogFile() : null;

    private DebugLog() {
    }

    private static Path initLogFile() {
        try {
            Path logsDir = AppPaths.locateDataDir().resolve("logs");
            Files.createDirectories(logsDir);
            return logsDir.resolve("matchcard.log");
        } catch (IOException e) {
            System.err.println("[DebugLog] Failed to prepare debug log: " + e.getMessage());
            return null;
        }
    }

    public static boolean enabled() {
        return ENABLED && LOG_FILE != null;
    }

    public static void log(String message) {
        if (!enabled() || message == null) return;
        String line = "[" + LocalDateTime.now().format(FORMATTER) + "] ["
                + Thread.currentThread().getName() + "] " + message + System.lineSeparator();
        synchronized (DebugLog.class) {
            try {
                Files.writeString(LOG_FILE, line, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                System.err.println("[DebugLog] Write failed: " + e.getMessage());
            }
        }
    }

    /**
     * Prints to stderr and mirrors the line into the debug log.
     */
    public static void warn(String message) {
        System.err.println(message);
        log("WARN " + message);
    }

    public static void warn(String message, Throwable cause) {
        String reason = cause == null ? "" : " (" + cause.getClass().getSimpleName() + ": " + cause.getMessage() + ")";
        warn(message + reason);
    }
}
