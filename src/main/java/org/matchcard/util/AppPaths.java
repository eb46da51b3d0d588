package org.matchcard.util;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves where matchcard keeps its on-disk state (settings, icon cache, logs).
 * {@code -Dmatchcard.dataDir} wins over {@code MATCHCARD_DATA_DIR}; otherwise {@code ./data}.
 */
public final class AppPaths {
    private AppPaths() {
    }

    public static Path locateDataDir() {
        String configured = System.getProperty("matchcard.dataDir",
                System.getenv().getOrDefault("MATCHCARD_DATA_DIR", ""));
        if (configured != null && !configured.isBlank()) {
            return Paths.get(configured.trim()).toAbsolutePath();
        }
        return Paths.get("data").toAbsolutePath();
    }

    public static Path locateDataFile(String name) {
        return locateDataDir().resolve(name);
    }

    public static Path defaultCacheRoot() {
        return locateDataDir().resolve("cache");
    }

    public static Path settingsPath() {
        return locateDataFile("matchcard.json");
    }
}
