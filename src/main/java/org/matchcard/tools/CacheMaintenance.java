package org.matchcard.tools;

import org.matchcard.cache.AssetCache;
import org.matchcard.cache.DataDragonClient;
import org.matchcard.config.RenderSettings;
import org.matchcard.config.SettingsStore;
import org.matchcard.util.AppPaths;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * Maintenance for the on-disk icon cache: {@code stats} or {@code cleanup <days>}.
 * Meant for a weekly cron job next to the bot.
 */
public class CacheMaintenance {
    public static void main(String[] args) throws IOException {
        String command = args.length == 0 ? "stats" : args[0];
        RenderSettings settings = new SettingsStore(AppPaths.settingsPath().toFile()).load()
                .applyEnvironment(System.getenv());
        // the version only matters for downloads, which maintenance never triggers
        AssetCache cache = new AssetCache(settings.cacheRootPath(), URI.create(settings.getAssetBaseUrl()),
                settings.getDataDragonVersion(), new DataDragonClient(), settings.downloadTimeout());

        switch (command) {
            case "stats" -> System.out.println("Cache at " + cache.root() + ": " + cache.stats());
            case "cleanup" -> {
                int days = args.length > 1 ? parseDays(args[1]) : 30;
                int deleted = cache.cleanupOlderThan(Duration.ofDays(days));
                System.out.println("Deleted " + deleted + " icons not accessed in " + days + " days; now " + cache.stats());
            }
            default -> {
                System.err.println("Usage: CacheMaintenance stats | cleanup <days>");
                System.exit(2);
            }
        }
    }

    private static int parseDays(String raw) {
        try {
            return Math.max(0, Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            System.err.println("Invalid day count '" + raw + "', using 30");
            return 30;
        }
    }
}
