package org.matchcard;

import com.merakianalytics.orianna.types.common.Platform;
import org.matchcard.cache.AssetCache;
import org.matchcard.cache.DataDragonClient;
import org.matchcard.config.RenderSettings;
import org.matchcard.config.SettingsStore;
import org.matchcard.model.MatchData;
import org.matchcard.model.RiotAccount;
import org.matchcard.render.RenderException;
import org.matchcard.render.ScoreboardRenderer;
import org.matchcard.riot.MatchDataStore;
import org.matchcard.riot.RiotApiClient;
import org.matchcard.riot.RiotMatchClient;
import org.matchcard.riot.RiotRateLimiter;
import org.matchcard.util.AppPaths;

import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * CLI entry to render one match scoreboard to a PNG file.
 * Usage (example):
 *   RIOT_API_KEY=... RIOT_PLATFORM=EUROPE_WEST mvn exec:java -Dexec.mainClass=org.matchcard.SummaryRunner \
 *       -Dexec.args="EUW1_7000000000 Faker#KR1 scoreboard.png"
 * The first argument may also be a match-v5 JSON file, in which case no API key is needed as long as
 * the second argument is a puuid.
 */
public class SummaryRunner {
    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: SummaryRunner <match.json | matchId> <puuid | gameName#tagLine> [out.png]");
            System.exit(2);
            return;
        }
        String matchArg = args[0];
        String playerArg = args[1];
        Path output = Paths.get(args.length > 2 ? args[2] : "scoreboard.png");

        RenderSettings settings = new SettingsStore(AppPaths.settingsPath().toFile()).load()
                .applyEnvironment(System.getenv())
                .validate();

        DataDragonClient dataDragon = new DataDragonClient();
        String version = resolveVersion(settings, dataDragon);
        AssetCache cache = new AssetCache(settings.cacheRootPath(), URI.create(settings.getAssetBaseUrl()),
                version, dataDragon, settings.downloadTimeout());

        RiotMatchClient riot = null;
        File matchFile = new File(matchArg);
        MatchData match;
        if (matchFile.isFile()) {
            match = new MatchDataStore(matchFile).load();
        } else {
            riot = riotClient();
            match = riot.fetchMatch(matchArg);
        }

        RiotAccount account;
        if (playerArg.contains("#")) {
            if (riot == null) {
                riot = riotClient();
            }
            String[] parts = playerArg.split("#", 2);
            account = riot.findAccount(parts[0], parts[1]).orElse(null);
            if (account == null) {
                System.err.println("[SummaryRunner] No Riot account named " + playerArg);
                System.exit(1);
                return;
            }
        } else {
            account = new RiotAccount(playerArg, playerArg, "");
        }

        try (ScoreboardRenderer renderer = new ScoreboardRenderer(cache, settings)) {
            byte[] png = renderer.renderSummary(account, match);
            Files.write(output, png);
            System.out.println("[SummaryRunner] Scoreboard for " + match.matchId() + " written to " + output.toAbsolutePath());
        } catch (RenderException e) {
            System.err.println("[SummaryRunner] Render failed: " + e.getMessage());
            System.exit(1);
        }
        System.out.println("[SummaryRunner] Icon cache: " + cache.stats());
    }

    private static String resolveVersion(RenderSettings settings, DataDragonClient dataDragon)
            throws IOException, InterruptedException {
        if (!settings.usesLatestVersion()) {
            return settings.getDataDragonVersion();
        }
        String version = dataDragon.latestVersion(URI.create(settings.getVersionsUrl()));
        System.out.println("[SummaryRunner] Using Data Dragon version " + version);
        return version;
    }

    private static RiotMatchClient riotClient() {
        String apiKey = System.getenv("RIOT_API_KEY");
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("RIOT_API_KEY is required to look up matches or accounts");
        }
        Platform platform = RiotMatchClient.parsePlatform(System.getenv().getOrDefault("RIOT_PLATFORM", "EUROPE_WEST"));
        RiotApiClient apiClient = new RiotApiClient(apiKey, RiotRateLimiter.personalKey());
        return RiotMatchClient.forPlatform(platform, apiClient);
    }
}
