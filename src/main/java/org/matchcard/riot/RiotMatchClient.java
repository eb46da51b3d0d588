package org.matchcard.riot;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.merakianalytics.orianna.types.common.Platform;
import org.matchcard.model.MatchData;
import org.matchcard.model.RiotAccount;
import org.matchcard.util.DebugLog;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads accounts and finished matches from the regional Riot endpoints (account-v1, match-v5).
 */
public class RiotMatchClient {
    private final RiotApiClient apiClient;
    private final URI regionalBase;
    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public RiotMatchClient(RiotApiClient apiClient, URI regionalBase) {
        this.apiClient = apiClient;
        this.regionalBase = regionalBase;
    }

    public static RiotMatchClient forPlatform(Platform platform, RiotApiClient apiClient) {
        return new RiotMatchClient(apiClient, URI.create("https://" + routingHostForPlatform(platform)));
    }

    public Optional<RiotAccount> findAccount(String gameName, String tagLine) throws IOException, InterruptedException {
        URI uri = resolve("/riot/account/v1/accounts/by-riot-id/" + encode(gameName) + "/" + encode(tagLine));
        Optional<String> body = apiClient.find(uri);
        if (body.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(body.get(), RiotAccount.class));
    }

    /**
     * Most recent match ids for {@code puuid}, newest first. Riot caps {@code count} at 100.
     */
    public List<String> recentMatchIds(String puuid, int count) throws IOException, InterruptedException {
        int fetchCount = Math.min(Math.max(count, 1), 100);
        URI uri = resolve("/lol/match/v5/matches/by-puuid/" + encode(puuid) + "/ids?count=" + fetchCount);
        JsonNode root = mapper.readTree(apiClient.get(uri));
        List<String> ids = new ArrayList<>();
        if (root != null && root.isArray()) {
            for (JsonNode id : root) {
                ids.add(id.asText());
            }
        }
        return ids;
    }

    public MatchData fetchMatch(String matchId) throws IOException, InterruptedException {
        URI uri = resolve("/lol/match/v5/matches/" + encode(matchId));
        MatchData match = mapper.readValue(apiClient.get(uri), MatchData.class);
        if (match.info() == null) {
            throw new IOException("Match " + matchId + " has no info section");
        }
        return match;
    }

    private URI resolve(String path) {
        String base = regionalBase.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + path);
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /**
     * Regional cluster that serves account-v1 and match-v5 for a platform.
     */
    public static String routingHostForPlatform(Platform p) {
        return switch (p.name()) {
            case "EUROPE_WEST", "EUROPE_NORTH_EAST", "TURKEY", "RUSSIA" -> "europe.api.riotgames.com";
            case "NORTH_AMERICA", "BRAZIL", "LATIN_AMERICA_NORTH", "LATIN_AMERICA_SOUTH" -> "americas.api.riotgames.com";
            case "KOREA", "JAPAN" -> "asia.api.riotgames.com";
            case "OCEANIA" -> "sea.api.riotgames.com";
            default -> routingHostForTag(p.getTag());
        };
    }

    // platform tags come as "EUW1", "NA1", "KR", ...
    static String routingHostForTag(String tag) {
        String prefix = tag.toUpperCase(Locale.ROOT).replaceAll("[0-9]+$", "");
        return switch (prefix) {
            case "EUW", "EUN", "EUNE", "TR", "RU", "ME" -> "europe.api.riotgames.com";
            case "NA", "BR", "LA", "LAN", "LAS" -> "americas.api.riotgames.com";
            case "KR", "JP" -> "asia.api.riotgames.com";
            case "OC", "OCE", "PH", "SG", "TH", "TW", "VN" -> "sea.api.riotgames.com";
            default -> "europe.api.riotgames.com";
        };
    }

    public static Platform parsePlatform(String tag) {
        if (tag == null || tag.isBlank()) return Platform.EUROPE_WEST;
        String normalized = tag.trim().toUpperCase(Locale.ROOT).replace("-", "_");
        try {
            return Platform.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            // also accept platform tags such as "KR" or "NA1"
            for (Platform p : Platform.values()) {
                if (p.getTag().equalsIgnoreCase(normalized)) {
                    return p;
                }
            }
            DebugLog.warn("[RiotMatchClient] Unknown platform '" + tag + "', falling back to EUW.");
            return Platform.EUROPE_WEST;
        }
    }
}
