package org.matchcard.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.matchcard.layout.RowOrder;
import org.matchcard.layout.ScoreboardGeometry;
import org.matchcard.util.AppPaths;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Everything the renderer and icon cache read at startup. Defaults reproduce the stock scoreboard;
 * a JSON file (see {@link SettingsStore}) and {@code MATCHCARD_*} variables override them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RenderSettings {
    public static final String LATEST_VERSION = "latest";

    private String assetBaseUrl = "https://ddragon.leagueoflegends.com/cdn";
    private String versionsUrl = "https://ddragon.leagueoflegends.com/api/versions.json";
    private String dataDragonVersion = LATEST_VERSION;
    private String cacheRoot;
    private int renderConcurrency = 2;
    private int renderTimeoutSeconds = 30;
    private int admissionTimeoutSeconds = 30;
    private int downloadTimeoutSeconds = 10;
    // icon-loading threads per admitted render; the shared pool holds renderConcurrency times this
    private int assetThreads = 10;
    private int imageWidth = 750;
    private int headerHeight = 80;
    private int teamHeaderHeight = 32;
    private int columnHeaderHeight = 22;
    private int rowHeight = 44;
    private int teamSpacing = 12;
    private int bottomPadding = 16;
    private int mainItemSlots = 6;
    private RowOrder rowOrder = RowOrder.TEAM_POSITION;

    /**
     * Applies {@code MATCHCARD_*} overrides. Values that fail to parse leave the current setting.
     */
    public RenderSettings applyEnvironment(Map<String, String> env) {
        assetBaseUrl = env.getOrDefault("MATCHCARD_ASSET_BASE_URL", assetBaseUrl);
        versionsUrl = env.getOrDefault("MATCHCARD_VERSIONS_URL", versionsUrl);
        dataDragonVersion = env.getOrDefault("MATCHCARD_DDRAGON_VERSION", dataDragonVersion);
        cacheRoot = env.getOrDefault("MATCHCARD_CACHE_ROOT", cacheRoot);
        renderConcurrency = parseInt(env, "MATCHCARD_RENDER_CONCURRENCY", renderConcurrency);
        renderTimeoutSeconds = parseInt(env, "MATCHCARD_RENDER_TIMEOUT_SECONDS", renderTimeoutSeconds);
        admissionTimeoutSeconds = parseInt(env, "MATCHCARD_ADMISSION_TIMEOUT_SECONDS", admissionTimeoutSeconds);
        downloadTimeoutSeconds = parseInt(env, "MATCHCARD_DOWNLOAD_TIMEOUT_SECONDS", downloadTimeoutSeconds);
        assetThreads = parseInt(env, "MATCHCARD_ASSET_THREADS", assetThreads);
        mainItemSlots = parseInt(env, "MATCHCARD_MAIN_ITEM_SLOTS", mainItemSlots);
        String order = env.get("MATCHCARD_ROW_ORDER");
        if (order != null && !order.isBlank()) {
            try {
                rowOrder = RowOrder.valueOf(order.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                System.err.println("[RenderSettings] Unknown row order '" + order + "', keeping " + rowOrder);
            }
        }
        return this;
    }

    /**
     * @throws IllegalArgumentException naming the first invalid setting
     */
    public RenderSettings validate() {
        requirePositive("renderConcurrency", renderConcurrency);
        requirePositive("renderTimeoutSeconds", renderTimeoutSeconds);
        requirePositive("admissionTimeoutSeconds", admissionTimeoutSeconds);
        requirePositive("downloadTimeoutSeconds", downloadTimeoutSeconds);
        requirePositive("assetThreads", assetThreads);
        requirePositive("imageWidth", imageWidth);
        requirePositive("headerHeight", headerHeight);
        requirePositive("teamHeaderHeight", teamHeaderHeight);
        requirePositive("columnHeaderHeight", columnHeaderHeight);
        requirePositive("rowHeight", rowHeight);
        requireNonNegative("teamSpacing", teamSpacing);
        requireNonNegative("bottomPadding", bottomPadding);
        if (mainItemSlots != 6 && mainItemSlots != 7) {
            throw new IllegalArgumentException("mainItemSlots must be 6 or 7, was " + mainItemSlots);
        }
        if (dataDragonVersion == null || dataDragonVersion.isBlank()) {
            throw new IllegalArgumentException("dataDragonVersion must not be blank");
        }
        if (rowOrder == null) {
            throw new IllegalArgumentException("rowOrder must be set");
        }
        URI.create(assetBaseUrl);
        return this;
    }

    @JsonIgnore
    public ScoreboardGeometry geometry() {
        return new ScoreboardGeometry(imageWidth, headerHeight, teamHeaderHeight, columnHeaderHeight,
                rowHeight, teamSpacing, bottomPadding, mainItemSlots);
    }

    @JsonIgnore
    public Path cacheRootPath() {
        return cacheRoot == null || cacheRoot.isBlank() ? AppPaths.defaultCacheRoot() : Paths.get(cacheRoot);
    }

    @JsonIgnore
    public Duration renderTimeout() { return Duration.ofSeconds(renderTimeoutSeconds); }

    @JsonIgnore
    public Duration admissionTimeout() { return Duration.ofSeconds(admissionTimeoutSeconds); }

    @JsonIgnore
    public Duration downloadTimeout() { return Duration.ofSeconds(downloadTimeoutSeconds); }

    @JsonIgnore
    public boolean usesLatestVersion() {
        return LATEST_VERSION.equalsIgnoreCase(dataDragonVersion);
    }

    private static int parseInt(Map<String, String> env, String key, int fallback) {
        String raw = env.get(key);
        if (raw == null) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            System.err.println("[RenderSettings] Ignoring non-numeric " + key + "=" + raw);
            return fallback;
        }
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, was " + value);
        }
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative, was " + value);
        }
    }

    // Jackson-friendly accessors
    public String getAssetBaseUrl() { return assetBaseUrl; }
    public void setAssetBaseUrl(String assetBaseUrl) { this.assetBaseUrl = assetBaseUrl; }
    public String getVersionsUrl() { return versionsUrl; }
    public void setVersionsUrl(String versionsUrl) { this.versionsUrl = versionsUrl; }
    public String getDataDragonVersion() { return dataDragonVersion; }
    public void setDataDragonVersion(String dataDragonVersion) { this.dataDragonVersion = dataDragonVersion; }
    public String getCacheRoot() { return cacheRoot; }
    public void setCacheRoot(String cacheRoot) { this.cacheRoot = cacheRoot; }
    public int getRenderConcurrency() { return renderConcurrency; }
    public void setRenderConcurrency(int renderConcurrency) { this.renderConcurrency = renderConcurrency; }
    public int getRenderTimeoutSeconds() { return renderTimeoutSeconds; }
    public void setRenderTimeoutSeconds(int renderTimeoutSeconds) { this.renderTimeoutSeconds = renderTimeoutSeconds; }
    public int getAdmissionTimeoutSeconds() { return admissionTimeoutSeconds; }
    public void setAdmissionTimeoutSeconds(int admissionTimeoutSeconds) { this.admissionTimeoutSeconds = admissionTimeoutSeconds; }
    public int getDownloadTimeoutSeconds() { return downloadTimeoutSeconds; }
    public void setDownloadTimeoutSeconds(int downloadTimeoutSeconds) { this.downloadTimeoutSeconds = downloadTimeoutSeconds; }
    public int getAssetThreads() { return assetThreads; }
    public void setAssetThreads(int assetThreads) { this.assetThreads = assetThreads; }
    public int getImageWidth() { return imageWidth; }
    public void setImageWidth(int imageWidth) { this.imageWidth = imageWidth; }
    public int getHeaderHeight() { return headerHeight; }
    public void setHeaderHeight(int headerHeight) { this.headerHeight = headerHeight; }
    public int getTeamHeaderHeight() { return teamHeaderHeight; }
    public void setTeamHeaderHeight(int teamHeaderHeight) { this.teamHeaderHeight = teamHeaderHeight; }
    public int getColumnHeaderHeight() { return columnHeaderHeight; }
    public void setColumnHeaderHeight(int columnHeaderHeight) { this.columnHeaderHeight = columnHeaderHeight; }
    public int getRowHeight() { return rowHeight; }
    public void setRowHeight(int rowHeight) { this.rowHeight = rowHeight; }
    public int getTeamSpacing() { return teamSpacing; }
    public void setTeamSpacing(int teamSpacing) { this.teamSpacing = teamSpacing; }
    public int getBottomPadding() { return bottomPadding; }
    public void setBottomPadding(int bottomPadding) { this.bottomPadding = bottomPadding; }
    public int getMainItemSlots() { return mainItemSlots; }
    public void setMainItemSlots(int mainItemSlots) { this.mainItemSlots = mainItemSlots; }
    public RowOrder getRowOrder() { return rowOrder; }
    public void setRowOrder(RowOrder rowOrder) { this.rowOrder = rowOrder; }
}
