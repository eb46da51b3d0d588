package org.matchcard.cache;

import org.matchcard.model.AssetKey;
import org.matchcard.model.AssetKind;
import org.matchcard.model.CacheStats;
import org.matchcard.util.DebugLog;
import org.matchcard.util.Deadline;

import javax.imageio.ImageIO;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.channels.ClosedByInterruptException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Local copy of Data Dragon icons, laid out as {@code {root}/champions/{name}.png} and
 * {@code {root}/items/{id}.png}.
 * <p>
 * Lookups go index, then disk, then network. At most one download per key runs at a time; callers
 * that arrive while it is in flight wait on the same gate and see the same outcome. A failed
 * download leaves the key absent so the next request retries it. Files land via temp file plus
 * rename, so a half-written icon is never served.
 */
public class AssetCache {
    private static final Pattern CHAMPION_NAME = Pattern.compile("[A-Za-z0-9]+");
    private static final Pattern ITEM_ID = Pattern.compile("[0-9]+");
    private static final String PNG = ".png";

    private final Path root;
    private final URI assetBase;
    private final String version;
    private final AssetSource source;
    private final Duration downloadTimeout;
    private final Map<AssetKey, Path> index = new ConcurrentHashMap<>();
    private final Map<AssetKey, CompletableFuture<Optional<Path>>> inFlight = new ConcurrentHashMap<>();
    private final AtomicInteger downloads = new AtomicInteger();

    public AssetCache(Path root, URI assetBase, String version, AssetSource source, Duration downloadTimeout) {
        this.root = root;
        this.assetBase = assetBase;
        this.version = version;
        this.source = source;
        this.downloadTimeout = downloadTimeout;
        for (AssetKind kind : AssetKind.values()) {
            try {
                Files.createDirectories(root.resolve(kind.directory()));
            } catch (IOException e) {
                DebugLog.warn("[AssetCache] Could not create " + root.resolve(kind.directory()), e);
            }
        }
        scanExisting();
        DebugLog.log("[AssetCache] Initialised at " + root + " for version " + version
                + " with " + index.size() + " cached files");
    }

    public Optional<Path> championIcon(String championName) throws InterruptedException {
        return icon(AssetKey.champion(championName), Deadline.none());
    }

    public Optional<Path> championIcon(String championName, Deadline deadline) throws InterruptedException {
        return icon(AssetKey.champion(championName), deadline);
    }

    public Optional<Path> itemIcon(int itemId) throws InterruptedException {
        return itemIcon(itemId, Deadline.none());
    }

    public Optional<Path> itemIcon(int itemId, Deadline deadline) throws InterruptedException {
        if (itemId == 0) {
            return Optional.empty();
        }
        return icon(AssetKey.item(itemId), deadline);
    }

    public Optional<Path> icon(AssetKey key) throws InterruptedException {
        return icon(key, Deadline.none());
    }

    /**
     * Resolves {@code key} to a local file, downloading it if needed. Returns empty for the empty item
     * slot, for identifiers that cannot name a file, and when the download fails or the deadline runs
     * out while waiting on another caller's download.
     *
     * @throws InterruptedException if the calling thread is interrupted; no gate is left behind
     */
    public Optional<Path> icon(AssetKey key, Deadline deadline) throws InterruptedException {
        if (key.isEmptySlot()) {
            return Optional.empty();
        }
        if (!isValidIdentifier(key)) {
            DebugLog.warn("[AssetCache] Rejecting malformed asset identifier " + key);
            return Optional.empty();
        }
        Path cached = indexed(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        Path target = pathFor(key);
        if (Files.isRegularFile(target)) {
            index.putIfAbsent(key, target);
            return Optional.of(target);
        }
        return fetch(key, target, deadline);
    }

    /**
     * Index entry for {@code key}, or null when there is none or its file has been deleted since.
     * A stale entry is dropped so the lookup continues as a miss.
     */
    private Path indexed(AssetKey key) {
        Path cached = index.get(key);
        if (cached == null) {
            return null;
        }
        if (Files.isRegularFile(cached)) {
            return cached;
        }
        index.remove(key, cached);
        DebugLog.log("[AssetCache] Dropped stale index entry for " + key);
        return null;
    }

    private Optional<Path> fetch(AssetKey key, Path target, Deadline deadline) throws InterruptedException {
        while (true) {
            CompletableFuture<Optional<Path>> gate = new CompletableFuture<>();
            CompletableFuture<Optional<Path>> existing = inFlight.putIfAbsent(key, gate);
            if (existing == null) {
                return runDownload(key, target, deadline, gate);
            }
            try {
                return existing.get(deadline.remainingNanos(), TimeUnit.NANOSECONDS);
            } catch (CancellationException e) {
                // the owning render was cancelled; this caller still wants the icon
                DebugLog.log("[AssetCache] Download owner for " + key + " cancelled, retrying");
            } catch (ExecutionException e) {
                DebugLog.warn("[AssetCache] Shared download for " + key + " failed", e.getCause());
                return Optional.empty();
            } catch (TimeoutException e) {
                DebugLog.log("[AssetCache] Gave up waiting for in-flight download of " + key);
                return Optional.empty();
            }
        }
    }

    private Optional<Path> runDownload(AssetKey key, Path target, Deadline deadline,
                                       CompletableFuture<Optional<Path>> gate) throws InterruptedException {
        Optional<Path> result = Optional.empty();
        boolean settled = false;
        try {
            // another caller may have finished between our miss and winning the gate
            Path cached = indexed(key);
            if (cached != null) {
                result = Optional.of(cached);
            } else if (Files.isRegularFile(target)) {
                index.putIfAbsent(key, target);
                result = Optional.of(target);
            } else {
                result = download(key, target, deadline);
            }
            settled = true;
            return result;
        } finally {
            inFlight.remove(key, gate);
            if (settled) {
                gate.complete(result);
            } else {
                gate.cancel(false);
            }
        }
    }

    private Optional<Path> download(AssetKey key, Path target, Deadline deadline) throws InterruptedException {
        if (deadline.isExpired()) {
            return Optional.empty();
        }
        URI uri = uriFor(key);
        downloads.incrementAndGet();
        byte[] data;
        try {
            data = source.download(uri, deadline.remainingOr(downloadTimeout));
        } catch (IOException e) {
            DebugLog.warn("[AssetCache] Error downloading " + uri, e);
            return Optional.empty();
        }
        if (!decodes(data)) {
            DebugLog.warn("[AssetCache] Discarding undecodable image from " + uri);
            return Optional.empty();
        }

        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), key.identifier() + "-", ".tmp");
            Files.write(temp, data);
            moveIntoPlace(temp, target);
            temp = null;
            index.put(key, target);
            DebugLog.log("[AssetCache] Downloaded and cached " + key + " -> " + target);
            return Optional.of(target);
        } catch (ClosedByInterruptException e) {
            throw new InterruptedException("Interrupted while storing " + key);
        } catch (IOException e) {
            DebugLog.warn("[AssetCache] Failed to store " + key + " at " + target, e);
            return Optional.empty();
        } finally {
            if (temp != null) {
                deleteTemp(temp);
            }
        }
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteTemp(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            DebugLog.warn("[AssetCache] Could not remove temp file " + temp, e);
        }
    }

    private static boolean decodes(byte[] data) {
        try {
            return ImageIO.read(new ByteArrayInputStream(data)) != null;
        } catch (IOException e) {
            return false;
        }
    }

    private void scanExisting() {
        for (AssetKind kind : AssetKind.values()) {
            for (Path file : listIcons(kind)) {
                String name = file.getFileName().toString();
                AssetKey key = new AssetKey(kind, name.substring(0, name.length() - PNG.length()));
                if (isValidIdentifier(key)) {
                    index.put(key, file);
                }
            }
        }
        DebugLog.log("[AssetCache] Cache scanned: " + index.size() + " files found");
    }

    private List<Path> listIcons(AssetKind kind) {
        Path dir = root.resolve(kind.directory());
        List<Path> icons = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return icons;
        }
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(PNG))
                    .forEach(icons::add);
        } catch (IOException e) {
            DebugLog.warn("[AssetCache] Failed to scan " + dir, e);
        }
        return icons;
    }

    public CacheStats stats() {
        int count = 0;
        long size = 0L;
        for (AssetKind kind : AssetKind.values()) {
            for (Path file : listIcons(kind)) {
                try {
                    size += Files.size(file);
                    count++;
                } catch (NoSuchFileException e) {
                    // removed by a concurrent cleanup
                } catch (IOException e) {
                    DebugLog.warn("[AssetCache] Could not stat " + file, e);
                }
            }
        }
        return new CacheStats(count, size);
    }

    /**
     * Deletes icons whose last access is older than {@code maxAge} and drops them from the index.
     * A lookup racing with the sweep may still index a file the sweep just removed; the next
     * lookup finds the file gone, drops the entry and downloads again.
     *
     * @return number of files deleted
     */
    public int cleanupOlderThan(Duration maxAge) {
        Instant cutoff = Instant.now().minus(maxAge);
        int deleted = 0;
        for (AssetKind kind : AssetKind.values()) {
            for (Path file : listIcons(kind)) {
                try {
                    BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
                    if (attributes.lastAccessTime().toInstant().isBefore(cutoff)) {
                        String name = file.getFileName().toString();
                        AssetKey key = new AssetKey(kind, name.substring(0, name.length() - PNG.length()));
                        index.remove(key, file);
                        if (Files.deleteIfExists(file)) {
                            deleted++;
                        }
                    }
                } catch (NoSuchFileException e) {
                    // already gone
                } catch (IOException e) {
                    DebugLog.warn("[AssetCache] Failed to delete cache file " + file, e);
                }
            }
        }
        if (deleted > 0) {
            DebugLog.log("[AssetCache] Cache cleanup: deleted " + deleted + " old files");
        }
        return deleted;
    }

    public Path pathFor(AssetKey key) {
        return root.resolve(key.kind().directory()).resolve(key.fileName());
    }

    public URI uriFor(AssetKey key) {
        String base = assetBase.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + "/" + version + "/img/" + key.kind().pathSegment() + "/" + key.fileName());
    }

    public boolean isCached(AssetKey key) {
        return indexed(key) != null || Files.isRegularFile(pathFor(key));
    }

    /** Network fetches attempted since construction. */
    public int downloadCount() {
        return downloads.get();
    }

    public int indexedCount() {
        return index.size();
    }

    public Path root() {
        return root;
    }

    public String version() {
        return version;
    }

    private static boolean isValidIdentifier(AssetKey key) {
        Pattern pattern = key.kind() == AssetKind.CHAMPION ? CHAMPION_NAME : ITEM_ID;
        return pattern.matcher(key.identifier()).matches();
    }
}
