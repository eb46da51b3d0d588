package org.matchcard.cache;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.matchcard.FakeAssetSource;
import org.matchcard.TestMatches;
import org.matchcard.model.AssetKey;
import org.matchcard.model.CacheStats;
import org.matchcard.util.Deadline;

import java.awt.Color;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributeView;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import static org.junit.Assert.*;

public class AssetCacheTest {
    private static final URI BASE = URI.create("https://ddragon.test/cdn/");

    @Rule
    public TemporaryFolder temp = new TemporaryFolder();

    private FakeAssetSource source;
    private Path root;
    private AssetCache cache;
    private ExecutorService pool;

    @Before
    public void setUp() throws IOException {
        source = new FakeAssetSource();
        root = temp.newFolder("icons").toPath();
        cache = new AssetCache(root, BASE, "14.1.1", source, Duration.ofSeconds(5));
        pool = Executors.newFixedThreadPool(8);
    }

    @After
    public void tearDown() {
        source.release();
        pool.shutdownNow();
    }

    @Test
    public void testEmptyItemSlotNeverTouchesCache() throws Exception {
        assertEquals(Optional.empty(), cache.itemIcon(0));
        assertEquals(0, source.calls());
        assertEquals(0, cache.downloadCount());
    }

    @Test
    public void testDownloadsOnceThenServesFromIndex() throws Exception {
        Optional<Path> first = cache.itemIcon(3340);
        Optional<Path> second = cache.itemIcon(3340);

        assertTrue(first.isPresent());
        assertEquals(first, second);
        assertEquals(root.resolve("items").resolve("3340.png"), first.get());
        assertTrue(Files.size(first.get()) > 0);
        assertEquals(1, source.calls());
        assertEquals(URI.create("https://ddragon.test/cdn/14.1.1/img/item/3340.png"), source.requested().get(0));
    }

    @Test
    public void testChampionIconsUseChampionDirectory() throws Exception {
        Optional<Path> icon = cache.championIcon("MissFortune");

        assertEquals(Optional.of(root.resolve("champions").resolve("MissFortune.png")), icon);
        assertEquals(URI.create("https://ddragon.test/cdn/14.1.1/img/champion/MissFortune.png"),
                cache.uriFor(AssetKey.champion("MissFortune")));
    }

    @Test
    public void testWarmStartFindsExistingFiles() throws Exception {
        cache.championIcon("Ahri");
        cache.itemIcon(6655);

        FakeAssetSource fresh = new FakeAssetSource();
        AssetCache restarted = new AssetCache(root, BASE, "14.1.1", fresh, Duration.ofSeconds(5));

        assertEquals(2, restarted.indexedCount());
        assertTrue(restarted.championIcon("Ahri").isPresent());
        assertTrue(restarted.itemIcon(6655).isPresent());
        assertEquals(0, fresh.calls());
    }

    @Test
    public void testConcurrentRequestsShareOneDownload() throws Exception {
        source.hold(1);
        int callers = 8;
        CountDownLatch ready = new CountDownLatch(callers);
        List<Future<Optional<Path>>> results = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            results.add(pool.submit(() -> {
                ready.countDown();
                return cache.championIcon("Jinx");
            }));
        }
        assertTrue(ready.await(5, TimeUnit.SECONDS));
        assertTrue(source.awaitEntrants(5000));
        Thread.sleep(100);
        source.release();

        Path expected = root.resolve("champions").resolve("Jinx.png");
        for (Future<Optional<Path>> result : results) {
            assertEquals(Optional.of(expected), result.get(10, TimeUnit.SECONDS));
        }
        assertEquals(1, source.calls());
    }

    @Test
    public void testFailedDownloadIsNotCachedAndRetried() throws Exception {
        source.failOn("/3047.png");

        assertEquals(Optional.empty(), cache.itemIcon(3047));
        assertFalse(cache.isCached(AssetKey.item(3047)));

        source.heal();
        assertTrue(cache.itemIcon(3047).isPresent());
        assertEquals(2, source.calls());
    }

    @Test
    public void testUndecodableBytesAreDiscarded() throws Exception {
        source.garbageOn("/Teemo.png");

        assertEquals(Optional.empty(), cache.championIcon("Teemo"));
        assertFalse(Files.exists(root.resolve("champions").resolve("Teemo.png")));
        assertEquals(0, leftoverTempFiles());
    }

    @Test
    public void testMalformedChampionNameIsRejected() throws Exception {
        assertEquals(Optional.empty(), cache.championIcon("../secrets"));
        assertEquals(Optional.empty(), cache.championIcon("Kai'Sa"));
        assertEquals(Optional.empty(), cache.championIcon(""));
        assertEquals(0, source.calls());
    }

    @Test
    public void testNegativeItemIdIsRejected() throws Exception {
        assertEquals(Optional.empty(), cache.itemIcon(-5));
        assertEquals(0, source.calls());
    }

    @Test
    public void testNoTempFilesRemainAfterDownloads() throws Exception {
        for (int id : new int[]{1001, 1036, 3006}) {
            assertTrue(cache.itemIcon(id).isPresent());
        }
        assertEquals(0, leftoverTempFiles());
    }

    @Test
    public void testExpiredDeadlineSkipsDownload() throws Exception {
        Deadline expired = Deadline.after(Duration.ZERO);

        assertEquals(Optional.empty(), cache.itemIcon(3031, expired));
        assertEquals(0, source.calls());
    }

    @Test
    public void testWaiterRetriesAfterOwnerInterrupted() throws Exception {
        source.hold(1);
        Future<Optional<Path>> owner = pool.submit(() -> cache.championIcon("Zed"));
        assertTrue(source.awaitEntrants(5000));

        Future<Optional<Path>> waiter = pool.submit(() -> cache.championIcon("Zed"));
        Thread.sleep(100);
        owner.cancel(true);
        Thread.sleep(100);
        source.release();

        assertEquals(Optional.of(root.resolve("champions").resolve("Zed.png")), waiter.get(10, TimeUnit.SECONDS));
        assertEquals(2, source.calls());
    }

    @Test
    public void testStatsCountsFilesAndBytes() throws Exception {
        cache.championIcon("Ahri");
        cache.itemIcon(3340);
        long expectedBytes = TestMatches.pngBytes(Color.ORANGE).length * 2L;

        CacheStats stats = cache.stats();

        assertEquals(2, stats.fileCount());
        assertEquals(expectedBytes, stats.totalSizeBytes());
    }

    @Test
    public void testCleanupRemovesOnlyStaleFiles() throws Exception {
        Path stale = cache.itemIcon(1001).get();
        Path fresh = cache.itemIcon(1036).get();
        FileTime old = FileTime.from(Instant.now().minus(40, ChronoUnit.DAYS));
        Files.getFileAttributeView(stale, BasicFileAttributeView.class).setTimes(old, old, null);

        int deleted = cache.cleanupOlderThan(Duration.ofDays(30));

        assertEquals(1, deleted);
        assertFalse(Files.exists(stale));
        assertTrue(Files.exists(fresh));
        assertFalse(cache.isCached(AssetKey.item(1001)));

        assertTrue(cache.itemIcon(1001).isPresent());
        assertEquals(3, source.calls());
    }

    @Test
    public void testConcurrentMixedKeysEachDownloadOnce() throws Exception {
        List<Callable<Optional<Path>>> tasks = new ArrayList<>();
        for (int round = 0; round < 4; round++) {
            for (String name : new String[]{"Garen", "Darius", "Lux"}) {
                tasks.add(() -> cache.championIcon(name));
            }
        }
        for (Future<Optional<Path>> future : pool.invokeAll(tasks, 10, TimeUnit.SECONDS)) {
            assertTrue(future.get().isPresent());
        }
        assertEquals(3, source.calls());
    }

    @Test
    public void testDeletedFileBehindIndexIsFetchedAgain() throws Exception {
        Path icon = cache.championIcon("Ahri").get();
        Files.delete(icon);

        Optional<Path> again = cache.championIcon("Ahri");

        assertEquals(Optional.of(icon), again);
        assertTrue(Files.isRegularFile(icon));
        assertEquals(2, source.calls());
    }

    @Test
    public void testLookupsRacingCleanupNeverKeepMissingFiles() throws Exception {
        String[] names = {"Annie", "Brand", "Corki", "Diana", "Ekko"};
        AtomicBoolean running = new AtomicBoolean(true);
        List<Future<?>> workers = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            workers.add(pool.submit(() -> {
                while (running.get()) {
                    for (String name : names) {
                        cache.championIcon(name);
                    }
                }
                return null;
            }));
        }
        workers.add(pool.submit(() -> {
            while (running.get()) {
                cache.cleanupOlderThan(Duration.ZERO);
            }
            return null;
        }));
        Thread.sleep(1500);
        running.set(false);
        for (Future<?> worker : workers) {
            worker.get(10, TimeUnit.SECONDS);
        }

        for (String name : names) {
            Optional<Path> icon = cache.championIcon(name);
            assertTrue(name, icon.isPresent());
            assertTrue(name + " points at a deleted file", Files.isRegularFile(icon.get()));
        }
    }

    private long leftoverTempFiles() throws IOException {
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".tmp")).count();
        }
    }
}
