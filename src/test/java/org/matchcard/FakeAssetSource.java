package org.matchcard;

import org.matchcard.cache.AssetSource;

import java.awt.Color;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory stand-in for Data Dragon. Counts calls, can fail chosen paths, serve garbage, or hold
 * every download until {@link #release()}.
 */
public class FakeAssetSource implements AssetSource {
    private final byte[] png = TestMatches.pngBytes(Color.ORANGE);
    private final AtomicInteger calls = new AtomicInteger();
    private final List<URI> requested = new CopyOnWriteArrayList<>();
    private final Set<String> failing = ConcurrentHashMap.newKeySet();
    private final Set<String> garbage = ConcurrentHashMap.newKeySet();
    private volatile CountDownLatch gate = new CountDownLatch(0);
    private volatile CountDownLatch entered = new CountDownLatch(0);

    @Override
    public byte[] download(URI uri, Duration timeout) throws IOException, InterruptedException {
        calls.incrementAndGet();
        requested.add(uri);
        entered.countDown();
        if (!gate.await(30, TimeUnit.SECONDS)) {
            throw new IOException("fake source gate never opened");
        }
        String path = uri.getPath();
        for (String suffix : failing) {
            if (path.endsWith(suffix)) {
                throw new IOException("HTTP 404 for " + uri);
            }
        }
        for (String suffix : garbage) {
            if (path.endsWith(suffix)) {
                return "not an image".getBytes();
            }
        }
        return png.clone();
    }

    /** Every subsequent download blocks until {@link #release()}. */
    public FakeAssetSource hold(int expectedEntrants) {
        gate = new CountDownLatch(1);
        entered = new CountDownLatch(expectedEntrants);
        return this;
    }

    public void release() {
        gate.countDown();
    }

    public boolean awaitEntrants(long millis) throws InterruptedException {
        return entered.await(millis, TimeUnit.MILLISECONDS);
    }

    public FakeAssetSource failOn(String pathSuffix) {
        failing.add(pathSuffix);
        return this;
    }

    public FakeAssetSource garbageOn(String pathSuffix) {
        garbage.add(pathSuffix);
        return this;
    }

    public void heal() {
        failing.clear();
        garbage.clear();
    }

    public int calls() {
        return calls.get();
    }

    public List<URI> requested() {
        return requested;
    }
}
