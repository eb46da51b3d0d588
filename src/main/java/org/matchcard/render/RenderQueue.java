package org.matchcard.render;

import org.matchcard.util.DebugLog;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Admission gate for renders: a fair semaphore with a timed acquire. Excess requests wait up to the
 * given timeout and are then refused rather than queued indefinitely.
 */
public class RenderQueue {
    private final int capacity;
    private final Semaphore permits;
    private final AtomicInteger inUse = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();

    public RenderQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, was " + capacity);
        }
        this.capacity = capacity;
        this.permits = new Semaphore(capacity, true);
    }

    /**
     * Waits up to {@code timeout} for a slot.
     *
     * @throws RenderQueueTimeoutException if no slot became free in time
     * @throws InterruptedException        if interrupted while waiting; no slot is held
     */
    public Slot acquire(Duration timeout) throws RenderQueueTimeoutException, InterruptedException {
        if (!permits.tryAcquire(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
            DebugLog.warn("[RenderQueue] Render queue full, request timed out waiting for slot");
            throw new RenderQueueTimeoutException(timeout);
        }
        int now = inUse.incrementAndGet();
        peak.accumulateAndGet(now, Math::max);
        return new Slot();
    }

    public int capacity() {
        return capacity;
    }

    public int inUse() {
        return inUse.get();
    }

    /** Highest number of slots held at the same time since construction. */
    public int peakInUse() {
        return peak.get();
    }

    public int available() {
        return permits.availablePermits();
    }

    /**
     * A held slot. {@link #close()} releases it; further calls are no-ops.
     */
    public final class Slot implements AutoCloseable {
        private final AtomicBoolean released = new AtomicBoolean();

        private Slot() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                inUse.decrementAndGet();
                permits.release();
            }
        }

        public boolean isReleased() {
            return released.get();
        }
    }
}
