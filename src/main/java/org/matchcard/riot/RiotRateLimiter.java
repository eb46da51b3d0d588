package org.matchcard.riot;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Sliding-window limiter for Riot's per-key quotas. Any number of windows may be stacked
 * (personal keys get 20 req / 1s and 100 req / 2min); a request goes out only when it fits all of them.
 */
public class RiotRateLimiter {
    private final List<Window> windows = new ArrayList<>();

    public RiotRateLimiter(int shortLimit, Duration shortWindow, int longLimit, Duration longWindow) {
        addWindow(shortLimit, shortWindow);
        addWindow(longLimit, longWindow);
    }

    public static RiotRateLimiter personalKey() {
        return new RiotRateLimiter(20, Duration.ofSeconds(1), 100, Duration.ofMinutes(2));
    }

    private void addWindow(int limit, Duration length) {
        if (limit > 0 && length != null && !length.isZero() && !length.isNegative()) {
            windows.add(new Window(limit, length.toNanos()));
        }
    }

    /**
     * Blocks until another request fits inside every window.
     */
    public void acquire() throws InterruptedException {
        while (true) {
            long waitNanos = tryReserve(System.nanoTime());
            if (waitNanos == 0L) {
                return;
            }
            // ceiling to millis so we never spin on a zero sleep
            Thread.sleep(Math.max(1L, (waitNanos + 999_999L) / 1_000_000L));
        }
    }

    /**
     * Records a request at {@code now} if all windows have room.
     *
     * @return 0 when reserved, otherwise nanos until the fullest window frees a slot
     */
    synchronized long tryReserve(long now) {
        long waitNanos = 0L;
        for (Window window : windows) {
            waitNanos = Math.max(waitNanos, window.waitNanos(now));
        }
        if (waitNanos > 0L) {
            return waitNanos;
        }
        for (Window window : windows) {
            window.stamps.addLast(now);
        }
        return 0L;
    }

    private static final class Window {
        private final int limit;
        private final long lengthNanos;
        private final Deque<Long> stamps = new ArrayDeque<>();

        Window(int limit, long lengthNanos) {
            this.limit = limit;
            this.lengthNanos = lengthNanos;
        }

        long waitNanos(long now) {
            long threshold = now - lengthNanos;
            while (!stamps.isEmpty() && stamps.peekFirst() <= threshold) {
                stamps.removeFirst();
            }
            if (stamps.size() < limit) {
                return 0L;
            }
            return Math.max(1L, lengthNanos - (now - stamps.peekFirst()));
        }
    }
}
