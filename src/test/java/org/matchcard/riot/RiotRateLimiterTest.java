package org.matchcard.riot;

import org.junit.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class RiotRateLimiterTest {
    private static final long SECOND = TimeUnit.SECONDS.toNanos(1);

    @Test
    public void testShortWindowBlocksOnceFull() {
        RiotRateLimiter limiter = new RiotRateLimiter(3, Duration.ofSeconds(1), 100, Duration.ofMinutes(2));
        long t0 = 1_000 * SECOND;

        assertEquals(0L, limiter.tryReserve(t0));
        assertEquals(0L, limiter.tryReserve(t0 + 10));
        assertEquals(0L, limiter.tryReserve(t0 + 20));
        long wait = limiter.tryReserve(t0 + 30);

        assertTrue(wait > 0L);
        assertEquals(SECOND - 30, wait);
        assertEquals(0L, limiter.tryReserve(t0 + SECOND));
    }

    @Test
    public void testLongWindowAppliesAcrossShortWindows() {
        RiotRateLimiter limiter = new RiotRateLimiter(2, Duration.ofSeconds(1), 3, Duration.ofSeconds(10));
        long t0 = 50 * SECOND;

        assertEquals(0L, limiter.tryReserve(t0));
        assertEquals(0L, limiter.tryReserve(t0 + 1));
        assertEquals(0L, limiter.tryReserve(t0 + 2 * SECOND));
        long wait = limiter.tryReserve(t0 + 4 * SECOND);

        assertEquals(6 * SECOND, wait);
        assertEquals(0L, limiter.tryReserve(t0 + 10 * SECOND + 1));
    }

    @Test
    public void testRejectedRequestDoesNotConsumeQuota() {
        RiotRateLimiter limiter = new RiotRateLimiter(1, Duration.ofSeconds(1), 0, Duration.ZERO);
        long t0 = 7 * SECOND;

        assertEquals(0L, limiter.tryReserve(t0));
        assertTrue(limiter.tryReserve(t0 + 100) > 0L);
        assertTrue(limiter.tryReserve(t0 + 200) > 0L);
        assertEquals(0L, limiter.tryReserve(t0 + SECOND));
    }

    @Test
    public void testAcquireReturnsImmediatelyWithRoom() throws Exception {
        RiotRateLimiter limiter = RiotRateLimiter.personalKey();
        long start = System.nanoTime();
        for (int i = 0; i < 5; i++) {
            limiter.acquire();
        }
        assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(1));
    }
}
