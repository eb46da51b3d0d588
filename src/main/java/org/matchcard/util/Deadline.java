package org.matchcard.util;

import java.time.Duration;

/**
 * A point on the {@link System#nanoTime()} clock shared by every wait of one operation.
 */
public final class Deadline {
    private static final Deadline NONE = new Deadline(Long.MAX_VALUE, true);

    private final long deadlineNanos;
    private final boolean unbounded;

    private Deadline(long deadlineNanos, boolean unbounded) {
        this.deadlineNanos = deadlineNanos;
        this.unbounded = unbounded;
    }

    public static Deadline after(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative: " + timeout);
        }
        return new Deadline(System.nanoTime() + timeout.toNanos(), false);
    }

    public static Deadline none() {
        return NONE;
    }

    public long remainingNanos() {
        if (unbounded) return Long.MAX_VALUE;
        return Math.max(0L, deadlineNanos - System.nanoTime());
    }

    public Duration remaining() {
        return unbounded ? Duration.ofNanos(Long.MAX_VALUE) : Duration.ofNanos(remainingNanos());
    }

    /**
     * Remaining time capped at {@code cap}; used to bound a single request or wait.
     */
    public Duration remainingOr(Duration cap) {
        long capNanos = cap.toNanos();
        return Duration.ofNanos(Math.min(capNanos, remainingNanos()));
    }

    public boolean isExpired() {
        return !unbounded && remainingNanos() == 0L;
    }

    @Override
    public String toString() {
        return unbounded ? "Deadline[none]" : "Deadline[" + remaining().toMillis() + "ms left]";
    }
}
