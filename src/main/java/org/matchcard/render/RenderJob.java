package org.matchcard.render;

import org.matchcard.model.MatchData;
import org.matchcard.model.RiotAccount;
import org.matchcard.util.Deadline;

import java.util.concurrent.atomic.AtomicLong;

/**
 * One render in flight: who asked, for which match, and until when.
 */
final class RenderJob {
    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final long id = SEQUENCE.incrementAndGet();
    private final RiotAccount account;
    private final MatchData match;
    private final Deadline deadline;

    RenderJob(RiotAccount account, MatchData match, Deadline deadline) {
        this.account = account;
        this.match = match;
        this.deadline = deadline;
    }

    /**
     * Fails fast if the deadline passed or the thread was interrupted. Called between stages.
     */
    void checkpoint(String stage) throws RenderCancelledException {
        if (Thread.currentThread().isInterrupted()) {
            throw new RenderCancelledException("Render " + id + " cancelled " + stage, false);
        }
        if (deadline.isExpired()) {
            throw new RenderCancelledException("Render " + id + " deadline expired " + stage, true);
        }
    }

    /**
     * Maps an interrupt at a suspension point to the matching cancellation error and keeps the
     * interrupt flag set for the caller.
     */
    RenderCancelledException cancelled(String stage, InterruptedException cause) {
        Thread.currentThread().interrupt();
        boolean expired = deadline.isExpired();
        String reason = expired ? " deadline expired " : " cancelled ";
        return new RenderCancelledException("Render " + id + reason + stage, expired, cause);
    }

    long id() {
        return id;
    }

    RiotAccount account() {
        return account;
    }

    MatchData match() {
        return match;
    }

    Deadline deadline() {
        return deadline;
    }

    @Override
    public String toString() {
        return "RenderJob[" + id + ", match=" + match.matchId() + ", " + deadline + "]";
    }
}
