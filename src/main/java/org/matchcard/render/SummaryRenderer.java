package org.matchcard.render;

import org.matchcard.model.MatchData;
import org.matchcard.model.RiotAccount;

import java.time.Duration;
import java.util.concurrent.Future;

public interface SummaryRenderer extends AutoCloseable {

    /**
     * Renders the post-game scoreboard for {@code account} as PNG bytes using the configured timeout.
     */
    byte[] renderSummary(RiotAccount account, MatchData match) throws RenderException;

    byte[] renderSummary(RiotAccount account, MatchData match, Duration timeout) throws RenderException;

    /**
     * Runs the render on a background thread. {@code cancel(true)} on the returned future aborts it;
     * a failed render surfaces its {@link RenderException} as the cause of the {@code ExecutionException}.
     */
    Future<byte[]> submit(RiotAccount account, MatchData match);

    @Override
    void close();
}
