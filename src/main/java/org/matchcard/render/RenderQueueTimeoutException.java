package org.matchcard.render;

import java.time.Duration;

/**
 * No render slot freed up in time. Nothing was drawn; the caller may try again later.
 */
public class RenderQueueTimeoutException extends RenderException {
    private final Duration waited;

    public RenderQueueTimeoutException(Duration waited) {
        super("Render queue is full. Please try again later.");
        this.waited = waited;
    }

    public Duration waited() {
        return waited;
    }
}
