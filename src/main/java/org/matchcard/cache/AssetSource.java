package org.matchcard.cache;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * Remote side of the icon cache. Implementations must be interruptible: an interrupt aborts the
 * transfer with {@link InterruptedException}.
 */
public interface AssetSource {

    /**
     * Downloads {@code uri} and returns the body; any non-success response is an {@link IOException}.
     */
    byte[] download(URI uri, Duration timeout) throws IOException, InterruptedException;
}
