package org.matchcard.render;

/**
 * A render that produced no image. Subclasses tell the caller why.
 */
public class RenderException extends Exception {
    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
