package org.matchcard.render;

/**
 * A render that had been admitted (or was waiting for admission) was stopped by its deadline or
 * by the caller.
 */
public class RenderCancelledException extends RenderException {
    private final boolean deadlineExpired;

    public RenderCancelledException(String message, boolean deadlineExpired) {
        super(message);
        this.deadlineExpired = deadlineExpired;
    }

    public RenderCancelledException(String message, boolean deadlineExpired, Throwable cause) {
        super(message, cause);
        this.deadlineExpired = deadlineExpired;
    }

    /** {@code true} when the render deadline ran out, {@code false} when the caller cancelled. */
    public boolean deadlineExpired() {
        return deadlineExpired;
    }
}
