package batchflow.engine.task;

import java.util.concurrent.CancellationException;

/**
 * Per-attempt cancellation flag. Task bodies poll it; the engine never
 * interrupts a running body.
 */
public final class CancellationToken {

    private volatile String reason;

    public void cancel(String reason) {
        if (this.reason == null) {
            this.reason = reason != null ? reason : "canceled";
        }
    }

    public boolean isCancelled() {
        return reason != null;
    }

    public String reason() {
        return reason;
    }

    /**
     * @throws CancellationException if cancellation was requested
     */
    public void throwIfCancelled() {
        String r = reason;
        if (r != null) {
            throw new CancellationException(r);
        }
    }
}
