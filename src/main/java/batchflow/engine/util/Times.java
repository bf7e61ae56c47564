package batchflow.engine.util;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Time helpers. Timestamps are kept at millisecond precision so they survive
 * a round trip through the store unchanged.
 */
public final class Times {

    private Times() {
    }

    public static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    /** Format a duration as "1h 02m 03s". */
    public static String format(Duration duration) {
        long seconds = duration.getSeconds();
        return String.format("%dh %02dm %02ds", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }
}
