package batchflow.engine.task;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * General purpose tasks available to every deployment.
 */
public final class BuiltinTasks {

    public static final String NOOP = "noop";
    public static final String ECHO = "echo";
    public static final String SLEEP = "sleep";

    private BuiltinTasks() {
    }

    public static void registerAll(TaskRegistry registry) {
        registry.register(NOOP, ctx -> null, true);
        registry.register(ECHO, ctx -> new LinkedHashMap<>(ctx.args()), true);
        registry.register(SLEEP, BuiltinTasks::sleep, true);
    }

    /**
     * Sleeps {@code millis} in short slices, reporting progress and honoring cancellation.
     */
    static Object sleep(TaskContext ctx) throws InterruptedException {
        long total = ctx.longArg("millis", 1000);
        long slice = Math.max(1, Math.min(100, total));
        long elapsed = 0;
        while (elapsed < total) {
            ctx.throwIfCancelled();
            long step = Math.min(slice, total - elapsed);
            Thread.sleep(step);
            elapsed += step;
            ctx.reportProgress(elapsed * 100.0 / total, "slept " + elapsed + " ms");
        }
        return Map.of("sleptMillis", total);
    }
}
