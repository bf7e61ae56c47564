package batchflow.engine.model;

import java.time.Duration;

/**
 * Engine counters since start plus the current queue shape.
 * Run times cover every finished attempt; queue time is measured from the
 * moment a job became runnable until a worker picked it up. Min and max are
 * 0 before the first attempt.
 */
public record EngineStats(
        long submitted,
        long completed,
        long failed,
        long canceled,
        long retried,
        long averageRunMillis,
        long minRunMillis,
        long maxRunMillis,
        long averageQueueMillis,
        int queued,
        int waiting,
        int running,
        int paused,
        Duration uptime) {
}
