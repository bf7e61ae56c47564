package batchflow.engine.api.v1.dto;

import batchflow.engine.model.EngineStats;
import batchflow.engine.util.Times;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for engine counters.
 * GET /api/v1/stats
 */
public record StatsResponse(
        @JsonProperty("submitted") long submitted,
        @JsonProperty("completed") long completed,
        @JsonProperty("failed") long failed,
        @JsonProperty("canceled") long canceled,
        @JsonProperty("retried") long retried,
        @JsonProperty("averageRunMillis") long averageRunMillis,
        @JsonProperty("minRunMillis") long minRunMillis,
        @JsonProperty("maxRunMillis") long maxRunMillis,
        @JsonProperty("averageQueueMillis") long averageQueueMillis,
        @JsonProperty("queued") int queued,
        @JsonProperty("waiting") int waiting,
        @JsonProperty("running") int running,
        @JsonProperty("paused") int paused,
        @JsonProperty("uptime") String uptime) {

    public static StatsResponse from(EngineStats stats) {
        return new StatsResponse(
                stats.submitted(),
                stats.completed(),
                stats.failed(),
                stats.canceled(),
                stats.retried(),
                stats.averageRunMillis(),
                stats.minRunMillis(),
                stats.maxRunMillis(),
                stats.averageQueueMillis(),
                stats.queued(),
                stats.waiting(),
                stats.running(),
                stats.paused(),
                Times.format(stats.uptime()));
    }
}
