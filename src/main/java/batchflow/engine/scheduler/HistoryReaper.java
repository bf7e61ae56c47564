package batchflow.engine.scheduler;

import batchflow.engine.queue.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Background task that drops finished jobs from memory once they are older
 * than the retention. They stay in the store and remain loadable by id.
 */
public class HistoryReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(HistoryReaper.class);

    private final JobQueue queue;
    private final Duration retention;

    public HistoryReaper(JobQueue queue, Duration retention) {
        this.queue = queue;
        this.retention = retention;
    }

    @Override
    public void run() {
        try {
            reapFinishedJobs();
        } catch (Exception e) {
            log.error("History reaper error", e);
        }
    }

    /**
     * Evict finished jobs older than the retention.
     *
     * @return number of jobs evicted
     */
    public int reapFinishedJobs() {
        Instant cutoff = Instant.now().minus(retention);
        JobQueue.Eviction eviction = queue.evict(cutoff, job -> true);

        if (eviction.jobs().isEmpty()) {
            log.debug("No finished jobs to evict");
            return 0;
        }

        log.info("History reaper: evicted {} job(s) and {} group(s) finished before {}",
                eviction.jobs().size(), eviction.groups().size(), cutoff);
        return eviction.jobs().size();
    }
}
