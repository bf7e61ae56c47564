package batchflow.engine.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs periodic housekeeping on a single daemon thread:
 * - HistoryReaper: evicts old finished jobs from memory
 */
public class MaintenanceScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final ScheduledExecutorService executor;
    private final HistoryReaper historyReaper;
    private final Duration reaperInterval;

    private volatile boolean running = false;

    public MaintenanceScheduler(HistoryReaper historyReaper, Duration reaperInterval) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "batchflow-maintenance");
            t.setDaemon(true);
            return t;
        });
        this.historyReaper = historyReaper;
        this.reaperInterval = reaperInterval;
    }

    public void start() {
        if (running) {
            log.warn("Maintenance scheduler already running");
            return;
        }

        running = true;

        long intervalMs = reaperInterval.toMillis();
        executor.scheduleAtFixedRate(historyReaper, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("History reaper scheduled every {}ms", intervalMs);
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Maintenance scheduler forcefully stopped");
            } else {
                log.info("Maintenance scheduler stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public HistoryReaper historyReaper() {
        return historyReaper;
    }
}
