package batchflow.engine.scheduler;

import batchflow.engine.error.UnknownTaskException;
import batchflow.engine.model.AttemptOutcome;
import batchflow.engine.model.ErrorKind;
import batchflow.engine.model.Job;
import batchflow.engine.model.JobError;
import batchflow.engine.queue.JobQueue;
import batchflow.engine.task.CancellationToken;
import batchflow.engine.task.TaskContext;
import batchflow.engine.task.TaskFunction;
import batchflow.engine.task.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of worker threads. Each loops: take the next eligible job from the
 * queue, resolve its task, run it inside a failure boundary, report the outcome.
 * Per-job timeouts are enforced by a watchdog thread that force-fails the
 * attempt and raises its cancellation flag; task bodies are never interrupted.
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final JobQueue queue;
    private final TaskRegistry registry;
    private final int size;
    private final Duration pollInterval;
    private final Duration shutdownTimeout;

    private final ExecutorService workers;
    private final ScheduledExecutorService watchdog;
    private final AtomicInteger busy = new AtomicInteger();

    private volatile boolean running = false;

    public WorkerPool(JobQueue queue, TaskRegistry registry, int size, Duration pollInterval,
            Duration shutdownTimeout) {
        if (size < 1) {
            throw new IllegalArgumentException("size must be at least 1");
        }
        this.queue = queue;
        this.registry = registry;
        this.size = size;
        this.pollInterval = pollInterval;
        this.shutdownTimeout = shutdownTimeout;

        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r, "batchflow-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "batchflow-timeout");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the worker threads.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Worker pool already running");
            return;
        }
        running = true;
        for (int i = 0; i < size; i++) {
            workers.submit(this::workLoop);
        }
        log.info("Worker pool started with {} workers", size);
    }

    /**
     * Stop taking jobs, let running attempts finish up to the shutdown timeout,
     * then abandon them. Abandoned attempts are re-run after a restart.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        queue.close();
        workers.shutdown();
        watchdog.shutdownNow();

        try {
            if (!workers.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
                log.warn("Worker pool forcefully stopped with {} job(s) still running", busy.get());
            } else {
                log.info("Worker pool stopped gracefully");
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
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

    public int size() {
        return size;
    }

    /** Number of workers currently executing a task body. */
    public int busyWorkers() {
        return busy.get();
    }

    private void workLoop() {
        while (running) {
            try {
                JobQueue.Lease lease = queue.take(pollInterval);
                if (lease != null) {
                    execute(lease);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Worker loop error", e);
            }
        }
        log.debug("Worker {} exiting", Thread.currentThread().getName());
    }

    /**
     * Run one attempt and report its outcome to the queue.
     */
    AttemptOutcome execute(JobQueue.Lease lease) {
        Job job = lease.job();
        int attempt = job.attempts();

        TaskFunction function;
        try {
            function = registry.resolve(job.taskName());
        } catch (UnknownTaskException e) {
            log.error("Job {} references unknown task '{}'", job.id(), job.taskName());
            return queue.fail(job.id(), attempt, JobError.from(ErrorKind.UNKNOWN_TASK, e));
        }

        CancellationToken token = lease.token();
        TaskContext context = new TaskContext(job.id(), job.taskName(), attempt, job.args(), token,
                (percent, message) -> queue.updateProgress(job.id(), attempt, percent, message));

        ScheduledFuture<?> timer = null;
        busy.incrementAndGet();
        try {
            timer = scheduleTimeout(job, attempt);
            Object result = function.execute(context);
            return queue.complete(job.id(), attempt, result);
        } catch (CancellationException e) {
            ErrorKind kind = token.isCancelled() ? ErrorKind.CANCELED : ErrorKind.TASK_EXECUTION;
            return queue.fail(job.id(), attempt, JobError.from(kind, e));
        } catch (InterruptedException e) {
            // only shutdown interrupts workers; otherwise keep the thread serving
            if (!running) {
                Thread.currentThread().interrupt();
            }
            return queue.fail(job.id(), attempt, JobError.from(ErrorKind.TASK_EXECUTION, e));
        } catch (Exception | LinkageError | AssertionError e) {
            log.debug("Job {} attempt {} raised {}", job.id(), attempt, e.toString());
            return queue.fail(job.id(), attempt, JobError.from(ErrorKind.TASK_EXECUTION, e));
        } finally {
            busy.decrementAndGet();
            if (timer != null) {
                timer.cancel(false);
            }
        }
    }

    private ScheduledFuture<?> scheduleTimeout(Job job, int attempt) {
        if (job.timeout() == null) {
            return null;
        }
        try {
            return watchdog.schedule(() -> queue.timeout(job.id(), attempt),
                    job.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // watchdog is gone once stop() has run; the attempt still finishes untimed
            log.warn("Job {} attempt {} runs without a timeout: pool is stopping", job.id(), attempt);
            return null;
        }
    }
}
