package batchflow.engine.scheduler;

import batchflow.engine.core.JobEventBus;
import batchflow.engine.model.*;
import batchflow.engine.queue.JobJournal;
import batchflow.engine.queue.JobQueue;
import batchflow.engine.repository.JobGroupRepository;
import batchflow.engine.repository.JobRepository;
import batchflow.engine.task.TaskRegistry;
import batchflow.engine.util.Times;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class WorkerPoolTest {

    private JobQueue queue;
    private TaskRegistry registry;
    private WorkerPool pool;

    @BeforeEach
    void setUp() {
        JobJournal journal = new JobJournal(mock(JobRepository.class), mock(JobGroupRepository.class),
                new JobEventBus());
        queue = new JobQueue(new RetryCoordinator(), journal, 2, 100);
        registry = new TaskRegistry();
        pool = new WorkerPool(queue, registry, 2, Duration.ofMillis(20), Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        pool.stop();
    }

    private JobQueue.Lease lease(String taskName, RetryPolicy policy, Duration timeout) throws InterruptedException {
        queue.add(Job.builder()
                .id("job-1")
                .taskName(taskName)
                .args(Map.of("n", 3))
                .retryPolicy(policy)
                .timeout(timeout)
                .createdAt(Times.now())
                .build());
        queue.submit("job-1");
        JobQueue.Lease lease = queue.take(Duration.ofSeconds(1));
        assertNotNull(lease);
        return lease;
    }

    private Job job() {
        return queue.find("job-1").orElseThrow();
    }

    @Test
    void successfulBodyCompletesJob() throws Exception {
        registry.register("double", ctx -> ctx.longArg("n", 0) * 2);

        AttemptOutcome outcome = pool.execute(lease("double", RetryPolicy.noRetry(), null));

        assertEquals(AttemptOutcome.COMPLETED, outcome);
        assertEquals(6L, job().result());
    }

    @Test
    void thrownExceptionFailsAttempt() throws Exception {
        registry.register("broken", ctx -> {
            throw new IOException("disk unavailable");
        });

        AttemptOutcome outcome = pool.execute(lease("broken", RetryPolicy.noRetry(), null));

        assertEquals(AttemptOutcome.FAILED, outcome);
        JobError error = job().error();
        assertEquals(ErrorKind.TASK_EXECUTION, error.kind());
        assertEquals("disk unavailable", error.message());
        assertEquals(IOException.class.getName(), error.exceptionType());
    }

    @Test
    void failedAttemptIsRetriedWhenAttemptsRemain() throws Exception {
        registry.register("flaky", ctx -> {
            throw new IllegalStateException("try again");
        });

        AttemptOutcome outcome = pool.execute(lease("flaky", new RetryPolicy(3, Duration.ZERO, 1.0, Duration.ZERO),
                null));

        assertEquals(AttemptOutcome.RETRY_SCHEDULED, outcome);
        assertEquals(JobStatus.QUEUED, job().status());
    }

    @Test
    void unregisteredTaskFailsWithoutRetry() throws Exception {
        AttemptOutcome outcome = pool.execute(lease("missing", RetryPolicy.defaults(), null));

        assertEquals(AttemptOutcome.FAILED, outcome);
        assertEquals(ErrorKind.UNKNOWN_TASK, job().error().kind());
        assertEquals(1, job().attempts());
    }

    @Test
    void cooperativeCancellationEndsCanceled() throws Exception {
        registry.register("stoppable", ctx -> {
            queue.cancel(ctx.jobId());
            ctx.throwIfCancelled();
            return "unreachable";
        });

        AttemptOutcome outcome = pool.execute(lease("stoppable", RetryPolicy.defaults(), null));

        assertEquals(AttemptOutcome.CANCELED, outcome);
        assertEquals(JobStatus.CANCELED, job().status());
    }

    @Test
    void timeoutFailsAttemptAndLateResultIsIgnored() throws Exception {
        registry.register("slow", ctx -> {
            long deadline = System.currentTimeMillis() + 5_000;
            while (!ctx.isCancelled() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            return "late";
        });

        AttemptOutcome outcome = pool.execute(lease("slow", RetryPolicy.noRetry(), Duration.ofMillis(100)));

        assertEquals(AttemptOutcome.STALE, outcome);
        assertEquals(JobStatus.FAILED, job().status());
        assertEquals(ErrorKind.TIMEOUT, job().error().kind());
        assertNull(job().result());
    }

    @Test
    void attemptLeasedBeforeStopStillReportsOutcome() throws Exception {
        registry.register("double", ctx -> ctx.longArg("n", 0) * 2);
        JobQueue.Lease lease = lease("double", RetryPolicy.noRetry(), Duration.ofSeconds(5));
        pool.start();
        pool.stop();

        AttemptOutcome outcome = pool.execute(lease);

        assertEquals(AttemptOutcome.COMPLETED, outcome);
        assertEquals(JobStatus.COMPLETED, job().status());
        assertEquals(0, queue.stats().running());
    }

    @Test
    void progressIsRecorded() throws Exception {
        registry.register("progress", ctx -> {
            ctx.reportProgress(50.0, "halfway");
            assertEquals(50.0, queue.find(ctx.jobId()).orElseThrow().progress());
            return null;
        });

        assertEquals(AttemptOutcome.COMPLETED, pool.execute(lease("progress", RetryPolicy.noRetry(), null)));
    }

    @Test
    void startedPoolRunsSubmittedJobs() throws Exception {
        registry.register("echo", ctx -> ctx.arg("n"));
        queue.add(Job.builder().id("job-1").taskName("echo").args(Map.of("n", 3)).createdAt(Times.now()).build());
        queue.submit("job-1");

        pool.start();
        Job done = queue.awaitTerminal("job-1", Duration.ofSeconds(5)).orElseThrow();

        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals(3, done.result());
        assertTrue(pool.isRunning());

        pool.stop();
        assertFalse(pool.isRunning());
    }
}
