package batchflow.engine.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JobTest {

    @Test
    void buildMinimalJob() {
        Job job = Job.builder()
                .id("job-1")
                .taskName("resize")
                .build();

        assertEquals("job-1", job.id());
        assertEquals("resize", job.taskName());
        assertEquals("resize", job.name());
        assertEquals(JobStatus.CREATED, job.status());
        assertEquals(JobPriority.NORMAL, job.priority());
        assertEquals(RetryPolicy.defaults(), job.retryPolicy());
        assertEquals(0, job.attempts());
        assertTrue(job.args().isEmpty());
        assertTrue(job.dependencies().isEmpty());
        assertNull(job.result());
        assertNull(job.error());
        assertNull(job.timeout());
    }

    @Test
    void argsAreCopiedAndUnmodifiable() {
        Map<String, Object> args = new HashMap<>();
        args.put("path", "a.png");

        Job job = Job.builder().id("job-1").taskName("resize").args(args).build();
        args.put("path", "b.png");

        assertEquals("a.png", job.args().get("path"));
        assertThrows(UnsupportedOperationException.class, () -> job.args().put("x", 1));
    }

    @Test
    void canRetry() {
        RetryPolicy policy = RetryPolicy.defaults().withMaxAttempts(3);

        Job retriable = Job.builder().id("j1").taskName("t").retryPolicy(policy).attempts(2).build();
        assertTrue(retriable.canRetry());

        Job exhausted = Job.builder().id("j2").taskName("t").retryPolicy(policy).attempts(3).build();
        assertFalse(exhausted.canRetry());
    }

    @Test
    void terminalAndPendingStates() {
        for (JobStatus status : JobStatus.values()) {
            Job job = Job.builder().id("j").taskName("t").status(status).build();
            assertEquals(status == JobStatus.COMPLETED || status == JobStatus.FAILED
                    || status == JobStatus.CANCELED, job.isTerminal(), status.name());
            assertEquals(status == JobStatus.QUEUED || status == JobStatus.WAITING, job.isPending(), status.name());
        }
    }

    @Test
    void isDueHonorsBackoffGate() {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");

        Job immediate = Job.builder().id("j1").taskName("t").build();
        assertTrue(immediate.isDue(now));

        Job later = Job.builder().id("j2").taskName("t").nextAttemptAt(now.plusSeconds(5)).build();
        assertFalse(later.isDue(now));
        assertTrue(later.isDue(now.plusSeconds(5)));
    }

    @Test
    void nextBumpsVersionAndKeepsFields() {
        Job job = Job.builder()
                .id("job-1")
                .taskName("t")
                .priority(JobPriority.HIGH)
                .dependencies(List.of("a", "b"))
                .timeout(Duration.ofSeconds(3))
                .version(4)
                .build();

        Job next = job.next().status(JobStatus.QUEUED).build();

        assertEquals(5, next.version());
        assertEquals(JobStatus.QUEUED, next.status());
        assertEquals(JobPriority.HIGH, next.priority());
        assertEquals(List.of("a", "b"), next.dependencies());
        assertEquals(Duration.ofSeconds(3), next.timeout());
        assertEquals(job, next);
    }

    @Test
    void requiresTaskName() {
        assertThrows(NullPointerException.class, () -> Job.builder().id("j").build());
    }

    @Test
    void specRejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class,
                () -> JobSpec.forTask("resize").timeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> JobSpec.forTask("resize").timeout(Duration.ofMillis(-1)).build());
        assertEquals(Duration.ofMillis(1), JobSpec.forTask("resize").timeout(Duration.ofMillis(1)).build().timeout());
    }
}
