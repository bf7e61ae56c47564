package batchflow.engine.store;

import batchflow.engine.config.EngineConfig;
import batchflow.engine.model.*;
import batchflow.engine.util.JsonValues;
import batchflow.engine.util.Times;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobRepositoryTest {

    private static Database db;
    private static JdbcJobRepository repo;

    @BeforeAll
    static void setup() {
        // Use in-memory H2 for tests
        EngineConfig config = EngineConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-jobs;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        repo = new JdbcJobRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanJobs() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM jobs");
            conn.commit();
        }
    }

    public static class Unreadable {
        public String getValue() {
            throw new IllegalStateException("not readable");
        }

        @Override
        public String toString() {
            return "opaque-result";
        }
    }

    private Job.Builder job(String id) {
        return Job.builder()
                .id(id)
                .taskName("resize")
                .createdAt(Times.now())
                .sequence(1);
    }

    @Test
    void saveAndFindById() {
        Instant now = Times.now();
        Job job = job("job-1")
                .name("thumbnail")
                .args(Map.of("path", "a.png", "width", 640))
                .priority(JobPriority.HIGH)
                .tags(List.of("images", "nightly"))
                .retryPolicy(new RetryPolicy(5, Duration.ofMillis(250), 3.0, Duration.ofSeconds(10)))
                .timeout(Duration.ofSeconds(30))
                .groupId("group-1")
                .status(JobStatus.QUEUED)
                .nextAttemptAt(now.plusSeconds(2))
                .attempts(1)
                .sequence(17)
                .version(3)
                .build();

        assertTrue(repo.save(job));

        Job found = repo.findById("job-1").orElseThrow();
        assertEquals("thumbnail", found.name());
        assertEquals("resize", found.taskName());
        assertEquals("a.png", found.args().get("path"));
        assertEquals(640, found.args().get("width"));
        assertEquals(JobPriority.HIGH, found.priority());
        assertEquals(List.of("images", "nightly"), found.tags());
        assertEquals(5, found.retryPolicy().maxAttempts());
        assertEquals(Duration.ofMillis(250), found.retryPolicy().baseDelay());
        assertEquals(3.0, found.retryPolicy().multiplier());
        assertEquals(Duration.ofSeconds(30), found.timeout());
        assertEquals("group-1", found.groupId());
        assertEquals(JobStatus.QUEUED, found.status());
        assertEquals(now.plusSeconds(2), found.nextAttemptAt());
        assertEquals(1, found.attempts());
        assertEquals(17, found.sequence());
        assertEquals(3, found.version());
    }

    @Test
    void normalizedArgsAndMetadataReadBackUnchanged() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("count", 5L);
        raw.put("at", Instant.parse("2024-05-01T10:15:30Z"));
        raw.put("ratio", 1.5f);
        raw.put("nested", Map.of("ids", List.of(1L, 2L)));
        Map<String, Object> args = JsonValues.normalize(raw, "args");

        repo.save(job("job-args").args(args).metadata(Map.of("owner", "ops", "cost", 3L)).build());

        Job found = repo.findById("job-args").orElseThrow();
        assertEquals(args, found.args());
        assertEquals(5, found.args().get("count"));
        assertEquals("2024-05-01T10:15:30Z", found.args().get("at"));
        assertEquals(1.5, found.args().get("ratio"));
        assertEquals(Map.of("ids", List.of(1, 2)), found.args().get("nested"));
        assertEquals(Map.of("owner", "ops", "cost", 3), found.metadata());
    }

    @Test
    void findByIdNotFound() {
        Optional<Job> found = repo.findById("nonexistent");
        assertTrue(found.isEmpty());
    }

    @Test
    void resultAndErrorRoundTrip() {
        repo.save(job("done").status(JobStatus.COMPLETED).result(Map.of("count", 3)).build());
        repo.save(job("failed").status(JobStatus.FAILED)
                .error(new JobError(ErrorKind.TIMEOUT, "Timed out after 100 ms", null)).build());

        assertEquals(Map.of("count", 3), repo.findById("done").orElseThrow().result());
        JobError error = repo.findById("failed").orElseThrow().error();
        assertEquals(ErrorKind.TIMEOUT, error.kind());
        assertEquals("Timed out after 100 ms", error.message());
        assertNull(error.exceptionType());
    }

    @Test
    void unserializableResultIsStoredAsString() {
        repo.save(job("job-1").status(JobStatus.COMPLETED).result(new Unreadable()).build());

        assertEquals("opaque-result", repo.findById("job-1").orElseThrow().result());
    }

    @Test
    void olderVersionDoesNotOverwriteNewer() {
        Job v2 = job("job-1").status(JobStatus.COMPLETED).version(2).build();
        Job v1 = v2.toBuilder().status(JobStatus.RUNNING).version(1).build();

        assertTrue(repo.save(v2));
        assertFalse(repo.save(v1));
        assertFalse(repo.save(v2), "equal version is not rewritten");

        assertEquals(JobStatus.COMPLETED, repo.findById("job-1").orElseThrow().status());

        assertTrue(repo.save(v2.next().progress(50.0).build()));
        assertEquals(3, repo.findById("job-1").orElseThrow().version());
    }

    @Test
    void findPendingReturnsRunningJobsAsQueued() {
        repo.save(job("queued").status(JobStatus.QUEUED).sequence(1).build());
        repo.save(job("running").status(JobStatus.RUNNING).attempts(1).startedAt(Times.now()).sequence(2).build());
        repo.save(job("paused").status(JobStatus.PAUSED).sequence(3).build());
        repo.save(job("done").status(JobStatus.COMPLETED).sequence(4).build());
        repo.save(job("canceled").status(JobStatus.CANCELED).sequence(5).build());

        List<Job> pending = repo.findPending();

        assertEquals(3, pending.size());
        Job running = pending.stream().filter(j -> j.id().equals("running")).findFirst().orElseThrow();
        assertEquals(JobStatus.QUEUED, running.status());
        assertEquals(1, running.attempts());
        assertNull(running.startedAt());
    }

    @Test
    void findByStatus() {
        repo.save(job("a").status(JobStatus.FAILED).build());
        repo.save(job("b").status(JobStatus.FAILED).build());
        repo.save(job("c").status(JobStatus.COMPLETED).build());

        assertEquals(2, repo.findByStatus(JobStatus.FAILED).size());
        assertEquals(1, repo.findByStatus(JobStatus.COMPLETED).size());
        assertTrue(repo.findByStatus(JobStatus.RUNNING).isEmpty());
    }

    @Test
    void maxSequence() {
        assertEquals(0, repo.maxSequence());

        repo.save(job("a").sequence(4).build());
        repo.save(job("b").sequence(9).build());

        assertEquals(9, repo.maxSequence());
    }

    @Test
    void delete() {
        repo.save(job("job-1").build());

        assertTrue(repo.delete("job-1"));
        assertFalse(repo.delete("job-1"));
        assertTrue(repo.findById("job-1").isEmpty());
    }
}
