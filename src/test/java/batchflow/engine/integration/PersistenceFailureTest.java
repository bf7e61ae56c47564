package batchflow.engine.integration;

import batchflow.engine.config.Dependencies;
import batchflow.engine.config.EngineConfig;
import batchflow.engine.error.PersistenceException;
import batchflow.engine.model.Job;
import batchflow.engine.model.JobSpec;
import batchflow.engine.model.JobStatus;
import batchflow.engine.repository.JobGroupRepository;
import batchflow.engine.repository.JobRepository;
import batchflow.engine.store.Database;
import batchflow.engine.task.TaskRegistry;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * The engine keeps scheduling when the store rejects writes. Creation only
 * logs the failure so the caller always gets the id; later state changes
 * report it.
 */
class PersistenceFailureTest {

        private Dependencies deps;
        private JobRepository jobRepository;

        @BeforeEach
        void setUp() {
                EngineConfig config = EngineConfig.defaults()
                                .withDatabaseUrl("jdbc:h2:mem:test-failure-" + System.nanoTime()
                                                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                                .withMaxWorkers(1)
                                .withPollInterval(Duration.ofMillis(20));
                jobRepository = mock(JobRepository.class);
                TaskRegistry registry = new TaskRegistry();
                registry.register("noop", ctx -> "ok");
                deps = Dependencies.create(config, registry, new Database(config), jobRepository,
                                mock(JobGroupRepository.class));
        }

        @AfterEach
        void tearDown() {
                if (deps != null) {
                        deps.close();
                }
        }

        @Test
        @DisplayName("Failed write on create still returns the id; later writes surface and the job still runs")
        void jobRunsDespiteFailedWrites() throws Exception {
                when(jobRepository.save(any(Job.class))).thenThrow(new PersistenceException("disk full", null));

                String id = deps.jobService().createJob(JobSpec.forTask("noop").build());

                List<Job> created = deps.jobService().listJobs(JobStatus.CREATED, null, null);
                assertEquals(1, created.size());
                assertEquals(id, created.get(0).id());

                assertThrows(PersistenceException.class, () -> deps.jobService().submit(id));
                assertEquals(JobStatus.QUEUED, deps.jobService().getStatus(id).status());

                deps.start();
                assertEquals(JobStatus.COMPLETED, deps.jobService().waitForJob(id, Duration.ofSeconds(10)));
                assertEquals("ok", deps.jobService().getResult(id).orElseThrow());
        }

        @Test
        @DisplayName("Recovery failure aborts startup")
        void unreadableStoreFailsStartup() {
                deps.close();
                deps = null;
                EngineConfig config = EngineConfig.defaults()
                                .withDatabaseUrl("jdbc:h2:mem:test-failure-" + System.nanoTime()
                                                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
                JobRepository broken = mock(JobRepository.class);
                when(broken.findPending()).thenThrow(new PersistenceException("Failed to load pending jobs", null));
                Database database = new Database(config);

                try {
                        assertThrows(PersistenceException.class, () -> Dependencies.create(config, new TaskRegistry(),
                                        database, broken, mock(JobGroupRepository.class)));
                } finally {
                        database.close();
                }
        }
}
