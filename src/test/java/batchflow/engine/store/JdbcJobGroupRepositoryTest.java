package batchflow.engine.store;

import batchflow.engine.model.GroupState;
import batchflow.engine.model.JobGroup;
import batchflow.engine.util.Times;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobGroupRepositoryTest {

    private static Database db;
    private static JdbcJobGroupRepository repo;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-groups;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 2);
        repo = new JdbcJobGroupRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanGroups() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM job_groups");
            conn.commit();
        }
    }

    private JobGroup group(String id) {
        Instant now = Times.now();
        return JobGroup.builder()
                .id(id)
                .name("nightly " + id)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    @Test
    void saveAndFindById() {
        JobGroup group = group("g1").toBuilder()
                .sequential(true)
                .cancelOnFailure(true)
                .memberIds(List.of("job-1", "job-2"))
                .metadata(Map.of("owner", "ops"))
                .state(GroupState.RUNNING)
                .version(4)
                .build();

        assertTrue(repo.save(group));

        JobGroup found = repo.findById("g1").orElseThrow();
        assertEquals("nightly g1", found.name());
        assertTrue(found.sequential());
        assertTrue(found.cancelOnFailure());
        assertFalse(found.canceled());
        assertEquals(List.of("job-1", "job-2"), found.memberIds());
        assertEquals(Map.of("owner", "ops"), found.metadata());
        assertEquals(GroupState.RUNNING, found.state());
        assertEquals(group.createdAt(), found.createdAt());
        assertEquals(4, found.version());
    }

    @Test
    void findByIdNotFound() {
        assertTrue(repo.findById("missing").isEmpty());
    }

    @Test
    void newerVersionReplacesMembers() {
        JobGroup initial = group("g1");
        repo.save(initial);

        JobGroup withMember = initial.withMember("job-1", Times.now());
        assertTrue(repo.save(withMember));
        assertFalse(repo.save(initial), "stale snapshot is skipped");

        assertEquals(List.of("job-1"), repo.findById("g1").orElseThrow().memberIds());
    }

    @Test
    void findPendingSkipsResolvedGroups() {
        repo.save(group("empty"));
        repo.save(group("running").toBuilder().state(GroupState.RUNNING).build());
        repo.save(group("done").toBuilder().state(GroupState.COMPLETED).build());
        repo.save(group("canceled").toBuilder().state(GroupState.CANCELED).canceled(true).build());

        List<JobGroup> pending = repo.findPending();

        assertEquals(2, pending.size());
        assertTrue(pending.stream().noneMatch(g -> g.state() == GroupState.COMPLETED));
    }

    @Test
    void delete() {
        repo.save(group("g1"));

        assertTrue(repo.delete("g1"));
        assertFalse(repo.delete("g1"));
    }
}
