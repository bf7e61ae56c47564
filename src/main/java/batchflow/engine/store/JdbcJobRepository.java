package batchflow.engine.store;

import batchflow.engine.error.PersistenceException;
import batchflow.engine.model.ErrorKind;
import batchflow.engine.model.Job;
import batchflow.engine.model.JobError;
import batchflow.engine.model.JobPriority;
import batchflow.engine.model.JobStatus;
import batchflow.engine.model.RetryPolicy;
import batchflow.engine.repository.JobRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of JobRepository.
 * Saves are version-guarded upserts: UPDATE where the stored version is lower,
 * INSERT when the row does not exist yet.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private static final List<String> COLUMNS = List.of(
            "name", "task_name", "args", "priority", "dependencies", "tags", "metadata", "status",
            "max_attempts", "base_delay_ms", "multiplier", "max_delay_ms", "attempts", "timeout_ms",
            "result", "error_kind", "error_message", "error_type", "group_id",
            "progress", "progress_message", "created_at", "started_at", "finished_at", "next_attempt_at",
            "seq", "version", "pause_requested", "cancel_requested");

    private static final String UPDATE_SQL = "UPDATE jobs SET "
            + String.join(" = ?, ", COLUMNS) + " = ? WHERE id = ? AND version < ?";

    private static final String INSERT_SQL = "INSERT INTO jobs (" + String.join(", ", COLUMNS) + ", id) VALUES ("
            + String.join(", ", Collections.nCopies(COLUMNS.size() + 1, "?")) + ")";

    private static final String PENDING_FILTER = "status NOT IN ('COMPLETED', 'FAILED', 'CANCELED')";

    private static final int MAX_MESSAGE_LENGTH = 4096;
    private static final String UNIQUE_VIOLATION = "23505";

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public boolean save(Job job) {
        try (Connection conn = db.getConnection()) {
            try {
                boolean written = upsert(conn, job);
                conn.commit();
                if (written) {
                    log.debug("Saved job {} v{} ({})", job.id(), job.version(), job.status());
                } else {
                    log.debug("Skipped stale write of job {} v{}", job.id(), job.version());
                }
                return written;
            } catch (SQLException e) {
                conn.rollback();
                if (!UNIQUE_VIOLATION.equals(e.getSQLState())) {
                    throw e;
                }
                // Lost an insert race: the row exists now, retry as an update.
                boolean written = update(conn, job);
                conn.commit();
                return written;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save job: " + job.id(), e);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to encode job: " + job.id(), e);
        }
    }

    private boolean upsert(Connection conn, Job job) throws SQLException, JsonProcessingException {
        if (update(conn, job)) {
            return true;
        }
        if (exists(conn, job.id())) {
            return false;
        }
        try (PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
            int next = bind(ps, job);
            ps.setString(next, job.id());
            return ps.executeUpdate() > 0;
        }
    }

    private boolean update(Connection conn, Job job) throws SQLException, JsonProcessingException {
        try (PreparedStatement ps = conn.prepareStatement(UPDATE_SQL)) {
            int next = bind(ps, job);
            ps.setString(next++, job.id());
            ps.setLong(next, job.version());
            return ps.executeUpdate() > 0;
        }
    }

    private boolean exists(Connection conn, String jobId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM jobs WHERE id = ?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        String sql = "SELECT * FROM jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            List<Job> jobs = executeQuery(ps);
            return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
        } catch (SQLException e) {
            throw new PersistenceException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public List<Job> findPending() {
        String sql = "SELECT * FROM jobs WHERE " + PENDING_FILTER + " ORDER BY created_at, seq";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            List<Job> jobs = new ArrayList<>();
            for (Job job : executeQuery(ps)) {
                if (job.status() == JobStatus.RUNNING) {
                    job = job.toBuilder()
                            .status(JobStatus.QUEUED)
                            .startedAt(null)
                            .nextAttemptAt(null)
                            .build();
                }
                jobs.add(job);
            }
            return jobs;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load pending jobs", e);
        }
    }

    @Override
    public List<Job> findByStatus(JobStatus status) {
        String sql = "SELECT * FROM jobs WHERE status = ? ORDER BY created_at DESC";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to find jobs by status", e);
        }
    }

    @Override
    public long maxSequence() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COALESCE(MAX(seq), 0) FROM jobs");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to read max sequence", e);
        }
    }

    @Override
    public boolean delete(String jobId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM jobs WHERE id = ?")) {

            ps.setString(1, jobId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to delete job: " + jobId, e);
        }
    }

    // --- Helpers ---

    /** Bind every column of {@link #COLUMNS}; returns the next free parameter index. */
    private int bind(PreparedStatement ps, Job job) throws SQLException, JsonProcessingException {
        int i = 1;
        ps.setString(i++, job.name());
        ps.setString(i++, job.taskName());
        ps.setString(i++, JsonColumns.writeMap(job.args()));
        ps.setString(i++, job.priority().name());
        ps.setString(i++, JsonColumns.writeList(job.dependencies()));
        ps.setString(i++, JsonColumns.writeList(job.tags()));
        ps.setString(i++, JsonColumns.writeMap(job.metadata()));
        ps.setString(i++, job.status().name());

        RetryPolicy policy = job.retryPolicy();
        ps.setInt(i++, policy.maxAttempts());
        ps.setLong(i++, policy.baseDelay().toMillis());
        ps.setDouble(i++, policy.multiplier());
        ps.setLong(i++, policy.maxDelay().toMillis());
        ps.setInt(i++, job.attempts());
        setLongOrNull(ps, i++, job.timeout() != null ? job.timeout().toMillis() : null);

        ps.setString(i++, JsonColumns.writeResult(job.result()));
        JobError error = job.error();
        ps.setString(i++, error != null ? error.kind().name() : null);
        ps.setString(i++, error != null ? truncate(error.message()) : null);
        ps.setString(i++, error != null ? error.exceptionType() : null);
        ps.setString(i++, job.groupId());

        ps.setDouble(i++, job.progress());
        ps.setString(i++, truncate(job.progressMessage()));
        setTimestamp(ps, i++, job.createdAt());
        setTimestamp(ps, i++, job.startedAt());
        setTimestamp(ps, i++, job.finishedAt());
        setTimestamp(ps, i++, job.nextAttemptAt());

        ps.setLong(i++, job.sequence());
        ps.setLong(i++, job.version());
        ps.setBoolean(i++, job.pauseRequested());
        ps.setBoolean(i++, job.cancelRequested());
        return i;
    }

    private List<Job> executeQuery(PreparedStatement ps) throws SQLException {
        List<Job> jobs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                jobs.add(mapRow(rs));
            }
        }
        return jobs;
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        try {
            String errorKind = rs.getString("error_kind");
            JobError error = errorKind == null ? null
                    : new JobError(ErrorKind.valueOf(errorKind), rs.getString("error_message"),
                            rs.getString("error_type"));
            Long timeoutMs = getLongOrNull(rs, "timeout_ms");

            return Job.builder()
                    .id(id)
                    .name(rs.getString("name"))
                    .taskName(rs.getString("task_name"))
                    .args(JsonColumns.readMap(rs.getString("args")))
                    .priority(JobPriority.valueOf(rs.getString("priority")))
                    .dependencies(JsonColumns.readList(rs.getString("dependencies")))
                    .tags(JsonColumns.readList(rs.getString("tags")))
                    .metadata(JsonColumns.readMap(rs.getString("metadata")))
                    .status(JobStatus.valueOf(rs.getString("status")))
                    .retryPolicy(new RetryPolicy(
                            rs.getInt("max_attempts"),
                            Duration.ofMillis(rs.getLong("base_delay_ms")),
                            rs.getDouble("multiplier"),
                            Duration.ofMillis(rs.getLong("max_delay_ms"))))
                    .attempts(rs.getInt("attempts"))
                    .timeout(timeoutMs != null ? Duration.ofMillis(timeoutMs) : null)
                    .result(JsonColumns.readResult(rs.getString("result")))
                    .error(error)
                    .groupId(rs.getString("group_id"))
                    .progress(rs.getDouble("progress"))
                    .progressMessage(rs.getString("progress_message"))
                    .createdAt(toInstant(rs.getTimestamp("created_at")))
                    .startedAt(toInstant(rs.getTimestamp("started_at")))
                    .finishedAt(toInstant(rs.getTimestamp("finished_at")))
                    .nextAttemptAt(toInstant(rs.getTimestamp("next_attempt_at")))
                    .sequence(rs.getLong("seq"))
                    .version(rs.getLong("version"))
                    .pauseRequested(rs.getBoolean("pause_requested"))
                    .cancelRequested(rs.getBoolean("cancel_requested"))
                    .build();
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupt JSON column in job: " + id, e);
        }
    }

    private void setTimestamp(PreparedStatement ps, int idx, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(idx, Timestamp.from(instant));
        } else {
            ps.setNull(idx, Types.TIMESTAMP);
        }
    }

    private void setLongOrNull(PreparedStatement ps, int idx, Long value) throws SQLException {
        if (value != null) {
            ps.setLong(idx, value);
        } else {
            ps.setNull(idx, Types.BIGINT);
        }
    }

    private Long getLongOrNull(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_MESSAGE_LENGTH) {
            return s;
        }
        return s.substring(0, MAX_MESSAGE_LENGTH);
    }
}
