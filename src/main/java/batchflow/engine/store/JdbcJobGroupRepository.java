package batchflow.engine.store;

import batchflow.engine.error.PersistenceException;
import batchflow.engine.model.GroupState;
import batchflow.engine.model.JobGroup;
import batchflow.engine.repository.JobGroupRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of JobGroupRepository.
 */
public class JdbcJobGroupRepository implements JobGroupRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobGroupRepository.class);

    private final Database db;

    public JdbcJobGroupRepository(Database db) {
        this.db = db;
    }

    @Override
    public boolean save(JobGroup group) {
        String update = """
                    UPDATE job_groups
                    SET name = ?, sequential = ?, cancel_on_failure = ?, member_ids = ?, metadata = ?, canceled = ?,
                        state = ?, created_at = ?, updated_at = ?, version = ?
                    WHERE id = ? AND version < ?
                """;
        String insert = """
                    INSERT INTO job_groups (name, sequential, cancel_on_failure, member_ids, metadata, canceled,
                        state, created_at, updated_at, version, id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            boolean written;
            try (PreparedStatement ps = conn.prepareStatement(update)) {
                int next = bind(ps, group);
                ps.setString(next++, group.id());
                ps.setLong(next, group.version());
                written = ps.executeUpdate() > 0;
            }
            if (!written && !exists(conn, group.id())) {
                try (PreparedStatement ps = conn.prepareStatement(insert)) {
                    int next = bind(ps, group);
                    ps.setString(next, group.id());
                    written = ps.executeUpdate() > 0;
                }
            }
            conn.commit();

            log.debug("Saved group {} v{} ({}): {}", group.id(), group.version(), group.state(), written);
            return written;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save group: " + group.id(), e);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to encode group: " + group.id(), e);
        }
    }

    @Override
    public Optional<JobGroup> findById(String groupId) {
        String sql = "SELECT * FROM job_groups WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, groupId);
            List<JobGroup> groups = executeQuery(ps);
            return groups.isEmpty() ? Optional.empty() : Optional.of(groups.get(0));
        } catch (SQLException e) {
            throw new PersistenceException("Failed to find group: " + groupId, e);
        }
    }

    @Override
    public List<JobGroup> findPending() {
        String sql = """
                    SELECT * FROM job_groups
                    WHERE state NOT IN ('COMPLETED', 'FAILED', 'CANCELED')
                    ORDER BY created_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load pending groups", e);
        }
    }

    @Override
    public boolean delete(String groupId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM job_groups WHERE id = ?")) {

            ps.setString(1, groupId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to delete group: " + groupId, e);
        }
    }

    // --- Helpers ---

    private int bind(PreparedStatement ps, JobGroup group) throws SQLException, JsonProcessingException {
        int i = 1;
        ps.setString(i++, group.name());
        ps.setBoolean(i++, group.sequential());
        ps.setBoolean(i++, group.cancelOnFailure());
        ps.setString(i++, JsonColumns.writeList(group.memberIds()));
        ps.setString(i++, JsonColumns.writeMap(group.metadata()));
        ps.setBoolean(i++, group.canceled());
        ps.setString(i++, group.state().name());
        setTimestamp(ps, i++, group.createdAt());
        setTimestamp(ps, i++, group.updatedAt());
        ps.setLong(i++, group.version());
        return i;
    }

    private boolean exists(Connection conn, String groupId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM job_groups WHERE id = ?")) {
            ps.setString(1, groupId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private List<JobGroup> executeQuery(PreparedStatement ps) throws SQLException {
        List<JobGroup> groups = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                groups.add(mapRow(rs));
            }
        }
        return groups;
    }

    private JobGroup mapRow(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        try {
            return JobGroup.builder()
                    .id(id)
                    .name(rs.getString("name"))
                    .sequential(rs.getBoolean("sequential"))
                    .cancelOnFailure(rs.getBoolean("cancel_on_failure"))
                    .memberIds(JsonColumns.readList(rs.getString("member_ids")))
                    .metadata(JsonColumns.readMap(rs.getString("metadata")))
                    .canceled(rs.getBoolean("canceled"))
                    .state(GroupState.valueOf(rs.getString("state")))
                    .createdAt(toInstant(rs.getTimestamp("created_at")))
                    .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                    .version(rs.getLong("version"))
                    .build();
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupt JSON column in group: " + id, e);
        }
    }

    private void setTimestamp(PreparedStatement ps, int idx, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(idx, Timestamp.from(instant));
        } else {
            ps.setNull(idx, Types.TIMESTAMP);
        }
    }

    private Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
