package batchflow.engine.store;

import batchflow.engine.config.EngineConfig;
import batchflow.engine.error.PersistenceException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling; connections are not auto-commit.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(EngineConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("batchflow-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id               VARCHAR(64) PRIMARY KEY,
                            name             VARCHAR(256),
                            task_name        VARCHAR(256) NOT NULL,
                            args             CLOB,
                            priority         VARCHAR(16) NOT NULL,
                            dependencies     CLOB,
                            tags             CLOB,
                            metadata         CLOB,
                            status           VARCHAR(20) NOT NULL,
                            max_attempts     INT NOT NULL,
                            base_delay_ms    BIGINT NOT NULL,
                            multiplier       DOUBLE NOT NULL,
                            max_delay_ms     BIGINT NOT NULL,
                            attempts         INT DEFAULT 0,
                            timeout_ms       BIGINT,
                            result           CLOB,
                            error_kind       VARCHAR(32),
                            error_message    VARCHAR(4096),
                            error_type       VARCHAR(512),
                            group_id         VARCHAR(64),
                            progress         DOUBLE DEFAULT 0,
                            progress_message VARCHAR(1024),
                            created_at       TIMESTAMP,
                            started_at       TIMESTAMP,
                            finished_at      TIMESTAMP,
                            next_attempt_at  TIMESTAMP,
                            seq              BIGINT NOT NULL,
                            version          BIGINT NOT NULL,
                            pause_requested  BOOLEAN DEFAULT FALSE,
                            cancel_requested BOOLEAN DEFAULT FALSE
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_groups (
                            id                VARCHAR(64) PRIMARY KEY,
                            name              VARCHAR(256) NOT NULL,
                            sequential        BOOLEAN DEFAULT FALSE,
                            cancel_on_failure BOOLEAN DEFAULT FALSE,
                            member_ids        CLOB,
                            metadata          CLOB,
                            canceled          BOOLEAN DEFAULT FALSE,
                            state             VARCHAR(20) NOT NULL,
                            created_at        TIMESTAMP,
                            updated_at        TIMESTAMP,
                            version           BIGINT NOT NULL
                        );
                    """);

            // data directories created before metadata was stored
            st.addBatch("ALTER TABLE jobs ADD COLUMN IF NOT EXISTS metadata CLOB;");
            st.addBatch("ALTER TABLE job_groups ADD COLUMN IF NOT EXISTS metadata CLOB;");

            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_status ON jobs(status, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_group ON jobs(group_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_groups_state ON job_groups(state);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new PersistenceException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
