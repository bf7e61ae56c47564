package batchflow.engine.config;

import batchflow.engine.model.RetryPolicy;
import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for engine settings.
 * All settings have sensible defaults.
 */
public final class EngineConfig {

    static final String H2_OPTIONS = ";AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";

    // Scheduling
    private int maxWorkers = Runtime.getRuntime().availableProcessors();
    private int maxQueueSize = 10_000;
    private Duration pollInterval = Duration.ofMillis(500);

    // Retry defaults
    private int maxAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;
    private Duration baseDelay = RetryPolicy.DEFAULT_BASE_DELAY;
    private double multiplier = RetryPolicy.DEFAULT_MULTIPLIER;
    private Duration maxDelay = RetryPolicy.DEFAULT_MAX_DELAY;

    // Persistence
    private Path dataDir = Path.of("data");
    private String databaseUrl = null; // derived from dataDir when unset
    private int databasePoolSize = 4;

    // Housekeeping
    private Duration historyRetention = Duration.ofHours(1);
    private Duration reaperInterval = Duration.ofSeconds(60);
    private Duration shutdownTimeout = Duration.ofSeconds(10);

    // HTTP server
    private boolean serverEnabled = false;
    private String serverHost = "0.0.0.0";
    private int serverPort = 8090;

    private EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromEnv() {
        EngineConfig config = new EngineConfig();

        String workers = System.getenv("BATCHFLOW_MAX_WORKERS");
        if (workers != null && !workers.isBlank()) {
            config.maxWorkers = Integer.parseInt(workers.trim());
        }

        String queueSize = System.getenv("BATCHFLOW_MAX_QUEUE_SIZE");
        if (queueSize != null && !queueSize.isBlank()) {
            config.maxQueueSize = Integer.parseInt(queueSize.trim());
        }

        String poll = System.getenv("BATCHFLOW_POLL_INTERVAL_MS");
        if (poll != null && !poll.isBlank()) {
            config.pollInterval = Duration.ofMillis(Long.parseLong(poll.trim()));
        }

        String dataDir = System.getenv("BATCHFLOW_DATA_DIR");
        if (dataDir != null && !dataDir.isBlank()) {
            config.dataDir = Path.of(dataDir.trim());
        }

        String dbUrl = System.getenv("BATCHFLOW_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl.trim();
        }

        String maxAttempts = System.getenv("BATCHFLOW_MAX_ATTEMPTS");
        if (maxAttempts != null && !maxAttempts.isBlank()) {
            config.maxAttempts = Integer.parseInt(maxAttempts.trim());
        }

        String serverEnabled = System.getenv("BATCHFLOW_SERVER_ENABLED");
        if (serverEnabled != null && !serverEnabled.isBlank()) {
            config.serverEnabled = Boolean.parseBoolean(serverEnabled.trim());
        }

        String port = System.getenv("BATCHFLOW_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        return config;
    }

    /**
     * Read settings from an INI file with optional sections [engine], [retry]
     * and [server]. Missing keys keep their defaults.
     *
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if a value is malformed
     */
    public static EngineConfig fromIni(File file) throws IOException {
        Ini ini = new Ini(file);
        EngineConfig config = new EngineConfig();

        Profile.Section engine = ini.get("engine");
        if (engine != null) {
            config.maxWorkers = intValue(engine, "max_workers", config.maxWorkers);
            config.maxQueueSize = intValue(engine, "max_queue_size", config.maxQueueSize);
            config.pollInterval = millis(engine, "poll_interval_ms", config.pollInterval);
            String dataDir = engine.get("data_dir");
            if (dataDir != null && !dataDir.isBlank()) {
                config.dataDir = Path.of(dataDir.trim());
            }
            String dbUrl = engine.get("database_url");
            if (dbUrl != null && !dbUrl.isBlank()) {
                config.databaseUrl = dbUrl.trim();
            }
            config.databasePoolSize = intValue(engine, "db_pool_size", config.databasePoolSize);
            config.historyRetention = millis(engine, "history_retention_ms", config.historyRetention);
            config.reaperInterval = millis(engine, "reaper_interval_ms", config.reaperInterval);
            config.shutdownTimeout = millis(engine, "shutdown_timeout_ms", config.shutdownTimeout);
        }

        Profile.Section retry = ini.get("retry");
        if (retry != null) {
            config.maxAttempts = intValue(retry, "max_attempts", config.maxAttempts);
            config.baseDelay = millis(retry, "base_delay_ms", config.baseDelay);
            config.maxDelay = millis(retry, "max_delay_ms", config.maxDelay);
            String multiplier = retry.get("multiplier");
            if (multiplier != null && !multiplier.isBlank()) {
                config.multiplier = Double.parseDouble(multiplier.trim());
            }
        }

        Profile.Section server = ini.get("server");
        if (server != null) {
            String enabled = server.get("enabled");
            if (enabled != null && !enabled.isBlank()) {
                config.serverEnabled = Boolean.parseBoolean(enabled.trim());
            }
            String host = server.get("host");
            if (host != null && !host.isBlank()) {
                config.serverHost = host.trim();
            }
            config.serverPort = intValue(server, "port", config.serverPort);
        }

        config.validate();
        return config;
    }

    private static int intValue(Profile.Section section, String key, int fallback) {
        String value = section.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for '" + key + "': " + value);
        }
    }

    private static Duration millis(Profile.Section section, String key, Duration fallback) {
        String value = section.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Duration.ofMillis(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid milliseconds for '" + key + "': " + value);
        }
    }

    /**
     * @throws IllegalArgumentException if a setting is out of range
     */
    public EngineConfig validate() {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("max_workers must be at least 1");
        }
        if (maxQueueSize < 1) {
            throw new IllegalArgumentException("max_queue_size must be at least 1");
        }
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("poll_interval must be positive");
        }
        defaultRetryPolicy();
        return this;
    }

    // Getters
    public int maxWorkers() {
        return maxWorkers;
    }

    public int maxQueueSize() {
        return maxQueueSize;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public RetryPolicy defaultRetryPolicy() {
        return new RetryPolicy(maxAttempts, baseDelay, multiplier, maxDelay);
    }

    public Path dataDir() {
        return dataDir;
    }

    public String databaseUrl() {
        if (databaseUrl != null) {
            return databaseUrl;
        }
        return "jdbc:h2:file:" + dataDir.resolve("batchflow").toAbsolutePath() + H2_OPTIONS;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Duration historyRetention() {
        return historyRetention;
    }

    public Duration reaperInterval() {
        return reaperInterval;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    public boolean serverEnabled() {
        return serverEnabled;
    }

    public String serverHost() {
        return serverHost;
    }

    public int serverPort() {
        return serverPort;
    }

    // Fluent setters for testing/customization
    public EngineConfig withMaxWorkers(int maxWorkers) {
        this.maxWorkers = maxWorkers;
        return this;
    }

    public EngineConfig withMaxQueueSize(int maxQueueSize) {
        this.maxQueueSize = maxQueueSize;
        return this;
    }

    public EngineConfig withPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
        return this;
    }

    public EngineConfig withRetryPolicy(RetryPolicy policy) {
        this.maxAttempts = policy.maxAttempts();
        this.baseDelay = policy.baseDelay();
        this.multiplier = policy.multiplier();
        this.maxDelay = policy.maxDelay();
        return this;
    }

    public EngineConfig withDataDir(Path dataDir) {
        this.dataDir = dataDir;
        return this;
    }

    public EngineConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public EngineConfig withHistoryRetention(Duration retention) {
        this.historyRetention = retention;
        return this;
    }

    public EngineConfig withReaperInterval(Duration interval) {
        this.reaperInterval = interval;
        return this;
    }

    public EngineConfig withShutdownTimeout(Duration timeout) {
        this.shutdownTimeout = timeout;
        return this;
    }

    public EngineConfig withServer(boolean enabled, int port) {
        this.serverEnabled = enabled;
        this.serverPort = port;
        return this;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "maxWorkers=" + maxWorkers +
                ", maxQueueSize=" + maxQueueSize +
                ", pollInterval=" + pollInterval.toMillis() + "ms" +
                ", maxAttempts=" + maxAttempts +
                ", databaseUrl='" + databaseUrl() + '\'' +
                ", server=" + (serverEnabled ? serverHost + ":" + serverPort : "off") +
                '}';
    }
}
