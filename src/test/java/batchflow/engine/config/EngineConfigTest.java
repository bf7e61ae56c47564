package batchflow.engine.config;

import batchflow.engine.model.RetryPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @TempDir
    Path tempDir;

    private File ini(String content) throws IOException {
        Path file = tempDir.resolve("engine.ini");
        Files.writeString(file, content);
        return file.toFile();
    }

    @Test
    void defaults() {
        EngineConfig config = EngineConfig.defaults();

        assertTrue(config.maxWorkers() >= 1);
        assertEquals(10_000, config.maxQueueSize());
        assertEquals(RetryPolicy.defaults(), config.defaultRetryPolicy());
        assertFalse(config.serverEnabled());
        assertEquals(8090, config.serverPort());
        assertTrue(config.databaseUrl().startsWith("jdbc:h2:file:"));
        assertTrue(config.databaseUrl().endsWith(EngineConfig.H2_OPTIONS));
    }

    @Test
    void readsAllSections() throws IOException {
        EngineConfig config = EngineConfig.fromIni(ini("""
                [engine]
                max_workers = 3
                max_queue_size = 50
                poll_interval_ms = 25
                database_url = jdbc:h2:mem:cfg
                history_retention_ms = 1000

                [retry]
                max_attempts = 5
                base_delay_ms = 200
                multiplier = 3.0
                max_delay_ms = 5000

                [server]
                enabled = true
                host = 127.0.0.1
                port = 9001
                """));

        assertEquals(3, config.maxWorkers());
        assertEquals(50, config.maxQueueSize());
        assertEquals(Duration.ofMillis(25), config.pollInterval());
        assertEquals("jdbc:h2:mem:cfg", config.databaseUrl());
        assertEquals(Duration.ofSeconds(1), config.historyRetention());
        assertEquals(new RetryPolicy(5, Duration.ofMillis(200), 3.0, Duration.ofSeconds(5)),
                config.defaultRetryPolicy());
        assertTrue(config.serverEnabled());
        assertEquals("127.0.0.1", config.serverHost());
        assertEquals(9001, config.serverPort());
    }

    @Test
    void missingSectionsKeepDefaults() throws IOException {
        EngineConfig config = EngineConfig.fromIni(ini("""
                [engine]
                max_workers = 2
                """));

        assertEquals(2, config.maxWorkers());
        assertEquals(RetryPolicy.defaults(), config.defaultRetryPolicy());
        assertEquals(8090, config.serverPort());
    }

    @Test
    void dataDirDerivesDatabaseUrl() throws IOException {
        EngineConfig config = EngineConfig.fromIni(ini("""
                [engine]
                data_dir = %s
                """.formatted(tempDir.toString().replace('\\', '/'))));

        assertTrue(config.databaseUrl().contains("batchflow"));
        assertEquals(tempDir.toAbsolutePath().toString().replace('\\', '/'),
                config.dataDir().toString().replace('\\', '/'));
    }

    @Test
    void malformedNumberIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.fromIni(ini("""
                        [engine]
                        max_workers = many
                        """)));
        assertTrue(e.getMessage().contains("max_workers"));
    }

    @Test
    void outOfRangeValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromIni(ini("""
                [engine]
                max_workers = 0
                """)));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromIni(ini("""
                [retry]
                multiplier = 0.5
                """)));
    }

    @Test
    void fluentSettersOverrideDefaults() {
        EngineConfig config = EngineConfig.defaults()
                .withMaxWorkers(1)
                .withRetryPolicy(RetryPolicy.noRetry())
                .withServer(true, 0)
                .validate();

        assertEquals(1, config.maxWorkers());
        assertEquals(1, config.defaultRetryPolicy().maxAttempts());
        assertTrue(config.serverEnabled());
        assertEquals(0, config.serverPort());
        assertTrue(config.toString().contains("maxWorkers=1"));
    }
}
