package batchflow;

import batchflow.engine.config.EngineConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EngineMainTest {

    @Test
    void loadsConfigurationFromIniArgument(@TempDir Path dir) throws IOException {
        Path ini = dir.resolve("engine.ini");
        Files.writeString(ini, """
                [engine]
                max_workers = 3

                [server]
                enabled = true
                port = 9090
                """);

        EngineConfig config = EngineMain.loadConfig(new String[]{ini.toString()});

        assertEquals(3, config.maxWorkers());
        assertTrue(config.serverEnabled());
        assertEquals(9090, config.serverPort());
    }

    @Test
    void missingIniFileFails(@TempDir Path dir) {
        String missing = dir.resolve("absent.ini").toString();

        assertThrows(IOException.class, () -> EngineMain.loadConfig(new String[]{missing}));
    }
}
