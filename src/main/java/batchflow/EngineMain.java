package batchflow;

import batchflow.engine.config.Dependencies;
import batchflow.engine.config.EngineConfig;
import batchflow.engine.task.BuiltinTasks;
import batchflow.engine.task.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.CountDownLatch;

/**
 * Standalone entry point: runs the engine with the built-in tasks and, when
 * enabled, the HTTP API.
 *
 * <pre>
 * java -jar batchflow-engine.jar [engine.ini]
 * </pre>
 *
 * Without an INI file the configuration is read from BATCHFLOW_* environment
 * variables.
 */
public final class EngineMain {

    private static final Logger log = LoggerFactory.getLogger(EngineMain.class);

    private EngineMain() {
    }

    public static void main(String[] args) throws Exception {
        EngineConfig config = loadConfig(args);

        TaskRegistry registry = new TaskRegistry();
        BuiltinTasks.registerAll(registry);

        Dependencies deps = Dependencies.create(config, registry);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            deps.close();
            stopped.countDown();
        }, "batchflow-shutdown"));

        deps.start();
        log.info("Engine running with tasks {}", registry.names());
        stopped.await();
    }

    static EngineConfig loadConfig(String[] args) throws IOException {
        if (args.length > 0) {
            File file = new File(args[0]);
            log.info("Loading configuration from {}", file.getAbsolutePath());
            return EngineConfig.fromIni(file);
        }
        return EngineConfig.fromEnv().validate();
    }
}
