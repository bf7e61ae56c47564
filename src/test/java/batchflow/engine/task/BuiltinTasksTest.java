package batchflow.engine.task;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class BuiltinTasksTest {

    @Test
    void registersAllBuiltins() {
        TaskRegistry registry = new TaskRegistry();
        BuiltinTasks.registerAll(registry);

        assertTrue(registry.contains(BuiltinTasks.NOOP));
        assertTrue(registry.contains(BuiltinTasks.ECHO));
        assertTrue(registry.contains(BuiltinTasks.SLEEP));
    }

    @Test
    void echoReturnsArguments() throws Exception {
        TaskRegistry registry = new TaskRegistry();
        BuiltinTasks.registerAll(registry);
        TaskContext ctx = new TaskContext("job-1", "echo", 1, Map.of("a", 1), new CancellationToken(), null);

        assertEquals(Map.of("a", 1), registry.resolve(BuiltinTasks.ECHO).execute(ctx));
        assertNull(registry.resolve(BuiltinTasks.NOOP).execute(ctx));
    }

    @Test
    void sleepReportsProgressUpToCompletion() throws Exception {
        List<Double> progress = new ArrayList<>();
        TaskContext ctx = new TaskContext("job-1", "sleep", 1, Map.of("millis", 30), new CancellationToken(),
                (percent, message) -> progress.add(percent));

        assertEquals(Map.of("sleptMillis", 30L), BuiltinTasks.sleep(ctx));
        assertEquals(100.0, progress.get(progress.size() - 1));
    }

    @Test
    void sleepStopsWhenCanceled() {
        CancellationToken token = new CancellationToken();
        token.cancel("stop");
        TaskContext ctx = new TaskContext("job-1", "sleep", 1, Map.of("millis", 10_000), token, null);

        assertThrows(CancellationException.class, () -> BuiltinTasks.sleep(ctx));
    }
}
