package batchflow.engine.task;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class TaskContextTest {

    @Test
    void typedArguments() {
        TaskContext ctx = new TaskContext("job-1", "t", 1,
                Map.of("n", 5, "s", "12", "name", "x"), new CancellationToken(), null);

        assertEquals(5L, ctx.longArg("n", 0));
        assertEquals(12L, ctx.longArg("s", 0));
        assertEquals(7L, ctx.longArg("missing", 7));
        assertEquals("x", ctx.stringArg("name"));
        assertThrows(IllegalArgumentException.class, () -> ctx.longArg("name", 0));
    }

    @Test
    void progressIsClamped() {
        List<Double> reported = new ArrayList<>();
        TaskContext ctx = new TaskContext("job-1", "t", 1, Map.of(), new CancellationToken(),
                (percent, message) -> reported.add(percent));

        ctx.reportProgress(150, "over");
        ctx.reportProgress(-3, "under");
        ctx.reportProgress(40, "ok");

        assertEquals(List.of(100.0, 0.0, 40.0), reported);
    }

    @Test
    void cancellationIsObservable() {
        CancellationToken token = new CancellationToken();
        TaskContext ctx = new TaskContext("job-1", "t", 1, Map.of(), token, null);

        assertFalse(ctx.isCancelled());
        ctx.throwIfCancelled();

        token.cancel("stop");
        token.cancel("ignored");

        assertTrue(ctx.isCancelled());
        assertEquals("stop", token.reason());
        CancellationException e = assertThrows(CancellationException.class, ctx::throwIfCancelled);
        assertEquals("stop", e.getMessage());
    }

    @Test
    void sleepTaskReportsProgressAndStopsOnCancel() throws Exception {
        List<Double> reported = new ArrayList<>();
        TaskContext ctx = new TaskContext("job-1", "sleep", 1, Map.of("millis", 30), new CancellationToken(),
                (percent, message) -> reported.add(percent));

        Object result = BuiltinTasks.sleep(ctx);

        assertEquals(Map.of("sleptMillis", 30L), result);
        assertEquals(100.0, reported.get(reported.size() - 1));

        CancellationToken token = new CancellationToken();
        token.cancel("stop");
        TaskContext canceled = new TaskContext("job-2", "sleep", 1, Map.of("millis", 10_000), token, null);
        assertThrows(CancellationException.class, () -> BuiltinTasks.sleep(canceled));
    }
}
