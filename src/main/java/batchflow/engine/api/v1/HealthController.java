package batchflow.engine.api.v1;

import batchflow.engine.api.Controller;
import batchflow.engine.api.v1.dto.HealthResponse;
import batchflow.engine.model.EngineStats;
import batchflow.engine.scheduler.WorkerPool;
import batchflow.engine.server.RouterHandler;
import batchflow.engine.service.JobService;
import batchflow.engine.store.Database;
import batchflow.engine.util.Times;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final JobService jobService;
    private final WorkerPool workerPool;

    public HealthController(Database database, JobService jobService, WorkerPool workerPool) {
        this.database = database;
        this.jobService = jobService;
        this.workerPool = workerPool;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (!database.isHealthy()) {
            log.warn("Health check: database unreachable");
            return ControllerResponse.json(
                    HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy("connection failed")));
        }

        EngineStats stats = jobService.stats();
        HealthResponse response = HealthResponse.healthy(
                Times.format(stats.uptime()), VERSION, workerPool.size(), workerPool.busyWorkers(),
                stats.queued(), stats.running());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }
}
