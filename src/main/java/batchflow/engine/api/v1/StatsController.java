package batchflow.engine.api.v1;

import batchflow.engine.api.Controller;
import batchflow.engine.api.v1.dto.StatsResponse;
import batchflow.engine.server.RouterHandler;
import batchflow.engine.service.JobService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

/**
 * GET /api/v1/stats
 */
public class StatsController implements Controller {

    private final JobService jobService;

    public StatsController(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/stats".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(StatsResponse.from(jobService.stats())));
    }
}
