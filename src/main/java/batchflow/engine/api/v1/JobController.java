package batchflow.engine.api.v1;

import batchflow.engine.api.Controller;
import batchflow.engine.api.v1.dto.CreateJobRequest;
import batchflow.engine.api.v1.dto.JobResponse;
import batchflow.engine.api.v1.dto.OperationResponse;
import batchflow.engine.config.EngineConfig;
import batchflow.engine.error.NotFoundException;
import batchflow.engine.model.Job;
import batchflow.engine.model.JobStatus;
import batchflow.engine.server.RouterHandler;
import batchflow.engine.service.JobService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for job management.
 *
 * POST /api/v1/jobs - Create (and by default submit) a job
 * GET /api/v1/jobs?status=&tag=&group= - List jobs held in memory
 * GET /api/v1/jobs/{jobId} - Get job details
 * POST /api/v1/jobs/{jobId}/{submit|pause|resume|cancel} - Control a job
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");
    private static final Pattern JOB_ACTION_PATTERN = Pattern
            .compile("^/api/v1/jobs/([^/]+)/(submit|pause|resume|cancel)$");

    private final JobService jobService;
    private final EngineConfig config;

    public JobController(JobService jobService, EngineConfig config) {
        this.jobService = jobService;
        this.config = config;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return JOBS_PATTERN.matcher(path).matches() || JOB_ACTION_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return JOBS_PATTERN.matcher(path).matches() || JOB_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        boolean post = req.method().equals(HttpMethod.POST);

        if (JOBS_PATTERN.matcher(path).matches()) {
            return post ? handleCreateJob(req) : handleListJobs(req);
        }

        Matcher actionMatcher = JOB_ACTION_PATTERN.matcher(path);
        if (post && actionMatcher.matches()) {
            return handleAction(actionMatcher.group(1), actionMatcher.group(2));
        }

        Matcher jobMatcher = JOB_BY_ID_PATTERN.matcher(path);
        if (!post && jobMatcher.matches()) {
            return handleGetJob(jobMatcher.group(1));
        }

        return ControllerResponse.notFound("unknown job endpoint");
    }

    /**
     * POST /api/v1/jobs
     */
    private ControllerResponse handleCreateJob(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        CreateJobRequest request = RouterHandler.mapper().readValue(body, CreateJobRequest.class);
        request.validate();

        String jobId = jobService.createJob(request.toSpec(config.defaultRetryPolicy()));
        if (request.submitNow()) {
            jobService.submit(jobId);
        }
        log.debug("Job {} created over HTTP (submitted={})", jobId, request.submitNow());

        Job job = jobService.findJob(jobId).orElseThrow(() -> NotFoundException.job(jobId));
        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(JobResponse.from(job)));
    }

    /**
     * GET /api/v1/jobs
     */
    private ControllerResponse handleListJobs(FullHttpRequest req) throws Exception {
        Map<String, List<String>> params = new QueryStringDecoder(req.uri()).parameters();
        String status = first(params, "status");
        String tag = first(params, "tag");
        String group = first(params, "group");

        List<JobResponse> jobs = jobService
                .listJobs(status != null ? JobStatus.parse(status) : null, tag, group)
                .stream()
                .map(job -> JobResponse.from(job).compact())
                .toList();

        Map<String, Object> response = Map.of(
                "total", jobs.size(),
                "jobs", jobs);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/jobs/{jobId}
     */
    private ControllerResponse handleGetJob(String jobId) throws Exception {
        Job job = jobService.findJob(jobId).orElseThrow(() -> NotFoundException.job(jobId));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(JobResponse.from(job)));
    }

    /**
     * POST /api/v1/jobs/{jobId}/{action}
     */
    private ControllerResponse handleAction(String jobId, String action) throws Exception {
        JobStatus status = switch (action) {
            case "submit" -> jobService.submit(jobId);
            case "pause" -> jobService.pause(jobId);
            case "resume" -> jobService.resume(jobId);
            case "cancel" -> jobService.cancel(jobId);
            default -> throw new IllegalArgumentException("Unknown action: " + action);
        };
        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(OperationResponse.of(jobId, action, status)));
    }

    private static String first(Map<String, List<String>> params, String name) {
        List<String> values = params.get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }
}
