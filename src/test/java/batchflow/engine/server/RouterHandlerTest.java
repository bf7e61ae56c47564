package batchflow.engine.server;

import batchflow.engine.api.Controller;
import batchflow.engine.api.Controller.ControllerResponse;
import batchflow.engine.error.InvalidStateException;
import batchflow.engine.error.NotFoundException;
import batchflow.engine.error.PersistenceException;
import batchflow.engine.error.QueueFullException;
import batchflow.engine.model.JobStatus;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.*;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class RouterHandlerTest {

    /** Answers GET /ping, fails on GET /boom. */
    private static final class PingController implements Controller {

        @Override
        public boolean matches(HttpMethod method, String path) {
            return HttpMethod.GET.equals(method) && (path.equals("/ping") || path.equals("/boom"));
        }

        @Override
        public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
            if (path.equals("/boom")) {
                throw new NotFoundException("Job not found: job-9");
            }
            return ControllerResponse.json("{\"pong\":true}");
        }
    }

    private FullHttpResponse send(RouterHandler router, String uri) {
        EmbeddedChannel channel = new EmbeddedChannel(router);
        try {
            channel.writeInbound(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, uri));
            FullHttpResponse response = channel.readOutbound();
            assertNotNull(response);
            return response;
        } finally {
            channel.finishAndReleaseAll();
        }
    }

    private static String body(FullHttpResponse response) {
        return response.content().toString(StandardCharsets.UTF_8);
    }

    @Test
    void dispatchesToMatchingController() {
        RouterHandler router = new RouterHandler().registerController(new PingController());

        FullHttpResponse response = send(router, "/ping?verbose=1");
        try {
            assertEquals(HttpResponseStatus.OK, response.status());
            assertEquals("{\"pong\":true}", body(response));
            assertTrue(response.headers().get(HttpHeaderNames.CONTENT_TYPE).startsWith("application/json"));
        } finally {
            response.release();
        }
    }

    @Test
    void unknownPathIsNotFound() throws Exception {
        RouterHandler router = new RouterHandler().registerController(new PingController());

        FullHttpResponse response = send(router, "/nothing");
        try {
            assertEquals(HttpResponseStatus.NOT_FOUND, response.status());
            JsonNode json = RouterHandler.mapper().readTree(body(response));
            assertEquals("not found", json.get("error").asText());
        } finally {
            response.release();
        }
    }

    @Test
    void controllerExceptionIsMapped() {
        RouterHandler router = new RouterHandler().registerController(new PingController());

        FullHttpResponse response = send(router, "/boom");
        try {
            assertEquals(HttpResponseStatus.NOT_FOUND, response.status());
            assertTrue(body(response).contains("job-9"));
        } finally {
            response.release();
        }
    }

    @Test
    void exceptionMapping() {
        assertEquals(HttpResponseStatus.NOT_FOUND,
                RouterHandler.toResponse(HttpMethod.GET, "/x", NotFoundException.job("j")).status());
        assertEquals(HttpResponseStatus.CONFLICT,
                RouterHandler.toResponse(HttpMethod.POST, "/x",
                        new InvalidStateException("j", JobStatus.QUEUED, "submit")).status());
        assertEquals(HttpResponseStatus.TOO_MANY_REQUESTS,
                RouterHandler.toResponse(HttpMethod.POST, "/x", new QueueFullException(10)).status());
        assertEquals(HttpResponseStatus.BAD_REQUEST,
                RouterHandler.toResponse(HttpMethod.POST, "/x", new IllegalArgumentException("bad")).status());
    }

    @Test
    void unexpectedErrorReportsCauseChain() {
        PersistenceException failure = new PersistenceException("Failed to save job: j",
                new SQLException("disk full"));

        ControllerResponse response = RouterHandler.toResponse(HttpMethod.POST, "/x", failure);

        assertEquals(HttpResponseStatus.INTERNAL_SERVER_ERROR, response.status());
        assertTrue(response.body().contains("Failed to save job"));
        assertTrue(response.body().contains("disk full"));
    }

    @Test
    void errorMessagesAreEscaped() throws Exception {
        ControllerResponse response = ControllerResponse.badRequest("bad \"quote\"\nline");

        JsonNode json = RouterHandler.mapper().readTree(response.body());
        assertEquals("bad \"quote\"\nline", json.get("error").asText());
    }
}
