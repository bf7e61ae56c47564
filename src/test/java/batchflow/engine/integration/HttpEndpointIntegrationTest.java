package batchflow.engine.integration;

import batchflow.engine.config.Dependencies;
import batchflow.engine.config.EngineConfig;
import batchflow.engine.task.BuiltinTasks;
import batchflow.engine.task.TaskRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits actual HTTP endpoints of a running engine.
 */
class HttpEndpointIntegrationTest {

        private static final ObjectMapper MAPPER = new ObjectMapper();

        private Dependencies deps;
        private HttpClient httpClient;
        private String baseUrl;

        @BeforeEach
        void setUp() {
                EngineConfig config = EngineConfig.defaults()
                                .withDatabaseUrl("jdbc:h2:mem:test-http-" + System.nanoTime()
                                                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                                .withMaxWorkers(2)
                                .withPollInterval(Duration.ofMillis(20))
                                .withServer(true, 0);
                TaskRegistry registry = new TaskRegistry();
                BuiltinTasks.registerAll(registry);
                deps = Dependencies.create(config, registry);
                deps.start();

                baseUrl = "http://127.0.0.1:" + deps.httpServer().port();
                httpClient = HttpClient.newBuilder()
                                .connectTimeout(Duration.ofSeconds(5))
                                .build();
        }

        @AfterEach
        void tearDown() {
                if (deps != null) {
                        deps.close();
                }
        }

        private HttpResponse<String> get(String path) throws Exception {
                return httpClient.send(
                                HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).GET().build(),
                                HttpResponse.BodyHandlers.ofString());
        }

        private HttpResponse<String> post(String path, String body) throws Exception {
                return httpClient.send(
                                HttpRequest.newBuilder()
                                                .uri(URI.create(baseUrl + path))
                                                .header("Content-Type", "application/json")
                                                .POST(HttpRequest.BodyPublishers.ofString(body))
                                                .build(),
                                HttpResponse.BodyHandlers.ofString());
        }

        private JsonNode awaitJobStatus(String jobId, String status) throws Exception {
                long deadline = System.currentTimeMillis() + 10_000;
                JsonNode job;
                do {
                        job = MAPPER.readTree(get("/api/v1/jobs/" + jobId).body());
                        if (status.equals(job.get("status").asText())) {
                                return job;
                        }
                        TimeUnit.MILLISECONDS.sleep(20);
                } while (System.currentTimeMillis() < deadline);
                fail("job " + jobId + " did not reach " + status + ", last seen " + job);
                return job;
        }

        @Test
        @DisplayName("Create a job over HTTP and read its result")
        void createAndComplete() throws Exception {
                HttpResponse<String> created = post("/api/v1/jobs", """
                                {
                                    "taskName": "echo",
                                    "name": "greeting",
                                    "args": {"message": "hello"},
                                    "priority": "high",
                                    "tags": ["http"]
                                }
                                """);

                assertEquals(201, created.statusCode(), created.body());
                JsonNode createdJson = MAPPER.readTree(created.body());
                String jobId = createdJson.get("jobId").asText();
                assertTrue(jobId.startsWith("job-"));
                assertEquals("HIGH", createdJson.get("priority").asText());

                JsonNode done = awaitJobStatus(jobId, "COMPLETED");
                assertEquals("hello", done.get("result").get("message").asText());
                assertEquals(1, done.get("attempts").asInt());
                assertTrue(done.has("finishedAt"));

                JsonNode list = MAPPER.readTree(get("/api/v1/jobs?status=completed&tag=http").body());
                assertEquals(1, list.get("total").asInt());
                assertEquals(jobId, list.get("jobs").get(0).get("jobId").asText());
        }

        @Test
        @DisplayName("Created-only job is submitted by a separate call; resubmitting a finished job is a no-op")
        void explicitSubmit() throws Exception {
                HttpResponse<String> created = post("/api/v1/jobs",
                                "{\"taskName\":\"noop\",\"submit\":false}");
                String jobId = MAPPER.readTree(created.body()).get("jobId").asText();
                assertEquals("CREATED", MAPPER.readTree(created.body()).get("status").asText());

                HttpResponse<String> submitted = post("/api/v1/jobs/" + jobId + "/submit", "");
                assertEquals(200, submitted.statusCode());
                assertEquals("submit", MAPPER.readTree(submitted.body()).get("operation").asText());

                awaitJobStatus(jobId, "COMPLETED");
                HttpResponse<String> again = post("/api/v1/jobs/" + jobId + "/submit", "");
                assertEquals(200, again.statusCode(), "submitting a finished job is a no-op");
                assertEquals("COMPLETED", MAPPER.readTree(again.body()).get("state").asText());
        }

        @Test
        @DisplayName("Running job can be canceled over HTTP")
        void cancelRunningJob() throws Exception {
                HttpResponse<String> created = post("/api/v1/jobs",
                                "{\"taskName\":\"sleep\",\"args\":{\"millis\":5000}}");
                String jobId = MAPPER.readTree(created.body()).get("jobId").asText();
                awaitJobStatus(jobId, "RUNNING");

                HttpResponse<String> canceled = post("/api/v1/jobs/" + jobId + "/cancel", "");
                assertEquals(200, canceled.statusCode());

                JsonNode job = awaitJobStatus(jobId, "CANCELED");
                assertEquals("CANCELED", job.get("error").get("kind").asText());
        }

        @Test
        @DisplayName("Error responses carry status codes and a message")
        void errorResponses() throws Exception {
                HttpResponse<String> missing = get("/api/v1/jobs/job-nope");
                assertEquals(404, missing.statusCode());
                assertTrue(MAPPER.readTree(missing.body()).has("error"));

                assertEquals(400, post("/api/v1/jobs", "{\"name\":\"no task\"}").statusCode());
                assertEquals(400, post("/api/v1/jobs", "{not json").statusCode());
                assertEquals(400, post("/api/v1/jobs", "").statusCode());
                assertEquals(400, get("/api/v1/jobs?status=bogus").statusCode());
                assertEquals(404, post("/api/v1/jobs",
                                "{\"taskName\":\"noop\",\"dependencies\":[\"job-nope\"]}").statusCode());
                assertEquals(404, get("/api/v1/unknown").statusCode());

                HttpResponse<String> created = post("/api/v1/jobs", "{\"taskName\":\"noop\",\"submit\":false}");
                String jobId = MAPPER.readTree(created.body()).get("jobId").asText();
                assertEquals(409, post("/api/v1/jobs/" + jobId + "/pause", "").statusCode());
        }

        @Test
        @DisplayName("Groups: create, add members, read status")
        void groupFlow() throws Exception {
                HttpResponse<String> createdGroup = post("/api/v1/groups",
                                "{\"name\":\"nightly\",\"sequential\":true}");
                assertEquals(201, createdGroup.statusCode(), createdGroup.body());
                JsonNode group = MAPPER.readTree(createdGroup.body());
                String groupId = group.get("groupId").asText();
                assertEquals("EMPTY", group.get("state").asText());
                assertTrue(group.get("sequential").asBoolean());

                String first = MAPPER.readTree(post("/api/v1/jobs",
                                "{\"taskName\":\"noop\",\"submit\":false}").body()).get("jobId").asText();
                String second = MAPPER.readTree(post("/api/v1/jobs",
                                "{\"taskName\":\"noop\",\"submit\":false}").body()).get("jobId").asText();
                assertEquals(200, post("/api/v1/groups/" + groupId + "/jobs/" + first, "").statusCode());
                assertEquals(200, post("/api/v1/groups/" + groupId + "/jobs/" + second, "").statusCode());
                post("/api/v1/jobs/" + second + "/submit", "");
                post("/api/v1/jobs/" + first + "/submit", "");

                awaitJobStatus(second, "COMPLETED");
                JsonNode status = MAPPER.readTree(get("/api/v1/groups/" + groupId).body());
                assertEquals("COMPLETED", status.get("state").asText());
                assertEquals(2, status.get("completed").asInt());
                assertEquals(first, status.get("members").get(0).asText());

                assertEquals(404, get("/api/v1/groups/group-nope").statusCode());
        }

        @Test
        @DisplayName("Canceling a group cancels its unfinished members")
        void cancelGroup() throws Exception {
                String groupId = MAPPER.readTree(post("/api/v1/groups", "").body()).get("groupId").asText();
                String jobId = MAPPER.readTree(post("/api/v1/jobs",
                                "{\"taskName\":\"noop\",\"submit\":false,\"groupId\":\"" + groupId + "\"}").body())
                                .get("jobId").asText();

                HttpResponse<String> canceled = post("/api/v1/groups/" + groupId + "/cancel", "");
                assertEquals(200, canceled.statusCode());
                assertEquals("CANCELED", MAPPER.readTree(canceled.body()).get("state").asText());
                assertEquals("CANCELED", MAPPER.readTree(get("/api/v1/jobs/" + jobId).body())
                                .get("status").asText());
        }

        @Test
        @DisplayName("Health and stats endpoints")
        void healthAndStats() throws Exception {
                HttpResponse<String> health = get("/api/v1/health");
                assertEquals(200, health.statusCode());
                JsonNode healthJson = MAPPER.readTree(health.body());
                assertEquals("healthy", healthJson.get("status").asText());
                assertEquals(2, healthJson.get("workers").asInt());
                assertEquals(0, healthJson.get("busyWorkers").asInt());

                String jobId = MAPPER.readTree(post("/api/v1/jobs", "{\"taskName\":\"noop\"}").body())
                                .get("jobId").asText();
                awaitJobStatus(jobId, "COMPLETED");

                JsonNode stats = MAPPER.readTree(get("/api/v1/stats").body());
                assertEquals(1, stats.get("submitted").asInt());
                assertEquals(1, stats.get("completed").asInt());
                assertTrue(stats.has("uptime"));
        }
}
