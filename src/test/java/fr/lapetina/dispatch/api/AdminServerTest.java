package fr.lapetina.dispatch.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.dispatch.actor.ActorPool;
import fr.lapetina.dispatch.actor.AdmissionQueue;
import fr.lapetina.dispatch.actor.DispatchManager;
import fr.lapetina.dispatch.actor.WorkflowSupervisor;
import fr.lapetina.dispatch.domain.model.SubmitOptions;
import fr.lapetina.dispatch.infrastructure.config.ConfigLoader;
import fr.lapetina.dispatch.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.dispatch.infrastructure.resilience.ResilienceGuard;
import fr.lapetina.dispatch.support.MutableClock;
import fr.lapetina.dispatch.support.StubProcessingEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AdminServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();

    @TempDir
    Path tempDir;

    private MetricsRegistry metrics;
    private WorkflowSupervisor supervisor;
    private DispatchManager manager;
    private ActorPool pool;
    private ConfigLoader configLoader;
    private AdminServer server;

    @BeforeEach
    void setUp() throws IOException {
        metrics = new MetricsRegistry("admin_test");
        supervisor = new WorkflowSupervisor(new StubProcessingEngine(), metrics, 10, Duration.ofSeconds(5));
        manager = new DispatchManager(new AdmissionQueue(8), supervisor, metrics, new SubmitOptions(1000, 1));
        pool = new ActorPool();
        pool.register("gpu-0");

        Path configFile = tempDir.resolve("config.yaml");
        Files.writeString(configFile, "dispatch:\n  admissionMax: 8\n");
        configLoader = new ConfigLoader(configFile.toString(), Map.of());
        configLoader.load();

        server = new AdminServer("127.0.0.1", 0, 8, manager, pool, metrics, configLoader);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
        configLoader.close();
        supervisor.close();
        metrics.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.getPort() + path);
    }

    @Nested
    @DisplayName("Health")
    class Health {

        @Test
        @DisplayName("should report UP with admission and pool details")
        void shouldReportUp() throws Exception {
            HttpResponse<String> response = get("/health");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = mapper.readTree(response.body());
            assertThat(body.get("status").asText()).isEqualTo("UP");
            assertThat(body.get("admission").get("max").asInt()).isEqualTo(8);
            assertThat(body.get("supervisor").asText()).isEqualTo("RUNNING");
            assertThat(body.get("resilience").get("enabled").asBoolean()).isFalse();
            assertThat(body.get("pool").get("workers").get(0).asText()).isEqualTo("gpu-0");
        }

        @Test
        @DisplayName("should report QUARANTINED with 503")
        void shouldReportQuarantine() throws Exception {
            ResilienceGuard guard = new ResilienceGuard("test", Duration.ofSeconds(10), 1, 1,
                    Duration.ofSeconds(30), new MutableClock());
            guard.recordFailure();
            manager.setResilienceGuard(guard);

            HttpResponse<String> response = get("/health");

            assertThat(response.statusCode()).isEqualTo(503);
            assertThat(mapper.readTree(response.body()).get("status").asText()).isEqualTo("QUARANTINED");
        }

        @Test
        @DisplayName("should report DOWN once the supervisor stopped")
        void shouldReportDown() throws Exception {
            supervisor.close();

            HttpResponse<String> response = get("/health");

            assertThat(response.statusCode()).isEqualTo(503);
            assertThat(mapper.readTree(response.body()).get("status").asText()).isEqualTo("DOWN");
        }

        @Test
        @DisplayName("should refuse other methods")
        void shouldRefusePost() throws Exception {
            assertThat(post("/health", "{}").statusCode()).isEqualTo(405);
        }
    }

    @Test
    @DisplayName("should expose Prometheus metrics")
    void shouldExposeMetrics() throws Exception {
        metrics.incrementListener("ok");

        HttpResponse<String> response = get("/metrics");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("admin_test_listener_total");
    }

    @Nested
    @DisplayName("Pool administration")
    class PoolAdministration {

        @Test
        @DisplayName("should register a worker")
        void shouldRegisterWorker() throws Exception {
            HttpResponse<String> response = post("/admin/pool/workers", "{\"id\":\"gpu-1\"}");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(mapper.readTree(response.body()).get("poolSize").asInt()).isEqualTo(2);
            assertThat(pool.getWorkers()).containsExactly("gpu-0", "gpu-1");
        }

        @Test
        @DisplayName("should reject a worker without id")
        void shouldRejectMissingId() throws Exception {
            assertThat(post("/admin/pool/workers", "{}").statusCode()).isEqualTo(400);
            assertThat(pool.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("should answer 400 for malformed JSON")
        void shouldRejectMalformedJson() throws Exception {
            assertThat(post("/admin/pool/workers", "{not json").statusCode()).isEqualTo(400);
        }

        @Test
        @DisplayName("should switch the selection strategy")
        void shouldSwitchStrategy() throws Exception {
            HttpResponse<String> response = post("/admin/pool/strategy", "{\"strategy\":\"random\"}");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(pool.getStrategy().getName()).isEqualTo("random");
            assertThat(mapper.readTree(get("/admin/pool").body()).get("strategy").asText()).isEqualTo("random");
        }

        @Test
        @DisplayName("should reject an unknown strategy")
        void shouldRejectUnknownStrategy() throws Exception {
            HttpResponse<String> response = post("/admin/pool/strategy", "{\"strategy\":\"fastest\"}");

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(pool.getStrategy().getName()).isEqualTo("round-robin");
        }

        @Test
        @DisplayName("should answer 404 for unknown admin paths")
        void shouldAnswerNotFound() throws Exception {
            assertThat(get("/admin/unknown").statusCode()).isEqualTo(404);
        }
    }

    @Test
    @DisplayName("should reload configuration on demand")
    void shouldReload() throws Exception {
        Files.writeString(tempDir.resolve("config.yaml"), "dispatch:\n  admissionMax: 32\n");

        HttpResponse<String> response = post("/admin/reload", "");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(response.body()).get("admissionMax").asInt()).isEqualTo(32);
        assertThat(configLoader.getCurrentConfig().getDispatch().getAdmissionMax()).isEqualTo(32);
    }
}
