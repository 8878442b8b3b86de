package fr.lapetina.dispatch.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.dispatch.actor.ActorPool;
import fr.lapetina.dispatch.actor.AdmissionQueue;
import fr.lapetina.dispatch.actor.DispatchManager;
import fr.lapetina.dispatch.actor.WorkflowSupervisor;
import fr.lapetina.dispatch.domain.strategy.StrategyFactory;
import fr.lapetina.dispatch.domain.strategy.WorkerSelectionStrategy;
import fr.lapetina.dispatch.infrastructure.config.ConfigLoader;
import fr.lapetina.dispatch.infrastructure.config.DispatchConfig;
import fr.lapetina.dispatch.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.dispatch.infrastructure.resilience.ResilienceGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Operator HTTP surface using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - GET /health - Admission, supervisor, quarantine and pool status
 * - GET /metrics - Prometheus metrics endpoint
 * - GET /admin/pool - Registered workers and selection strategy
 * - POST /admin/pool/workers - Register a worker
 * - POST /admin/pool/strategy - Change worker selection strategy
 * - POST /admin/reload - Reload configuration
 */
public final class AdminServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdminServer.class);

    private final HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final DispatchManager manager;
    private final ActorPool pool;
    private final MetricsRegistry metricsRegistry;
    private final ConfigLoader configLoader;

    public AdminServer(
            String host,
            int port,
            int backlog,
            DispatchManager manager,
            ActorPool pool,
            MetricsRegistry metricsRegistry,
            ConfigLoader configLoader
    ) throws IOException {
        this.manager = manager;
        this.pool = pool;
        this.metricsRegistry = metricsRegistry;
        this.configLoader = configLoader;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule());

        this.server = HttpServer.create(new InetSocketAddress(host, port), backlog);
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "admin-http");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("Admin server configured on {}:{}", host, port);
    }

    public void start() {
        server.start();
        log.info("Admin server started on port {}", getPort());
    }

    /**
     * Bound port; differs from the configured one when port 0 was requested.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        log.info("Admin server stopped");
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            AdmissionQueue admission = manager.getAdmission();
            WorkflowSupervisor supervisor = manager.getSupervisor();
            ResilienceGuard guard = manager.getResilienceGuard();

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", determineOverallHealth(supervisor, guard));
            health.put("timestamp", Instant.now());

            Map<String, Object> admissionStats = new LinkedHashMap<>();
            admissionStats.put("inFlight", admission.getInFlight());
            admissionStats.put("max", admission.getMax());
            health.put("admission", admissionStats);

            health.put("supervisor", supervisor.getState().name());

            Map<String, Object> resilience = new LinkedHashMap<>();
            resilience.put("enabled", guard != null);
            if (guard != null) {
                resilience.put("allowed", guard.isAllowed());
                resilience.put("quarantinedUntil", guard.getQuarantinedUntil());
                resilience.put("shed", guard.backpressureSignal().name().toLowerCase());
            }
            health.put("resilience", resilience);

            health.put("pool", poolInfo());

            int statusCode = "UP".equals(health.get("status")) ? 200 : 503;
            sendJson(exchange, statusCode, health);
        }

        private String determineOverallHealth(WorkflowSupervisor supervisor, ResilienceGuard guard) {
            if (supervisor.getState() != WorkflowSupervisor.State.RUNNING) {
                return "DOWN";
            }
            if (guard != null && !guard.isAllowed()) {
                return "QUARANTINED";
            }
            return "UP";
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                if (path.equals("/admin/pool") && "GET".equals(method)) {
                    sendJson(exchange, 200, poolInfo());
                } else if (path.equals("/admin/pool/workers") && "POST".equals(method)) {
                    handleRegisterWorker(exchange);
                } else if (path.equals("/admin/pool/strategy") && "POST".equals(method)) {
                    handleChangeStrategy(exchange);
                } else if (path.equals("/admin/reload") && "POST".equals(method)) {
                    handleReloadConfig(exchange);
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (JsonProcessingException e) {
                sendError(exchange, 400, "Malformed JSON body");
            } catch (Exception e) {
                log.error("Error in admin handler", e);
                sendError(exchange, 500, e.getMessage());
            }
        }

        private void handleRegisterWorker(HttpExchange exchange) throws IOException {
            Map<String, Object> request = readBody(exchange);
            Object id = request.get("id");
            if (!(id instanceof String workerId) || workerId.isBlank()) {
                sendError(exchange, 400, "Missing 'id' field");
                return;
            }

            pool.register(workerId);
            sendJson(exchange, 200, Map.of(
                    "worker", workerId,
                    "poolSize", pool.size()
            ));
        }

        private void handleChangeStrategy(HttpExchange exchange) throws IOException {
            Map<String, Object> request = readBody(exchange);
            Object name = request.get("strategy");
            if (!(name instanceof String strategyName) || strategyName.isBlank()) {
                sendError(exchange, 400, "Missing 'strategy' field");
                return;
            }

            Optional<WorkerSelectionStrategy> strategy = StrategyFactory.create(strategyName);
            if (strategy.isEmpty()) {
                sendError(exchange, 400, "Unknown strategy: " + strategyName +
                        ". Available: " + StrategyFactory.getRegisteredNames());
                return;
            }

            pool.setStrategy(strategy.get());
            sendJson(exchange, 200, Map.of(
                    "strategy", strategyName,
                    "message", "Strategy changed successfully"
            ));
        }

        private void handleReloadConfig(HttpExchange exchange) throws IOException {
            if (configLoader == null) {
                sendError(exchange, 503, "Configuration reload not available");
                return;
            }
            DispatchConfig newConfig = configLoader.reload();
            sendJson(exchange, 200, Map.of(
                    "message", "Configuration reloaded",
                    "admissionMax", newConfig.getDispatch().getAdmissionMax()
            ));
        }

        @SuppressWarnings("unchecked")
        private Map<String, Object> readBody(HttpExchange exchange) throws IOException {
            try (InputStream is = exchange.getRequestBody()) {
                Map<String, Object> body = objectMapper.readValue(is, Map.class);
                return body != null ? body : Map.of();
            }
        }
    }

    // ==================== HELPER METHODS ====================

    private Map<String, Object> poolInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("strategy", pool.getStrategy().getName());
        info.put("workers", pool.getWorkers());
        info.put("available", StrategyFactory.getRegisteredNames());
        return info;
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message != null ? message : "unknown error");
        sendJson(exchange, statusCode, error);
    }
}
