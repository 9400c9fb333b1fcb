package fr.lapetina.scheduler.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.scheduler.disruptor.SchedulerPipeline;
import fr.lapetina.scheduler.dlq.DeadLetterQueue;
import fr.lapetina.scheduler.domain.model.DepthSnapshot;
import fr.lapetina.scheduler.domain.model.DlqEntry;
import fr.lapetina.scheduler.domain.model.TenantTier;
import fr.lapetina.scheduler.governor.NoisyNeighborGovernor;
import fr.lapetina.scheduler.infrastructure.config.ReloadResult;
import fr.lapetina.scheduler.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.scheduler.worker.LocalWorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Operator HTTP server using JDK's built-in HttpServer. It never accepts scheduling work.
 *
 * Endpoints:
 * - GET /health - Replica status, 503 while stopped
 * - GET /metrics - Prometheus metrics endpoint, absent when metrics are disabled
 * - GET /admin/queue - Queue depth per tier, local buffer and DLQ size
 * - GET /admin/dlq?limit=N - Most recent dead-letter entries
 * - GET /admin/governor - Throttled tenants with their consumption ratio
 * - POST /admin/reload - Reload configuration (409 without a file, 422 when the file is invalid)
 */
public final class AdminHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdminHttpServer.class);

    static final int DEFAULT_DLQ_LIMIT = 100;
    static final int MAX_DLQ_LIMIT = 1000;

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final String replicaId;
    private final SchedulerPipeline pipeline;
    private final LocalWorkerPool workerPool;
    private final DeadLetterQueue deadLetterQueue;
    private final NoisyNeighborGovernor governor;
    private final MetricsRegistry metricsRegistry;
    private final Supplier<ReloadResult> reloader;

    public AdminHttpServer(
            int port,
            int backlog,
            int threads,
            String replicaId,
            SchedulerPipeline pipeline,
            LocalWorkerPool workerPool,
            DeadLetterQueue deadLetterQueue,
            NoisyNeighborGovernor governor,
            MetricsRegistry metricsRegistry,
            Supplier<ReloadResult> reloader
    ) throws IOException {
        this.replicaId = replicaId;
        this.pipeline = pipeline;
        this.workerPool = workerPool;
        this.deadLetterQueue = deadLetterQueue;
        this.governor = governor;
        this.metricsRegistry = metricsRegistry;
        this.reloader = reloader;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(port), backlog
        );

        this.executor = Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "admin-http");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/health", new HealthHandler());
        if (metricsRegistry != null) {
            server.createContext("/metrics", new MetricsHandler());
        }
        server.createContext("/admin", new AdminHandler());

        log.info("Admin HTTP server configured on port {}", port);
    }

    public void start() {
        server.start();
        log.info("Admin HTTP server started");
    }

    /**
     * Actual bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Admin HTTP server stopped");
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            boolean running = pipeline.isRunning();
            DepthSnapshot depths = pipeline.depthSnapshot();

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", running ? "UP" : "DOWN");
            health.put("replicaId", replicaId);
            health.put("timestamp", System.currentTimeMillis());
            health.put("workersBusy", workerPool.busySlots());
            health.put("workersTotal", workerPool.size());
            health.put("overloaded", pipeline.isOverloaded());
            health.put("queueSize", depths.globalTotal());
            health.put("ringBufferRemaining", pipeline.getRemainingCapacity());

            sendJson(exchange, running ? 200 : 503, health);
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
                if (path.equals("/admin/queue") && "GET".equals(method)) {
                    handleQueue(exchange);
                } else if (path.equals("/admin/dlq") && "GET".equals(method)) {
                    handleDlq(exchange);
                } else if (path.equals("/admin/governor") && "GET".equals(method)) {
                    handleGovernor(exchange);
                } else if (path.equals("/admin/reload") && "POST".equals(method)) {
                    handleReloadConfig(exchange);
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, e.getMessage());
            } catch (Exception e) {
                log.error("Error in admin handler: path={}", path, e);
                sendError(exchange, 500, e.getMessage());
            }
        }

        private void handleQueue(HttpExchange exchange) throws IOException {
            DepthSnapshot depths = pipeline.depthSnapshot();
            Map<String, Object> global = new LinkedHashMap<>();
            for (TenantTier tier : TenantTier.values()) {
                global.put(tier.name(), depths.global().getOrDefault(tier, 0));
            }

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("global", global);
            body.put("globalTotal", depths.globalTotal());
            body.put("local", depths.local());
            body.put("dlq", depths.dlq());
            sendJson(exchange, 200, body);
        }

        private void handleDlq(HttpExchange exchange) throws IOException {
            int limit = parseLimit(exchange.getRequestURI().getRawQuery());
            List<DlqEntry> entries = deadLetterQueue.recent(limit);

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("size", deadLetterQueue.size());
            body.put("totalRecorded", deadLetterQueue.totalRecorded());
            body.put("entries", entries);
            sendJson(exchange, 200, body);
        }

        private void handleGovernor(HttpExchange exchange) throws IOException {
            List<Map<String, Object>> throttled = new ArrayList<>();
            governor.throttledTenants().forEach((tenantId, ratio) -> {
                Map<String, Object> info = new LinkedHashMap<>();
                info.put("tenantId", tenantId);
                info.put("ratio", ratio);
                throttled.add(info);
            });
            sendJson(exchange, 200, Map.of(
                    "throttledCount", throttled.size(),
                    "throttled", throttled
            ));
        }

        private void handleReloadConfig(HttpExchange exchange) throws IOException {
            if (reloader == null) {
                sendError(exchange, 409, "Configuration was not loaded from a file");
                return;
            }
            ReloadResult result = reloader.get();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", result.status().name());
            body.put("changed", result.changed());
            body.put("redistribution", result.settings().redistribution().name());
            body.put("maxQueueSize", result.settings().maxQueueSize());
            body.put("maxQueueWaitMs", result.settings().maxQueueWait().toMillis());
            if (result.status() == ReloadResult.Status.REJECTED) {
                body.put("error", result.message());
                sendJson(exchange, 422, body);
                return;
            }
            sendJson(exchange, 200, body);
        }
    }

    static int parseLimit(String query) {
        if (query == null || query.isEmpty()) {
            return DEFAULT_DLQ_LIMIT;
        }
        for (String param : query.split("&")) {
            int eq = param.indexOf('=');
            if (eq > 0 && param.substring(0, eq).equals("limit")) {
                int limit;
                try {
                    limit = Integer.parseInt(param.substring(eq + 1));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid limit: " + param.substring(eq + 1));
                }
                if (limit < 1) {
                    throw new IllegalArgumentException("limit must be >= 1");
                }
                return Math.min(limit, MAX_DLQ_LIMIT);
            }
        }
        return DEFAULT_DLQ_LIMIT;
    }

    // ==================== HELPER METHODS ====================

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message != null ? message : "unknown");
        sendJson(exchange, statusCode, error);
    }
}
