package io.rthub.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.rthub.config.HubConfig;
import io.rthub.config.PipelineConfig;
import io.rthub.infrastructure.metrics.HubMetrics;
import io.rthub.infrastructure.metrics.PrometheusMetricsHandler;
import io.rthub.migration.EventTableMigration;
import io.rthub.repository.EventRepository;
import io.rthub.repository.InMemoryEventRepository;
import io.rthub.repository.PostgresEventRepository;
import io.rthub.service.core.EventQueryService;
import io.rthub.service.core.EventService;
import io.rthub.service.processing.DelayingEventProcessor;
import io.rthub.service.processing.ProcessingQueue;
import io.rthub.transport.http.EventHandlers;
import io.rthub.transport.ws.WsHub;
import io.rthub.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Event hub server: HTTP API, WebSocket hub and processing workers in one process.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static final String USER_HEADER = "X-User-Id";

    public static void main(String[] args) {
        int port = Env.getInt("PORT", 8080);
        HubConfig hubConfig = HubConfig.fromEnv();
        PipelineConfig pipelineConfig = PipelineConfig.fromEnv();
        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Storage
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = null;
        EventRepository repo;
        String store = Env.get("STORE", "postgres");
        if ("memory".equalsIgnoreCase(store)) {
            log.warn("STORE=memory: events are not persisted across restarts");
            repo = new InMemoryEventRepository();
        } else {
            dataSource = createDataSource();
            new EventTableMigration(dataSource).migrate();
            repo = new PostgresEventRepository(dataSource);
        }

        // ═══════════════════════════════════════════════════════════════
        // Hub + pipeline
        // ═══════════════════════════════════════════════════════════════
        HubMetrics metrics = new HubMetrics();
        WsHub wsHub = new WsHub(hubConfig, metrics, clock);
        ProcessingQueue queue = new ProcessingQueue(pipelineConfig.queueCapacity(), pipelineConfig.workerThreads(), clock);
        EventService eventService = new EventService(repo, wsHub,
                new DelayingEventProcessor(pipelineConfig.processingDelay()), queue, pipelineConfig, metrics, clock);
        EventQueryService queryService = new EventQueryService(repo, clock);

        wsHub.start();
        eventService.start();

        EventHandlers api = new EventHandlers(eventService, queryService, wsHub);
        HttpHandler root = buildHandler(api, wsHub, new PrometheusMetricsHandler(metrics.getRegistry()));

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(root)
            .build();
        server.start();
        log.info("Event hub started on http://localhost:{}/ (ws://localhost:{}/rt/ws, store={})", port, port, store);

        HikariDataSource ds = dataSource;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            queue.shutdown(Duration.ofSeconds(5));
            wsHub.shutdown();
            if (ds != null) {
                ds.close();
            }
            log.info("Shutdown complete");
        }, "shutdown"));
    }

    /**
     * Full handler chain: CORS, then the WebSocket upgrade on /rt/ws, then the REST routes
     * on worker threads.
     */
    public static HttpHandler buildHandler(EventHandlers api, WsHub wsHub, HttpHandler metricsHandler) {
        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", api::health)
            // Publish
            .post("/events", api::publish)
            .post("/rt/events", api::publish)
            .post("/events/batch", api::publishBatch)
            // Read
            .get("/events", api::list)
            .get("/rt/events", api::list)
            .get("/events/failed", api::failed)
            .get("/events/history", api::history)
            .get("/events/types", api::types)
            .get("/events/sources", api::sources)
            .get("/events/{id}", api::get)
            // Pipeline
            .post("/events/process", api::processPending)
            .post("/events/{id}/retry", api::retry)
            .delete("/events/retries/{retryId}", api::cancelRetry)
            .put("/events/{id}/status", api::updateStatus)
            // Delete
            .delete("/events/batch", api::deleteBatch)
            .delete("/events/{id}", api::delete)
            // Search & stats
            .post("/search", api::search)
            .get("/stats/realtime", api::realtimeStats)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
                exchange.getResponseSender().send("{\"error\":\"not found\"}", StandardCharsets.UTF_8);
            });

        HttpHandler paths = Handlers.path()
            .addExactPath("/rt/ws", wsHub.websocketHandler(App::resolveUser))
            .addPrefixPath("/", new BlockingHandler(routes));

        // CORS Handler
        return exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, PUT, DELETE, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type, X-Source, X-User-Id")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                paths.handleRequest(exchange);
            }
        };
    }

    /**
     * User id for a WebSocket handshake: the X-User-Id header set upstream,
     * else a user_id query parameter.
     */
    static String resolveUser(WebSocketHttpExchange exchange) {
        String header = exchange.getRequestHeader(USER_HEADER);
        if (header != null && !header.isBlank()) {
            return header.trim();
        }
        Map<String, List<String>> params = exchange.getRequestParameters();
        List<String> values = params != null ? params.get("user_id") : null;
        if (values != null && !values.isEmpty() && values.get(0) != null && !values.get(0).isBlank()) {
            return values.get(0).trim();
        }
        return null;
    }

    private static HikariDataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/rthub");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("rthub-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }

    private App() {}
}
