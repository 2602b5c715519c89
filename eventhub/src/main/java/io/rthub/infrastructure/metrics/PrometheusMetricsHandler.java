package io.rthub.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Serves GET /metrics in the Prometheus text exposition format.
 * Repeated {@code name[]} query parameters restrict the output to those samples.
 *
 * Example output:
 * <pre>
 * # HELP rthub_ws_frames_total Broadcast frames per session by result
 * # TYPE rthub_ws_frames_total counter
 * rthub_ws_frames_total{result="queued",} 1234.0
 * rthub_ws_frames_total{result="dropped",} 3.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Set<String> names = requestedNames(exchange);
        StringWriter body = new StringWriter();
        try {
            TextFormat.write004(body, names.isEmpty()
                    ? registry.metricFamilySamples()
                    : registry.filteredMetricFamilySamples(names));
        } catch (IOException e) {
            log.error("[METRICS] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
            exchange.getResponseSender().send("error exporting metrics", StandardCharsets.UTF_8);
            return;
        }

        String scrape = body.toString();
        exchange.setStatusCode(200);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
        exchange.getResponseSender().send(scrape, StandardCharsets.UTF_8);
        log.debug("[METRICS] Scrape served {} bytes (filter={})", scrape.length(), names.isEmpty() ? "-" : names);
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get("name[]");
        Set<String> names = new HashSet<>();
        if (values != null) {
            for (String v : values) {
                if (v != null && !v.isBlank()) {
                    names.add(v.trim());
                }
            }
        }
        return names;
    }
}
