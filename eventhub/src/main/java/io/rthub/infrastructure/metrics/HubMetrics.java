package io.rthub.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus metrics for the connection hub and the event pipeline.
 *
 * Key Metrics:
 * - rthub_events_published_total{source} - Events accepted by publish / batch publish
 * - rthub_events_processed_total{outcome} - Terminal processing results (processed, failed)
 * - rthub_retries_scheduled_total - Retries accepted by the retry operation
 * - rthub_tasks_rejected_total{kind} - Processing tasks refused by a full queue
 * - rthub_ws_frames_total{result} - Broadcast frames queued or dropped per session
 * - rthub_ws_sessions - Currently registered sessions
 * - rthub_processing_seconds - Processor latency
 */
public final class HubMetrics {

    private final CollectorRegistry registry;

    private final Counter published;
    private final Counter processed;
    private final Counter retries;
    private final Counter rejected;
    private final Counter frames;
    private final Gauge sessions;
    private final Histogram processingLatency;

    public HubMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public HubMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.published = Counter.build()
            .name("rthub_events_published_total")
            .help("Total number of events published")
            .labelNames("source")
            .register(registry);

        this.processed = Counter.build()
            .name("rthub_events_processed_total")
            .help("Total number of processing attempts by outcome")
            .labelNames("outcome")
            .register(registry);

        this.retries = Counter.build()
            .name("rthub_retries_scheduled_total")
            .help("Total number of retries scheduled")
            .register(registry);

        this.rejected = Counter.build()
            .name("rthub_tasks_rejected_total")
            .help("Processing tasks rejected because the queue was full")
            .labelNames("kind")
            .register(registry);

        this.frames = Counter.build()
            .name("rthub_ws_frames_total")
            .help("Broadcast frames per session by result")
            .labelNames("result")
            .register(registry);

        this.sessions = Gauge.build()
            .name("rthub_ws_sessions")
            .help("Currently registered WebSocket sessions")
            .register(registry);

        this.processingLatency = Histogram.build()
            .name("rthub_processing_seconds")
            .help("Event processor latency in seconds")
            .buckets(0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0)
            .register(registry);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    public void recordPublished(String source) {
        published.labels(source).inc();
    }

    public void recordProcessed(boolean success, Duration latency) {
        processed.labels(success ? "processed" : "failed").inc();
        processingLatency.observe(latency.toNanos() / 1_000_000_000.0);
    }

    public void recordRetryScheduled() {
        retries.inc();
    }

    public void recordRejected(String kind) {
        rejected.labels(kind).inc();
    }

    public void recordFramesQueued(int count) {
        if (count > 0) {
            frames.labels("queued").inc(count);
        }
    }

    public void recordFrameDropped() {
        frames.labels("dropped").inc();
    }

    public void setSessions(int count) {
        sessions.set(count);
    }
}
