package io.rthub.config;

import io.rthub.util.Env;

import java.time.Duration;

/**
 * Event pipeline settings.
 */
public record PipelineConfig(
        int maxRetryAttempts,
        Duration retryDelay,
        int workerThreads,
        int queueCapacity,
        Duration processingDelay,
        int maxBatchSize
) {
    public PipelineConfig {
        if (maxRetryAttempts <= 0 || workerThreads <= 0 || queueCapacity <= 0 || maxBatchSize <= 0) {
            throw new IllegalArgumentException("pipeline limits must be positive");
        }
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(3, Duration.ofSeconds(60), 4, 10_000, Duration.ofMillis(10), 100);
    }

    public static PipelineConfig fromEnv() {
        PipelineConfig d = defaults();
        int delayMs = Env.getInt("PROCESSING_DELAY_MS", (int) d.processingDelay().toMillis());
        return new PipelineConfig(
                Env.getPositiveInt("RETRY_MAX_ATTEMPTS", d.maxRetryAttempts()),
                Env.getSeconds("RETRY_DELAY_SEC", d.retryDelay()),
                Env.getPositiveInt("WORKER_THREADS", d.workerThreads()),
                Env.getPositiveInt("QUEUE_CAPACITY", d.queueCapacity()),
                Duration.ofMillis(Math.max(0, delayMs)),
                d.maxBatchSize());
    }
}
