package io.rthub.service.processing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Bounded delay queue drained by a fixed pool of worker threads.
 *
 * Immediate work is a task due now; a retry is a task due later. Submissions beyond
 * capacity are rejected rather than blocking the caller. Queued tasks can be cancelled
 * until a worker starts them.
 */
public final class ProcessingQueue {
    private static final Logger log = LoggerFactory.getLogger(ProcessingQueue.class);

    private final int capacity;
    private final int workerThreads;
    private final Clock clock;

    private final DelayQueue<ProcessingTask> queue = new DelayQueue<>();
    private final Map<String, ProcessingTask> pending = new ConcurrentHashMap<>();
    private final Object admission = new Object();
    private boolean stopped;                       // guarded by admission

    private final AtomicInteger workerSeq = new AtomicInteger();
    private volatile ExecutorService workers;

    public ProcessingQueue(int capacity, int workerThreads) {
        this(capacity, workerThreads, Clock.systemUTC());
    }

    public ProcessingQueue(int capacity, int workerThreads, Clock clock) {
        if (capacity <= 0 || workerThreads <= 0) {
            throw new IllegalArgumentException("capacity and workerThreads must be positive");
        }
        this.capacity = capacity;
        this.workerThreads = workerThreads;
        this.clock = clock;
    }

    /**
     * Starts the workers. Each due task is handed to {@code handler} on a worker thread.
     */
    public synchronized void start(Consumer<ProcessingTask> handler) {
        if (workers != null) {
            throw new IllegalStateException("processing queue already started");
        }
        ExecutorService pool = Executors.newFixedThreadPool(workerThreads, r -> {
            Thread t = new Thread(r, "event-worker-" + workerSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < workerThreads; i++) {
            pool.execute(() -> workerLoop(handler));
        }
        workers = pool;
        log.info("[PIPELINE] Processing queue started ({} workers, capacity {})", workerThreads, capacity);
    }

    private void workerLoop(Consumer<ProcessingTask> handler) {
        while (!Thread.currentThread().isInterrupted()) {
            ProcessingTask task;
            try {
                task = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (task.isPoison()) {
                return;
            }
            pending.remove(task.taskId());
            if (!task.tryStart()) {
                continue;
            }
            try {
                handler.accept(task);
            } catch (Throwable e) {
                // a worker outlives any single task
                log.error("[PIPELINE] Task {} failed: {}", task, e.getMessage(), e);
            }
        }
    }

    /**
     * Queues the event for immediate processing.
     *
     * @return the task, or empty if the queue is full or stopped
     */
    public Optional<ProcessingTask> submit(String eventId) {
        return schedule(eventId, clock.instant(), ProcessingTask.Kind.PROCESS);
    }

    public Optional<ProcessingTask> schedule(String eventId, Instant dueAt, ProcessingTask.Kind kind) {
        synchronized (admission) {
            if (stopped || queue.size() >= capacity) {
                log.warn("[PIPELINE] Rejected {} task for event {} (depth={}, stopped={})",
                        kind, eventId, queue.size(), stopped);
                return Optional.empty();
            }
            ProcessingTask task = ProcessingTask.of(eventId, kind, dueAt, clock);
            pending.put(task.taskId(), task);
            queue.put(task);
            return Optional.of(task);
        }
    }

    /**
     * Cancels a queued task of the given kind that no worker has started yet.
     *
     * @return the cancelled task, or empty if unknown, of another kind, already started or already cancelled
     */
    public Optional<ProcessingTask> cancel(String taskId, ProcessingTask.Kind kind) {
        ProcessingTask task = pending.get(taskId);
        if (task == null || task.kind() != kind || !task.tryCancel()) {
            return Optional.empty();
        }
        pending.remove(taskId);
        queue.remove(task);
        return Optional.of(task);
    }

    public int depth() {
        return queue.size();
    }

    /**
     * Stops accepting work, discards queued tasks and lets running tasks finish within {@code grace}.
     */
    public void shutdown(Duration grace) {
        int discarded;
        synchronized (admission) {
            stopped = true;
            discarded = queue.size();
            queue.clear();
            pending.clear();
            if (workers != null) {
                for (int i = 0; i < workerThreads; i++) {
                    queue.put(ProcessingTask.poisonPill(clock));
                }
            }
        }
        ExecutorService pool = workers;
        if (pool == null) {
            return;
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[PIPELINE] Workers still busy after {}, interrupting", grace);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[PIPELINE] Processing queue stopped ({} queued task(s) discarded)", discarded);
    }
}
