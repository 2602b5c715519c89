package io.rthub.transport.ws;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Connected client: identity, topic subscriptions and the bounded outbound frame queue
 * drained by its write pump.
 */
public final class ClientSession {

    // Identity-compared marker that tells the write pump to stop.
    private static final String END_OF_STREAM = new String("<end-of-stream>");

    private final String id;
    private final String userId;
    private final SessionConnection connection;
    private final BlockingQueue<String> outbound;
    private final int outboundCapacity;
    private final Set<String> subscriptions = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();
    private final Instant connectedAt;
    private volatile Instant lastActivity;

    public ClientSession(String id, String userId, SessionConnection connection, int queueCapacity, Instant now) {
        this.id = id;
        this.userId = userId;
        this.connection = connection;
        // one extra slot so the end marker always fits
        this.outbound = new ArrayBlockingQueue<>(queueCapacity + 1);
        this.outboundCapacity = queueCapacity;
        this.connectedAt = now;
        this.lastActivity = now;
    }

    public String id() {
        return id;
    }

    public String userId() {
        return userId;
    }

    SessionConnection connection() {
        return connection;
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    public void touch(Instant now) {
        lastActivity = now;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public long droppedFrames() {
        return dropped.get();
    }

    public int queuedFrames() {
        return outbound.size();
    }

    /**
     * Non-blocking enqueue.
     *
     * @return false if the session is closed or its queue is full; a full queue counts a drop
     */
    boolean offer(String frame) {
        if (closed.get()) {
            return false;
        }
        if (outbound.size() >= outboundCapacity || !outbound.offer(frame)) {
            dropped.incrementAndGet();
            return false;
        }
        return true;
    }

    /**
     * @return the next frame, null when nothing arrived within {@code timeout}
     */
    String poll(Duration timeout) throws InterruptedException {
        return outbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    static boolean isEndOfStream(String frame) {
        return frame == END_OF_STREAM;
    }

    /**
     * Closes the queue once: pending frames are discarded and the write pump is told to stop.
     */
    boolean closeOutbound() {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        outbound.clear();
        outbound.offer(END_OF_STREAM);
        return true;
    }

    void subscribe(Collection<String> topics) {
        subscriptions.addAll(topics);
    }

    void unsubscribe(Collection<String> topics) {
        subscriptions.removeAll(topics);
    }

    public boolean isSubscribed(String topic) {
        return subscriptions.contains(topic);
    }

    public Set<String> subscriptions() {
        return new TreeSet<>(subscriptions);
    }
}
